package com.lendingengine.market;

import com.lendingengine.common.exception.UnknownMarketException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Keyed store for market and position records.
 *
 * Positions are created on first touch and persisted immediately, so nested
 * operations within the same transaction see the same managed instance.
 */
@Component
@RequiredArgsConstructor
public class MarketStore {

    private final MarketRepository marketRepository;
    private final PositionRepository positionRepository;

    public boolean exists(String marketId) {
        return marketRepository.existsById(marketId);
    }

    public Market requireMarket(String marketId) {
        return marketRepository.findById(marketId)
            .orElseThrow(() -> new UnknownMarketException(marketId));
    }

    public Market save(Market market) {
        return marketRepository.save(market);
    }

    public Position position(String marketId, String account) {
        return positionRepository.findById(Position.key(marketId, account))
            .orElseGet(() -> positionRepository.save(new Position(marketId, account)));
    }

    public Optional<Position> findPosition(String marketId, String account) {
        return positionRepository.findById(Position.key(marketId, account));
    }

    public Position save(Position position) {
        return positionRepository.save(position);
    }

    public List<Position> positions(String marketId) {
        return positionRepository.findByMarketId(marketId);
    }

    public List<Position> positionsOf(String account) {
        return positionRepository.findByAccount(account);
    }
}
