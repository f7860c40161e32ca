package com.lendingengine.irm;

import com.lendingengine.common.Addresses;
import com.lendingengine.config.EngineProperties;
import com.lendingengine.market.Market;
import com.lendingengine.market.MarketParams;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Clock;
import java.util.Optional;

/**
 * Adaptive curve rate model.
 *
 * Each market starts at {@link AdaptiveCurve#INITIAL_RATE_AT_TARGET}. On every query the
 * rate at target is moved by the utilization error times the adjustment speed times the
 * time since the previous query, the new value is stored, and the curve rate at the
 * current utilization is returned.
 */
@Component
@Slf4j
public class AdaptiveCurveRateModel implements RateModel {

    private final String address;
    private final RateAtTargetStateRepository stateRepository;
    private final Clock clock;

    public AdaptiveCurveRateModel(EngineProperties properties, RateAtTargetStateRepository stateRepository,
                                  Clock clock) {
        this.address = Addresses.requireNonZero(properties.getAdaptiveCurve().getAddress(), "adaptive curve irm");
        this.stateRepository = stateRepository;
        this.clock = clock;
    }

    @Override
    public String getAddress() {
        return address;
    }

    @Override
    @Transactional
    public BigInteger borrowRate(MarketParams params, Market market) {
        long now = clock.instant().getEpochSecond();
        BigInteger utilization = AdaptiveCurve.utilization(
            market.getTotalBorrowAssets(), market.getTotalSupplyAssets());
        BigInteger err = AdaptiveCurve.error(utilization);

        Optional<RateAtTargetState> existing = stateRepository.findById(market.getMarketId());
        BigInteger rateAtTarget = existing
            .map(state -> AdaptiveCurve.adapt(state.getRateAtTarget(), err, Math.max(0, now - state.getLastUpdate())))
            .orElse(AdaptiveCurve.INITIAL_RATE_AT_TARGET);

        RateAtTargetState state = existing.orElseGet(() -> new RateAtTargetState(market.getMarketId(), rateAtTarget, now));
        state.setRateAtTarget(rateAtTarget);
        state.setLastUpdate(now);
        stateRepository.save(state);

        BigInteger rate = AdaptiveCurve.curve(rateAtTarget, err);
        log.debug("Borrow rate for market {}: utilization={}, rateAtTarget={}, rate={}",
            market.getMarketId(), utilization, rateAtTarget, rate);
        return rate;
    }

    @Override
    @Transactional(readOnly = true)
    public BigInteger borrowRateView(String marketId, BigInteger utilization) {
        long now = clock.instant().getEpochSecond();
        BigInteger err = AdaptiveCurve.error(utilization);
        BigInteger rateAtTarget = stateRepository.findById(marketId)
            .map(state -> AdaptiveCurve.adapt(state.getRateAtTarget(), err, Math.max(0, now - state.getLastUpdate())))
            .orElse(AdaptiveCurve.INITIAL_RATE_AT_TARGET);
        return AdaptiveCurve.curve(rateAtTarget, err);
    }

    @Transactional(readOnly = true)
    public Optional<BigInteger> rateAtTarget(String marketId) {
        return stateRepository.findById(marketId).map(RateAtTargetState::getRateAtTarget);
    }
}
