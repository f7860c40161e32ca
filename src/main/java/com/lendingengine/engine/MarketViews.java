package com.lendingengine.engine;

import com.lendingengine.common.Addresses;
import com.lendingengine.irm.AdaptiveCurve;
import com.lendingengine.irm.RateModelRegistry;
import com.lendingengine.market.Market;
import com.lendingengine.market.MarketId;
import com.lendingengine.market.MarketParams;
import com.lendingengine.market.MarketStore;
import com.lendingengine.market.Position;
import com.lendingengine.math.SharesMath;
import com.lendingengine.oracle.OracleRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.util.List;

/**
 * Read-only views over markets and positions. Nothing here mutates state; expected
 * balances simulate pending interest with the rate model's view function.
 */
@Service
@RequiredArgsConstructor
public class MarketViews {

    private final MarketStore marketStore;
    private final InterestAccrual interestAccrual;
    private final RateModelRegistry rateModels;
    private final OracleRegistry oracles;

    @Transactional(readOnly = true)
    public Market market(String marketId) {
        return marketStore.requireMarket(MarketId.normalize(marketId));
    }

    @Transactional(readOnly = true)
    public MarketParams idToMarketParams(String marketId) {
        return market(marketId).getParams();
    }

    /**
     * Position of an account; an all-zero position if it never interacted with the market.
     */
    @Transactional(readOnly = true)
    public Position position(String marketId, String account) {
        String id = MarketId.normalize(marketId);
        String holder = Addresses.normalize(account);
        return marketStore.findPosition(id, holder).orElseGet(() -> new Position(id, holder));
    }

    @Transactional(readOnly = true)
    public List<Position> positions(String marketId) {
        return marketStore.positions(MarketId.normalize(marketId));
    }

    /**
     * Positions of an account across all markets.
     */
    @Transactional(readOnly = true)
    public List<Position> positionsOf(String account) {
        return marketStore.positionsOf(Addresses.normalize(account));
    }

    @Transactional(readOnly = true)
    public ExpectedBalances expectedMarketBalances(String marketId) {
        return interestAccrual.preview(market(marketId));
    }

    @Transactional(readOnly = true)
    public BigInteger expectedSupplyAssets(String marketId, String account) {
        ExpectedBalances balances = expectedMarketBalances(marketId);
        return SharesMath.toAssetsRoundingDown(position(marketId, account).getSupplyShares(),
            balances.getTotalSupplyAssets(), balances.getTotalSupplyShares());
    }

    @Transactional(readOnly = true)
    public BigInteger expectedBorrowAssets(String marketId, String account) {
        ExpectedBalances balances = expectedMarketBalances(marketId);
        return SharesMath.toAssetsRoundingUp(position(marketId, account).getBorrowShares(),
            balances.getTotalBorrowAssets(), balances.getTotalBorrowShares());
    }

    /**
     * Current borrow rate per second as the rate model would quote it now; zero for interest-free markets.
     */
    @Transactional(readOnly = true)
    public BigInteger borrowRate(String marketId) {
        Market market = market(marketId);
        BigInteger utilization = AdaptiveCurve.utilization(market.getTotalBorrowAssets(), market.getTotalSupplyAssets());
        return rateModels.resolve(market.getParams().getIrm())
            .map(model -> model.borrowRateView(market.getMarketId(), utilization))
            .orElse(BigInteger.ZERO);
    }

    /**
     * Health of a position against expected balances and the current oracle price.
     */
    @Transactional(readOnly = true)
    public boolean isHealthy(String marketId, String account) {
        Market market = market(marketId);
        Position position = position(marketId, account);
        if (position.getBorrowShares().signum() == 0) {
            return true;
        }
        ExpectedBalances balances = interestAccrual.preview(market);
        BigInteger price = oracles.price(market.getParams().getOracle());
        return HealthCheck.isHealthy(position.getBorrowShares(), position.getCollateral(),
            balances.getTotalBorrowAssets(), balances.getTotalBorrowShares(), market.getParams().getLltv(), price);
    }

    @Transactional(readOnly = true)
    public BigInteger liquidationIncentiveFactor(String marketId) {
        return HealthCheck.liquidationIncentiveFactor(idToMarketParams(marketId).getLltv());
    }
}
