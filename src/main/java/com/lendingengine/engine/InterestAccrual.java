package com.lendingengine.engine;

import com.lendingengine.governance.GovernanceService;
import com.lendingengine.irm.AdaptiveCurve;
import com.lendingengine.irm.RateModel;
import com.lendingengine.irm.RateModelRegistry;
import com.lendingengine.ledger.EventRecorder;
import com.lendingengine.ledger.EventType;
import com.lendingengine.ledger.LedgerEvent;
import com.lendingengine.market.Market;
import com.lendingengine.market.MarketStore;
import com.lendingengine.market.Position;
import com.lendingengine.math.MathLib;
import com.lendingengine.math.SharesMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Clock;
import java.util.Optional;

/**
 * Lazy interest accrual, run at the start of every operation touching a market.
 *
 * Interest is linear over the elapsed time: borrow * rate * elapsed, rounded down.
 * It is added to both the borrow and the supply side, and the fee portion is minted
 * as supply shares to the fee recipient at the pre-mint exchange rate.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InterestAccrual {

    private final RateModelRegistry rateModels;
    private final MarketStore marketStore;
    private final GovernanceService governance;
    private final EventRecorder eventRecorder;
    private final Clock clock;

    public void accrue(Market market) {
        long now = clock.instant().getEpochSecond();
        long elapsed = now - market.getLastUpdate();
        if (elapsed <= 0) {
            return;
        }

        Optional<RateModel> model = rateModels.resolve(market.getParams().getIrm());
        if (model.isPresent()) {
            // polled even without borrows so the model's own state follows time
            BigInteger rate = model.get().borrowRate(market.getParams(), market);
            if (market.getTotalBorrowAssets().signum() > 0) {
                applyInterest(market, rate, elapsed);
            }
        }

        market.setLastUpdate(now);
        marketStore.save(market);
    }

    /**
     * Totals the market would have if interest were accrued now, without touching any state.
     */
    public ExpectedBalances preview(Market market) {
        long elapsed = clock.instant().getEpochSecond() - market.getLastUpdate();
        Optional<RateModel> model = rateModels.resolve(market.getParams().getIrm());
        if (elapsed <= 0 || model.isEmpty() || market.getTotalBorrowAssets().signum() == 0) {
            return new ExpectedBalances(market.getTotalSupplyAssets(), market.getTotalSupplyShares(),
                market.getTotalBorrowAssets(), market.getTotalBorrowShares());
        }

        BigInteger utilization = AdaptiveCurve.utilization(market.getTotalBorrowAssets(), market.getTotalSupplyAssets());
        BigInteger rate = model.get().borrowRateView(market.getMarketId(), utilization);
        BigInteger interest = interest(market.getTotalBorrowAssets(), rate, elapsed);
        BigInteger supplyAssets = market.getTotalSupplyAssets().add(interest);
        BigInteger feeShares = feeShares(interest, market.getFee(), supplyAssets, market.getTotalSupplyShares());

        return new ExpectedBalances(supplyAssets, market.getTotalSupplyShares().add(feeShares),
            market.getTotalBorrowAssets().add(interest), market.getTotalBorrowShares());
    }

    private void applyInterest(Market market, BigInteger rate, long elapsed) {
        BigInteger interest = interest(market.getTotalBorrowAssets(), rate, elapsed);
        market.setTotalBorrowAssets(market.getTotalBorrowAssets().add(interest));
        market.setTotalSupplyAssets(market.getTotalSupplyAssets().add(interest));

        BigInteger feeShares = feeShares(interest, market.getFee(),
            market.getTotalSupplyAssets(), market.getTotalSupplyShares());
        if (feeShares.signum() > 0) {
            String feeRecipient = governance.feeRecipient();
            Position position = marketStore.position(market.getMarketId(), feeRecipient);
            position.setSupplyShares(position.getSupplyShares().add(feeShares));
            market.setTotalSupplyShares(market.getTotalSupplyShares().add(feeShares));
            marketStore.save(position);
        }

        eventRecorder.record(LedgerEvent.builder()
            .eventType(EventType.ACCRUE_INTEREST)
            .marketId(market.getMarketId())
            .assets(interest)
            .shares(feeShares)
            .description("borrowRate=" + rate));

        log.debug("Accrued interest on market {}: elapsed={}s, rate={}, interest={}, feeShares={}",
            market.getMarketId(), elapsed, rate, interest, feeShares);
    }

    static BigInteger interest(BigInteger totalBorrowAssets, BigInteger rate, long elapsed) {
        return MathLib.wMulDown(totalBorrowAssets, rate.multiply(BigInteger.valueOf(elapsed)));
    }

    /**
     * Fee shares for the interest, valued against supply assets that already include the
     * interest but not the fee itself.
     */
    static BigInteger feeShares(BigInteger interest, BigInteger fee, BigInteger totalSupplyAssets,
                                BigInteger totalSupplyShares) {
        if (fee.signum() == 0) {
            return BigInteger.ZERO;
        }
        BigInteger feeAmount = MathLib.wMulDown(interest, fee);
        return SharesMath.toSharesRoundingDown(feeAmount, totalSupplyAssets.subtract(feeAmount), totalSupplyShares);
    }
}
