package com.lendingengine.engine;

import com.lendingengine.authorization.AuthorizationService;
import com.lendingengine.common.Addresses;
import com.lendingengine.common.LedgerLock;
import com.lendingengine.common.exception.HealthyPositionException;
import com.lendingengine.common.exception.InsufficientBalanceException;
import com.lendingengine.common.exception.InsufficientCollateralException;
import com.lendingengine.common.exception.InsufficientLiquidityException;
import com.lendingengine.common.exception.InvalidInputException;
import com.lendingengine.common.exception.MarketAlreadyExistsException;
import com.lendingengine.common.exception.TransferFailedException;
import com.lendingengine.common.exception.UnrepaidFlashLoanException;
import com.lendingengine.common.exception.UnsupportedLltvException;
import com.lendingengine.common.exception.UnsupportedRateModelException;
import com.lendingengine.config.EngineProperties;
import com.lendingengine.governance.GovernanceService;
import com.lendingengine.irm.RateModel;
import com.lendingengine.irm.RateModelRegistry;
import com.lendingengine.ledger.EventRecorder;
import com.lendingengine.ledger.EventType;
import com.lendingengine.ledger.LedgerEvent;
import com.lendingengine.market.Market;
import com.lendingengine.market.MarketParams;
import com.lendingengine.market.MarketStore;
import com.lendingengine.market.Position;
import com.lendingengine.math.MathLib;
import com.lendingengine.math.SharesMath;
import com.lendingengine.oracle.OracleRegistry;
import com.lendingengine.token.AssetTransfer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Clock;
import java.util.Optional;

/**
 * Isolated-market lending engine.
 *
 * Operation flow:
 * 1. Enter the call guard
 * 2. Accrue pending interest of the market
 * 3. Derive assets or shares with the rounding that favours the pool
 * 4. Update position and market totals
 * 5. Enforce liquidity and solvency
 * 6. Run the caller's callback, if any
 * 7. Move tokens
 *
 * Every operation runs in one transaction: any failure, including a failed token
 * transfer, rolls the whole operation back. Operations are serialized through the
 * {@link LedgerLock}, so concurrent requests never act on stale market state.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LendingEngine {

    private final MarketStore marketStore;
    private final InterestAccrual interestAccrual;
    private final GovernanceService governance;
    private final AuthorizationService authorizationService;
    private final RateModelRegistry rateModels;
    private final OracleRegistry oracles;
    private final AssetTransfer assetTransfer;
    private final EventRecorder eventRecorder;
    private final CallGuard callGuard;
    private final LedgerLock ledgerLock;
    private final EngineProperties properties;
    private final Clock clock;

    @Transactional
    public String createMarket(String caller, MarketParams params) {
        try (CallGuard.Token ignored = enter("createMarket")) {
            String sender = Addresses.normalize(caller);
            if (!governance.isIrmEnabled(params.getIrm()) || !rateModels.isRegistered(params.getIrm())) {
                throw new UnsupportedRateModelException(params.getIrm());
            }
            if (!governance.isLltvEnabled(params.getLltv())) {
                throw new UnsupportedLltvException(params.getLltv());
            }

            String id = params.id();
            if (marketStore.exists(id)) {
                throw new MarketAlreadyExistsException(id);
            }
            oracles.resolve(params.getOracle());

            Market market = marketStore.save(new Market(id, params, now()));

            eventRecorder.record(LedgerEvent.builder()
                .eventType(EventType.CREATE_MARKET)
                .marketId(id)
                .caller(sender)
                .description(params.toString()));

            // initializes the model's per-market state
            Optional<RateModel> model = rateModels.resolve(params.getIrm());
            model.ifPresent(m -> m.borrowRate(params, market));

            log.info("Created market {}: loan={}, collateral={}, oracle={}, irm={}, lltv={}",
                id, params.getLoanToken(), params.getCollateralToken(), params.getOracle(),
                params.getIrm(), params.getLltv());
            return id;
        }
    }

    @Transactional
    public AssetsShares supply(String caller, MarketParams params, BigInteger assets, BigInteger shares,
                               String onBehalf, LendingCallback callback, byte[] data) {
        try (CallGuard.Token ignored = enter("supply")) {
            String sender = Addresses.normalize(caller);
            Market market = marketStore.requireMarket(params.id());
            requireAmounts(assets, shares);
            String account = Addresses.requireNonZero(onBehalf, "onBehalf");

            interestAccrual.accrue(market);

            if (assets.signum() > 0) {
                shares = SharesMath.toSharesRoundingDown(assets, market.getTotalSupplyAssets(), market.getTotalSupplyShares());
            } else {
                assets = SharesMath.toAssetsRoundingUp(shares, market.getTotalSupplyAssets(), market.getTotalSupplyShares());
            }
            requireNonZeroDerived(assets, shares);

            Position position = marketStore.position(market.getMarketId(), account);
            position.setSupplyShares(position.getSupplyShares().add(shares));
            market.setTotalSupplyShares(market.getTotalSupplyShares().add(shares));
            market.setTotalSupplyAssets(market.getTotalSupplyAssets().add(assets));
            marketStore.save(position);
            marketStore.save(market);

            recordAmounts(EventType.SUPPLY, market, sender, account, null, assets, shares);
            log.info("Supply on market {}: {} assets / {} shares for {} by {}",
                market.getMarketId(), assets, shares, account, sender);

            BigInteger owed = assets;
            if (callback != null) {
                callGuard.runCallback(() -> callback.onSupply(owed, data));
            }
            assetTransfer.transferFrom(params.getLoanToken(), sender, engineAddress(), assets);

            return new AssetsShares(assets, shares);
        }
    }

    @Transactional
    public AssetsShares withdraw(String caller, MarketParams params, BigInteger assets, BigInteger shares,
                                 String onBehalf, String receiver) {
        try (CallGuard.Token ignored = enter("withdraw")) {
            String sender = Addresses.normalize(caller);
            Market market = marketStore.requireMarket(params.id());
            requireAmounts(assets, shares);
            String to = Addresses.requireNonZero(receiver, "receiver");
            String account = Addresses.normalize(onBehalf);
            authorizationService.requireSenderAuthorized(sender, account, "withdraw");

            interestAccrual.accrue(market);

            if (assets.signum() > 0) {
                shares = SharesMath.toSharesRoundingUp(assets, market.getTotalSupplyAssets(), market.getTotalSupplyShares());
            } else {
                assets = SharesMath.toAssetsRoundingDown(shares, market.getTotalSupplyAssets(), market.getTotalSupplyShares());
            }
            requireNonZeroDerived(assets, shares);

            Position position = marketStore.position(market.getMarketId(), account);
            if (position.getSupplyShares().compareTo(shares) < 0) {
                throw new InsufficientBalanceException("supply shares", account, shares, position.getSupplyShares());
            }
            position.setSupplyShares(position.getSupplyShares().subtract(shares));
            market.setTotalSupplyShares(market.getTotalSupplyShares().subtract(shares));
            market.setTotalSupplyAssets(market.getTotalSupplyAssets().subtract(assets));

            requireLiquidity(market);
            marketStore.save(position);
            marketStore.save(market);

            recordAmounts(EventType.WITHDRAW, market, sender, account, to, assets, shares);
            log.info("Withdraw on market {}: {} assets / {} shares from {} to {} by {}",
                market.getMarketId(), assets, shares, account, to, sender);

            assetTransfer.transfer(params.getLoanToken(), to, assets);

            return new AssetsShares(assets, shares);
        }
    }

    @Transactional
    public AssetsShares borrow(String caller, MarketParams params, BigInteger assets, BigInteger shares,
                               String onBehalf, String receiver) {
        try (CallGuard.Token ignored = enter("borrow")) {
            String sender = Addresses.normalize(caller);
            Market market = marketStore.requireMarket(params.id());
            requireAmounts(assets, shares);
            String to = Addresses.requireNonZero(receiver, "receiver");
            String account = Addresses.normalize(onBehalf);
            authorizationService.requireSenderAuthorized(sender, account, "borrow");

            interestAccrual.accrue(market);

            if (assets.signum() > 0) {
                shares = SharesMath.toSharesRoundingUp(assets, market.getTotalBorrowAssets(), market.getTotalBorrowShares());
            } else {
                assets = SharesMath.toAssetsRoundingDown(shares, market.getTotalBorrowAssets(), market.getTotalBorrowShares());
            }
            requireNonZeroDerived(assets, shares);

            Position position = marketStore.position(market.getMarketId(), account);
            position.setBorrowShares(position.getBorrowShares().add(shares));
            market.setTotalBorrowShares(market.getTotalBorrowShares().add(shares));
            market.setTotalBorrowAssets(market.getTotalBorrowAssets().add(assets));

            requireLiquidity(market);
            requireHealthy(market, position);
            marketStore.save(position);
            marketStore.save(market);

            recordAmounts(EventType.BORROW, market, sender, account, to, assets, shares);
            log.info("Borrow on market {}: {} assets / {} shares for {} to {} by {}",
                market.getMarketId(), assets, shares, account, to, sender);

            assetTransfer.transfer(params.getLoanToken(), to, assets);

            return new AssetsShares(assets, shares);
        }
    }

    @Transactional
    public AssetsShares repay(String caller, MarketParams params, BigInteger assets, BigInteger shares,
                              String onBehalf, LendingCallback callback, byte[] data) {
        try (CallGuard.Token ignored = enter("repay")) {
            String sender = Addresses.normalize(caller);
            Market market = marketStore.requireMarket(params.id());
            requireAmounts(assets, shares);
            String account = Addresses.requireNonZero(onBehalf, "onBehalf");

            interestAccrual.accrue(market);

            if (assets.signum() > 0) {
                shares = SharesMath.toSharesRoundingDown(assets, market.getTotalBorrowAssets(), market.getTotalBorrowShares());
            } else {
                assets = SharesMath.toAssetsRoundingUp(shares, market.getTotalBorrowAssets(), market.getTotalBorrowShares());
            }
            requireNonZeroDerived(assets, shares);

            Position position = marketStore.position(market.getMarketId(), account);
            if (position.getBorrowShares().compareTo(shares) < 0) {
                throw new InsufficientBalanceException("borrow shares", account, shares, position.getBorrowShares());
            }
            position.setBorrowShares(position.getBorrowShares().subtract(shares));
            market.setTotalBorrowShares(market.getTotalBorrowShares().subtract(shares));
            market.setTotalBorrowAssets(MathLib.zeroFloorSub(market.getTotalBorrowAssets(), assets));
            marketStore.save(position);
            marketStore.save(market);

            recordAmounts(EventType.REPAY, market, sender, account, null, assets, shares);
            log.info("Repay on market {}: {} assets / {} shares for {} by {}",
                market.getMarketId(), assets, shares, account, sender);

            BigInteger owed = assets;
            if (callback != null) {
                callGuard.runCallback(() -> callback.onRepay(owed, data));
            }
            assetTransfer.transferFrom(params.getLoanToken(), sender, engineAddress(), assets);

            return new AssetsShares(assets, shares);
        }
    }

    /**
     * Collateral does not earn interest, so no accrual is needed here.
     */
    @Transactional
    public void supplyCollateral(String caller, MarketParams params, BigInteger assets, String onBehalf,
                                 LendingCallback callback, byte[] data) {
        try (CallGuard.Token ignored = enter("supplyCollateral")) {
            String sender = Addresses.normalize(caller);
            Market market = marketStore.requireMarket(params.id());
            requirePositive(assets, "assets");
            String account = Addresses.requireNonZero(onBehalf, "onBehalf");

            Position position = marketStore.position(market.getMarketId(), account);
            position.setCollateral(position.getCollateral().add(assets));
            marketStore.save(position);

            recordAmounts(EventType.SUPPLY_COLLATERAL, market, sender, account, null, assets, null);
            log.info("Supply collateral on market {}: {} for {} by {}", market.getMarketId(), assets, account, sender);

            if (callback != null) {
                callGuard.runCallback(() -> callback.onSupplyCollateral(assets, data));
            }
            assetTransfer.transferFrom(params.getCollateralToken(), sender, engineAddress(), assets);
        }
    }

    @Transactional
    public void withdrawCollateral(String caller, MarketParams params, BigInteger assets, String onBehalf,
                                   String receiver) {
        try (CallGuard.Token ignored = enter("withdrawCollateral")) {
            String sender = Addresses.normalize(caller);
            Market market = marketStore.requireMarket(params.id());
            requirePositive(assets, "assets");
            String to = Addresses.requireNonZero(receiver, "receiver");
            String account = Addresses.normalize(onBehalf);
            authorizationService.requireSenderAuthorized(sender, account, "withdraw collateral");

            interestAccrual.accrue(market);

            Position position = marketStore.position(market.getMarketId(), account);
            if (position.getCollateral().compareTo(assets) < 0) {
                throw new InsufficientBalanceException("collateral", account, assets, position.getCollateral());
            }
            position.setCollateral(position.getCollateral().subtract(assets));

            requireHealthy(market, position);
            marketStore.save(position);

            recordAmounts(EventType.WITHDRAW_COLLATERAL, market, sender, account, to, assets, null);
            log.info("Withdraw collateral on market {}: {} from {} to {} by {}",
                market.getMarketId(), assets, account, to, sender);

            assetTransfer.transfer(params.getCollateralToken(), to, assets);
        }
    }

    /**
     * Liquidate an unhealthy position.
     *
     * Exactly one of {@code seizedAssets} (collateral to take) or {@code repaidShares}
     * (debt to cover) drives; the other is derived through the oracle price and the
     * liquidation incentive factor. If the borrower is left without collateral, the
     * remaining debt is written off against suppliers.
     */
    @Transactional
    public LiquidationResult liquidate(String caller, MarketParams params, String borrower,
                                       BigInteger seizedAssets, BigInteger repaidShares,
                                       LendingCallback callback, byte[] data) {
        try (CallGuard.Token ignored = enter("liquidate")) {
            String sender = Addresses.normalize(caller);
            Market market = marketStore.requireMarket(params.id());
            requireAmounts(seizedAssets, repaidShares);
            String account = Addresses.normalize(borrower);

            interestAccrual.accrue(market);

            BigInteger price = oracles.price(params.getOracle());
            Position position = marketStore.position(market.getMarketId(), account);
            if (HealthCheck.isHealthy(position.getBorrowShares(), position.getCollateral(),
                    market.getTotalBorrowAssets(), market.getTotalBorrowShares(), params.getLltv(), price)) {
                log.warn("Rejected liquidation of healthy position {} on market {}", account, market.getMarketId());
                throw new HealthyPositionException(market.getMarketId(), account);
            }

            BigInteger incentiveFactor = HealthCheck.liquidationIncentiveFactor(params.getLltv());
            if (seizedAssets.signum() > 0) {
                BigInteger seizedAssetsQuoted = MathLib.mulDivUp(seizedAssets, price, EngineConstants.ORACLE_PRICE_SCALE);
                repaidShares = SharesMath.toSharesRoundingUp(MathLib.wDivUp(seizedAssetsQuoted, incentiveFactor),
                    market.getTotalBorrowAssets(), market.getTotalBorrowShares());
            } else {
                BigInteger repaidQuoted = SharesMath.toAssetsRoundingDown(repaidShares,
                    market.getTotalBorrowAssets(), market.getTotalBorrowShares());
                seizedAssets = MathLib.mulDivDown(MathLib.wMulDown(repaidQuoted, incentiveFactor),
                    EngineConstants.ORACLE_PRICE_SCALE, price);
            }
            BigInteger repaidAssets = SharesMath.toAssetsRoundingUp(repaidShares,
                market.getTotalBorrowAssets(), market.getTotalBorrowShares());

            if (position.getBorrowShares().compareTo(repaidShares) < 0) {
                throw new InsufficientBalanceException("borrow shares", account, repaidShares, position.getBorrowShares());
            }
            if (position.getCollateral().compareTo(seizedAssets) < 0) {
                throw new InsufficientBalanceException("collateral", account, seizedAssets, position.getCollateral());
            }

            position.setBorrowShares(position.getBorrowShares().subtract(repaidShares));
            market.setTotalBorrowShares(market.getTotalBorrowShares().subtract(repaidShares));
            market.setTotalBorrowAssets(MathLib.zeroFloorSub(market.getTotalBorrowAssets(), repaidAssets));
            position.setCollateral(position.getCollateral().subtract(seizedAssets));

            BigInteger badDebtShares = BigInteger.ZERO;
            BigInteger badDebtAssets = BigInteger.ZERO;
            if (position.getCollateral().signum() == 0 && position.getBorrowShares().signum() > 0) {
                badDebtShares = position.getBorrowShares();
                badDebtAssets = market.getTotalBorrowAssets().min(SharesMath.toAssetsRoundingUp(badDebtShares,
                    market.getTotalBorrowAssets(), market.getTotalBorrowShares()));

                market.setTotalBorrowAssets(market.getTotalBorrowAssets().subtract(badDebtAssets));
                market.setTotalSupplyAssets(market.getTotalSupplyAssets().subtract(badDebtAssets));
                market.setTotalBorrowShares(market.getTotalBorrowShares().subtract(badDebtShares));
                position.setBorrowShares(BigInteger.ZERO);

                log.warn("Bad debt of {} assets ({} shares) written off on market {} for {}",
                    badDebtAssets, badDebtShares, market.getMarketId(), account);
            }
            marketStore.save(position);
            marketStore.save(market);

            eventRecorder.record(LedgerEvent.builder()
                .eventType(EventType.LIQUIDATE)
                .marketId(market.getMarketId())
                .caller(sender)
                .onBehalf(account)
                .assets(repaidAssets)
                .shares(repaidShares)
                .secondaryAssets(badDebtAssets)
                .secondaryShares(badDebtShares)
                .description("seized=" + seizedAssets));
            log.info("Liquidated {} on market {}: seized {} collateral, repaid {} assets / {} shares, by {}",
                account, market.getMarketId(), seizedAssets, repaidAssets, repaidShares, sender);

            assetTransfer.transfer(params.getCollateralToken(), sender, seizedAssets);
            if (callback != null) {
                callGuard.runCallback(() -> callback.onLiquidate(repaidAssets, data));
            }
            assetTransfer.transferFrom(params.getLoanToken(), sender, engineAddress(), repaidAssets);

            return new LiquidationResult(seizedAssets, repaidAssets, repaidShares, badDebtAssets, badDebtShares);
        }
    }

    /**
     * Lend any token held by the engine for the duration of the callback. No fee is charged.
     */
    @Transactional
    public void flashLoan(String caller, String token, BigInteger assets, LendingCallback callback, byte[] data) {
        try (CallGuard.Token ignored = enter("flashLoan")) {
            String sender = Addresses.normalize(caller);
            String tokenAddress = Addresses.requireNonZero(token, "token");
            requirePositive(assets, "assets");

            eventRecorder.record(LedgerEvent.builder()
                .eventType(EventType.FLASH_LOAN)
                .caller(sender)
                .subject(tokenAddress)
                .assets(assets));

            assetTransfer.transfer(tokenAddress, sender, assets);
            if (callback != null) {
                callGuard.runCallback(() -> callback.onFlashLoan(assets, data));
            }
            try {
                assetTransfer.transferFrom(tokenAddress, sender, engineAddress(), assets);
            } catch (TransferFailedException e) {
                log.warn("Flash loan of {} {} to {} not repaid", assets, tokenAddress, sender);
                throw new UnrepaidFlashLoanException(tokenAddress, assets, e);
            }

            log.info("Flash loan of {} {} to {}", assets, tokenAddress, sender);
        }
    }

    @Transactional
    public void accrueInterest(String caller, MarketParams params) {
        try (CallGuard.Token ignored = enter("accrueInterest")) {
            Market market = marketStore.requireMarket(params.id());
            interestAccrual.accrue(market);
            log.debug("Interest accrued on market {} by {}", market.getMarketId(), Addresses.normalize(caller));
        }
    }

    /**
     * Owner only. Pending interest is accrued at the old fee first.
     */
    @Transactional
    public void setFee(String caller, MarketParams params, BigInteger newFee) {
        try (CallGuard.Token ignored = enter("setFee")) {
            String sender = Addresses.normalize(caller);
            governance.requireOwner(sender, "set fee");
            Market market = marketStore.requireMarket(params.id());
            if (newFee.signum() < 0) {
                throw InvalidInputException.negativeAmount("fee", newFee);
            }
            if (newFee.equals(market.getFee())) {
                throw InvalidInputException.alreadySet("fee");
            }
            if (newFee.compareTo(EngineConstants.MAX_FEE) > 0) {
                throw InvalidInputException.feeTooHigh(newFee, EngineConstants.MAX_FEE);
            }

            interestAccrual.accrue(market);

            market.setFee(newFee);
            marketStore.save(market);

            eventRecorder.record(LedgerEvent.builder()
                .eventType(EventType.SET_FEE)
                .marketId(market.getMarketId())
                .caller(sender)
                .assets(newFee));
            log.info("Fee of market {} set to {}", market.getMarketId(), newFee);
        }
    }

    /**
     * Ledger lock first, then the reentrancy guard. The lock outlives the guard: it is
     * released when the transaction completes.
     */
    private CallGuard.Token enter(String operation) {
        ledgerLock.acquire();
        return callGuard.enter(operation);
    }

    private void requireLiquidity(Market market) {
        if (!market.isLiquid()) {
            throw new InsufficientLiquidityException(market.getMarketId(),
                market.getTotalBorrowAssets(), market.getTotalSupplyAssets());
        }
    }

    /**
     * The oracle is only consulted when the position has debt.
     */
    private void requireHealthy(Market market, Position position) {
        if (position.getBorrowShares().signum() == 0) {
            return;
        }
        BigInteger price = oracles.price(market.getParams().getOracle());
        if (!HealthCheck.isHealthy(position.getBorrowShares(), position.getCollateral(),
                market.getTotalBorrowAssets(), market.getTotalBorrowShares(), market.getParams().getLltv(), price)) {
            log.warn("Rejected operation leaving {} undercollateralized on market {}",
                position.getAccount(), market.getMarketId());
            throw new InsufficientCollateralException(market.getMarketId(), position.getAccount());
        }
    }

    private void recordAmounts(EventType type, Market market, String caller, String onBehalf, String receiver,
                               BigInteger assets, BigInteger shares) {
        eventRecorder.record(LedgerEvent.builder()
            .eventType(type)
            .marketId(market.getMarketId())
            .caller(caller)
            .onBehalf(onBehalf)
            .receiver(receiver)
            .assets(assets)
            .shares(shares));
    }

    private static void requireAmounts(BigInteger assets, BigInteger shares) {
        if (assets == null || shares == null) {
            throw InvalidInputException.inconsistentInput();
        }
        if (assets.signum() < 0) {
            throw InvalidInputException.negativeAmount("assets", assets);
        }
        if (shares.signum() < 0) {
            throw InvalidInputException.negativeAmount("shares", shares);
        }
        if (!MathLib.exactlyOneZero(assets, shares)) {
            throw InvalidInputException.inconsistentInput();
        }
    }

    private static void requireNonZeroDerived(BigInteger assets, BigInteger shares) {
        if (assets.signum() == 0) {
            throw InvalidInputException.zeroAmount("assets");
        }
        if (shares.signum() == 0) {
            throw InvalidInputException.zeroAmount("shares");
        }
    }

    private static void requirePositive(BigInteger amount, String field) {
        if (amount == null || amount.signum() == 0) {
            throw InvalidInputException.zeroAmount(field);
        }
        if (amount.signum() < 0) {
            throw InvalidInputException.negativeAmount(field, amount);
        }
    }

    private String engineAddress() {
        return Addresses.normalize(properties.getAddress());
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}
