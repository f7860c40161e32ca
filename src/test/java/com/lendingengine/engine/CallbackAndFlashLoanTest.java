package com.lendingengine.engine;

import com.lendingengine.common.exception.ErrorCode;
import com.lendingengine.common.exception.InvalidInputException;
import com.lendingengine.common.exception.ReentrantCallException;
import com.lendingengine.common.exception.TransferFailedException;
import com.lendingengine.common.exception.UnrepaidFlashLoanException;
import com.lendingengine.ledger.EventRecorder;
import com.lendingengine.ledger.EventType;
import com.lendingengine.market.Market;
import com.lendingengine.market.MarketParams;
import com.lendingengine.support.MarketFixture;
import com.lendingengine.support.MarketFixture.TestMarket;
import com.lendingengine.token.TokenLedgerService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigInteger;
import java.util.concurrent.atomic.AtomicReference;

import static com.lendingengine.support.MarketFixture.randomAddress;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for caller callbacks, flash loans and reentrancy protection.
 */
@SpringBootTest
@ActiveProfiles("test")
class CallbackAndFlashLoanTest {

    private static final BigInteger ZERO = BigInteger.ZERO;

    @Autowired
    private LendingEngine lendingEngine;

    @Autowired
    private MarketViews marketViews;

    @Autowired
    private EventRecorder eventRecorder;

    @Autowired
    private TokenLedgerService tokenLedger;

    @Autowired
    private MarketFixture fixture;

    private TestMarket market;
    private MarketParams params;

    @BeforeEach
    void setUp() {
        market = fixture.createDefaultMarket();
        params = market.params();
        String supplier = fixture.fundedAccount(market.loanToken(), 20_000);
        lendingEngine.supply(supplier, params, BigInteger.valueOf(20_000), ZERO, supplier, null, new byte[0]);
    }

    @Test
    void testSupplyCallbackCanSourceTokens() {
        String supplier = randomAddress();
        AtomicReference<BigInteger> owed = new AtomicReference<>();

        lendingEngine.supply(supplier, params, BigInteger.valueOf(300), ZERO, supplier, new LendingCallback() {
            @Override
            public void onSupply(BigInteger assets, byte[] data) {
                owed.set(assets);
                tokenLedger.mint(market.loanToken(), supplier, assets);
            }
        }, "data".getBytes());

        assertEquals(BigInteger.valueOf(300), owed.get());
        assertEquals(ZERO, fixture.balance(market.loanToken(), supplier));
        assertEquals(BigInteger.valueOf(20_300), marketViews.market(market.id()).getTotalSupplyAssets());
    }

    @Test
    void testCallbackDataIsPassedThrough() {
        String supplier = fixture.fundedAccount(market.loanToken(), 10);
        byte[] payload = {1, 2, 3};
        AtomicReference<byte[]> received = new AtomicReference<>();

        lendingEngine.supply(supplier, params, BigInteger.TEN, ZERO, supplier, new LendingCallback() {
            @Override
            public void onSupply(BigInteger assets, byte[] data) {
                received.set(data);
            }
        }, payload);

        assertArrayEquals(payload, received.get());
    }

    @Test
    void testCollateralCallbackCanBorrowAgainstNewCollateral() {
        String borrower = fixture.fundedAccount(market.collateralToken(), 10);

        lendingEngine.supplyCollateral(borrower, params, BigInteger.TEN, borrower, new LendingCallback() {
            @Override
            public void onSupplyCollateral(BigInteger assets, byte[] data) {
                lendingEngine.borrow(borrower, params, BigInteger.valueOf(16_000), ZERO, borrower, borrower);
            }
        }, new byte[0]);

        assertEquals(BigInteger.valueOf(16_000), fixture.balance(market.loanToken(), borrower));
        assertEquals(BigInteger.TEN, marketViews.position(market.id(), borrower).getCollateral());
        assertTrue(marketViews.isHealthy(market.id(), borrower));
    }

    @Test
    void testRepayCallbackRunsBeforeTokensArePulled() {
        String borrower = fixture.fundedAccount(market.collateralToken(), 10);
        lendingEngine.supplyCollateral(borrower, params, BigInteger.TEN, borrower, null, new byte[0]);
        lendingEngine.borrow(borrower, params, BigInteger.valueOf(1_000), ZERO, borrower, randomAddress());

        lendingEngine.repay(borrower, params, BigInteger.valueOf(1_000), ZERO, borrower, new LendingCallback() {
            @Override
            public void onRepay(BigInteger assets, byte[] data) {
                tokenLedger.mint(market.loanToken(), borrower, assets);
            }
        }, new byte[0]);

        assertEquals(ZERO, marketViews.position(market.id(), borrower).getBorrowShares());
    }

    @Test
    void testFlashLoanIsRepaidWithinTheCall() {
        String flashBorrower = randomAddress();
        AtomicReference<BigInteger> heldDuringCallback = new AtomicReference<>();

        lendingEngine.flashLoan(flashBorrower, market.loanToken(), BigInteger.valueOf(5_000), new LendingCallback() {
            @Override
            public void onFlashLoan(BigInteger assets, byte[] data) {
                heldDuringCallback.set(tokenLedger.balanceOf(market.loanToken(), flashBorrower));
            }
        }, new byte[0]);

        assertEquals(BigInteger.valueOf(5_000), heldDuringCallback.get());
        assertEquals(ZERO, fixture.balance(market.loanToken(), flashBorrower));
        assertEquals(BigInteger.valueOf(20_000), fixture.balance(market.loanToken(), MarketFixture.ENGINE));
    }

    @Test
    void testUnrepaidFlashLoanRollsBack() {
        String flashBorrower = randomAddress();
        String accomplice = randomAddress();

        UnrepaidFlashLoanException e = assertThrows(UnrepaidFlashLoanException.class,
            () -> lendingEngine.flashLoan(flashBorrower, market.loanToken(), BigInteger.valueOf(5_000), new LendingCallback() {
                @Override
                public void onFlashLoan(BigInteger assets, byte[] data) {
                    tokenLedger.transferFrom(market.loanToken(), flashBorrower, accomplice, assets);
                }
            }, new byte[0]));

        assertEquals(ErrorCode.UNREPAID_FLASH_LOAN, e.getErrorCode());
        assertEquals(ZERO, fixture.balance(market.loanToken(), accomplice));
        assertEquals(BigInteger.valueOf(20_000), fixture.balance(market.loanToken(), MarketFixture.ENGINE));
    }

    @Test
    void testFlashLoanValidation() {
        InvalidInputException zero = assertThrows(InvalidInputException.class,
            () -> lendingEngine.flashLoan(randomAddress(), market.loanToken(), ZERO, null, new byte[0]));
        assertEquals(ErrorCode.ZERO_AMOUNT, zero.getErrorCode());

        assertThrows(TransferFailedException.class,
            () -> lendingEngine.flashLoan(randomAddress(), market.loanToken(), BigInteger.valueOf(20_001), null, new byte[0]));
    }

    @Test
    void testFlashLoanCallbackMayUseTheEngine() {
        String flashBorrower = randomAddress();

        lendingEngine.flashLoan(flashBorrower, market.loanToken(), BigInteger.valueOf(5_000), new LendingCallback() {
            @Override
            public void onFlashLoan(BigInteger assets, byte[] data) {
                AssetsShares supplied = lendingEngine.supply(flashBorrower, params, assets, ZERO, flashBorrower, null, new byte[0]);
                lendingEngine.withdraw(flashBorrower, params, ZERO, supplied.getShares(), flashBorrower, flashBorrower);
            }
        }, new byte[0]);

        assertEquals(ZERO, fixture.balance(market.loanToken(), flashBorrower));
        assertEquals(2, eventRecorder.getMarketEvents(market.id(), EventType.SUPPLY).size());
        assertEquals(1, eventRecorder.getMarketEvents(market.id(), EventType.WITHDRAW).size());
    }

    @Test
    void testTransferHookCannotReenter() {
        String supplier = fixture.fundedAccount(market.loanToken(), 1_000);
        lendingEngine.supply(supplier, params, BigInteger.valueOf(1_000), ZERO, supplier, null, new byte[0]);
        Market before = marketViews.market(market.id());

        tokenLedger.registerHook(supplier, (token, from, amount) ->
            lendingEngine.supply(supplier, params, amount, ZERO, supplier, null, new byte[0]));
        try {
            ReentrantCallException e = assertThrows(ReentrantCallException.class,
                () -> lendingEngine.withdraw(supplier, params, BigInteger.valueOf(500), ZERO, supplier, supplier));
            assertEquals(ErrorCode.REENTRANT_CALL, e.getErrorCode());
        } finally {
            tokenLedger.removeHook(supplier);
        }

        Market after = marketViews.market(market.id());
        assertEquals(before.getTotalSupplyAssets(), after.getTotalSupplyAssets());
        assertEquals(ZERO, fixture.balance(market.loanToken(), supplier));
    }
}
