package com.lendingengine.governance;

import com.lendingengine.common.exception.ErrorCode;
import com.lendingengine.common.exception.InvalidInputException;
import com.lendingengine.common.exception.UnauthorizedException;
import com.lendingengine.engine.LendingEngine;
import com.lendingengine.engine.MarketViews;
import com.lendingengine.support.MarketFixture;
import com.lendingengine.support.MarketFixture.TestMarket;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigInteger;
import java.util.concurrent.ThreadLocalRandom;

import static com.lendingengine.support.MarketFixture.OWNER;
import static com.lendingengine.support.MarketFixture.randomAddress;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for owner-gated settings.
 */
@SpringBootTest
@ActiveProfiles("test")
class GovernanceServiceTest {

    @Autowired
    private GovernanceService governanceService;

    @Autowired
    private LendingEngine lendingEngine;

    @Autowired
    private MarketViews marketViews;

    @Autowired
    private MarketFixture fixture;

    private static BigInteger randomLltv() {
        // avoid the values enabled by configuration
        return BigInteger.valueOf(ThreadLocalRandom.current().nextLong(1, 900_000_000_000L))
            .multiply(BigInteger.valueOf(1_000_000L)).add(BigInteger.ONE);
    }

    @Test
    void testSettingsAreInstalledFromConfiguration() {
        assertEquals(OWNER, governanceService.owner());
        assertEquals(MarketFixture.FEE_RECIPIENT, governanceService.feeRecipient());
        assertTrue(governanceService.isIrmEnabled(MarketFixture.NO_IRM));
        assertTrue(governanceService.isIrmEnabled(MarketFixture.ADAPTIVE_IRM));
        assertTrue(governanceService.isLltvEnabled(MarketFixture.LLTV_80));
    }

    @Test
    void testOnlyOwnerCanChangeSettings() {
        String stranger = randomAddress();

        UnauthorizedException e = assertThrows(UnauthorizedException.class,
            () -> governanceService.setOwner(stranger, stranger));
        assertEquals(ErrorCode.UNAUTHORIZED, e.getErrorCode());
        assertThrows(UnauthorizedException.class, () -> governanceService.setFeeRecipient(stranger, stranger));
        assertThrows(UnauthorizedException.class, () -> governanceService.enableIrm(stranger, randomAddress()));
        assertThrows(UnauthorizedException.class, () -> governanceService.enableLltv(stranger, randomLltv()));
    }

    @Test
    void testOwnershipTransfer() {
        String newOwner = randomAddress();

        governanceService.setOwner(OWNER, newOwner);
        try {
            assertEquals(newOwner, governanceService.owner());
            assertThrows(UnauthorizedException.class, () -> governanceService.enableIrm(OWNER, randomAddress()));
            InvalidInputException same = assertThrows(InvalidInputException.class,
                () -> governanceService.setOwner(newOwner, newOwner));
            assertEquals(ErrorCode.ALREADY_SET, same.getErrorCode());
        } finally {
            governanceService.setOwner(newOwner, OWNER);
        }
        assertEquals(OWNER, governanceService.owner());
    }

    @Test
    void testFeeRecipientChange() {
        String recipient = randomAddress();

        governanceService.setFeeRecipient(OWNER, recipient);
        try {
            assertEquals(recipient, governanceService.feeRecipient());
        } finally {
            governanceService.setFeeRecipient(OWNER, MarketFixture.FEE_RECIPIENT);
        }
    }

    @Test
    void testEnableIrmOnce() {
        String irm = randomAddress();

        governanceService.enableIrm(OWNER, irm);

        assertTrue(governanceService.isIrmEnabled(irm));
        InvalidInputException e = assertThrows(InvalidInputException.class, () -> governanceService.enableIrm(OWNER, irm));
        assertEquals(ErrorCode.ALREADY_SET, e.getErrorCode());
    }

    @Test
    void testEnabledLltvCanBeUsedForMarkets() {
        BigInteger lltv = randomLltv();

        governanceService.enableLltv(OWNER, lltv);
        TestMarket market = fixture.createMarket(MarketFixture.NO_IRM, lltv, MarketFixture.price(1));

        assertEquals(lltv, marketViews.idToMarketParams(market.id()).getLltv());
        assertThrows(InvalidInputException.class, () -> governanceService.enableLltv(OWNER, lltv));
    }

    @Test
    void testLltvBounds() {
        InvalidInputException tooHigh = assertThrows(InvalidInputException.class,
            () -> governanceService.enableLltv(OWNER, MarketFixture.WAD));
        assertEquals(ErrorCode.MAX_LLTV_EXCEEDED, tooHigh.getErrorCode());

        InvalidInputException negative = assertThrows(InvalidInputException.class,
            () -> governanceService.enableLltv(OWNER, BigInteger.ONE.negate()));
        assertEquals(ErrorCode.INVALID_AMOUNT, negative.getErrorCode());
    }

    @Test
    void testSetFeeRules() {
        TestMarket market = fixture.createDefaultMarket();

        assertThrows(UnauthorizedException.class,
            () -> lendingEngine.setFee(randomAddress(), market.params(), BigInteger.TEN));
        InvalidInputException same = assertThrows(InvalidInputException.class,
            () -> lendingEngine.setFee(OWNER, market.params(), BigInteger.ZERO));
        assertEquals(ErrorCode.ALREADY_SET, same.getErrorCode());
        InvalidInputException tooHigh = assertThrows(InvalidInputException.class,
            () -> lendingEngine.setFee(OWNER, market.params(), new BigInteger("250000000000000001")));
        assertEquals(ErrorCode.MAX_FEE_EXCEEDED, tooHigh.getErrorCode());

        lendingEngine.setFee(OWNER, market.params(), new BigInteger("250000000000000000"));
        assertEquals(new BigInteger("250000000000000000"), marketViews.market(market.id()).getFee());
    }
}
