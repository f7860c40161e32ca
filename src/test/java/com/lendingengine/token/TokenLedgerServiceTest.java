package com.lendingengine.token;

import com.lendingengine.common.exception.ErrorCode;
import com.lendingengine.common.exception.TransferFailedException;
import com.lendingengine.support.MarketFixture;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import static com.lendingengine.support.MarketFixture.randomAddress;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for the internal token ledger.
 */
@SpringBootTest
@ActiveProfiles("test")
class TokenLedgerServiceTest {

    @Autowired
    private TokenLedgerService tokenLedger;

    private final String token = randomAddress();

    @Test
    void testMintAndTransfer() {
        String alice = randomAddress();
        String bob = randomAddress();
        tokenLedger.mint(token, alice, BigInteger.valueOf(100));

        tokenLedger.transferFrom(token, alice, bob, BigInteger.valueOf(40));

        assertEquals(BigInteger.valueOf(60), tokenLedger.balanceOf(token, alice));
        assertEquals(BigInteger.valueOf(40), tokenLedger.balanceOf(token, bob));
        assertEquals(1, tokenLedger.balancesOf(bob).size());
    }

    @Test
    void testTransferFromEngineAccount() {
        String receiver = randomAddress();
        tokenLedger.mint(token, MarketFixture.ENGINE, BigInteger.valueOf(10));

        tokenLedger.transfer(token, receiver, BigInteger.valueOf(10));

        assertEquals(BigInteger.TEN, tokenLedger.balanceOf(token, receiver));
        assertEquals(BigInteger.ZERO, tokenLedger.balanceOf(token, MarketFixture.ENGINE));
    }

    @Test
    void testInsufficientBalanceFails() {
        String alice = randomAddress();
        tokenLedger.mint(token, alice, BigInteger.valueOf(5));

        TransferFailedException e = assertThrows(TransferFailedException.class,
            () -> tokenLedger.transferFrom(token, alice, randomAddress(), BigInteger.valueOf(6)));
        assertEquals(ErrorCode.TRANSFER_FAILED, e.getErrorCode());
        assertEquals(BigInteger.valueOf(5), tokenLedger.balanceOf(token, alice));
    }

    @Test
    void testTransferToZeroAddressFails() {
        String alice = randomAddress();
        tokenLedger.mint(token, alice, BigInteger.valueOf(5));

        assertThrows(TransferFailedException.class,
            () -> tokenLedger.transferFrom(token, alice, MarketFixture.NO_IRM, BigInteger.ONE));
    }

    @Test
    void testZeroTransferIsNoOp() {
        String alice = randomAddress();

        tokenLedger.transferFrom(token, alice, randomAddress(), BigInteger.ZERO);

        assertEquals(BigInteger.ZERO, tokenLedger.balanceOf(token, alice));
    }

    @Test
    void testReceiveHookRunsAfterCredit() {
        String alice = randomAddress();
        String bob = randomAddress();
        tokenLedger.mint(token, alice, BigInteger.valueOf(10));
        List<BigInteger> seen = new ArrayList<>();

        tokenLedger.registerHook(bob, (t, from, amount) -> {
            assertEquals(alice, from);
            seen.add(tokenLedger.balanceOf(t, bob));
        });
        try {
            tokenLedger.transferFrom(token, alice, bob, BigInteger.valueOf(3));
        } finally {
            tokenLedger.removeHook(bob);
        }

        assertEquals(List.of(BigInteger.valueOf(3)), seen);
    }

    @Test
    void testMintRejectsNonPositiveAmounts() {
        assertThrows(IllegalArgumentException.class,
            () -> tokenLedger.mint(token, randomAddress(), BigInteger.ZERO));
    }
}
