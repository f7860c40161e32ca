package com.lendingengine.common;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class LedgerLockTest {

    private final LedgerLock ledgerLock = new LedgerLock();

    @AfterEach
    void tearDown() {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }

    @Test
    void testAcquireOutsideTransactionFails() {
        assertThrows(IllegalStateException.class, ledgerLock::acquire);
        assertFalse(ledgerLock.isHeldByCurrentThread());
    }

    @Test
    void testLockIsHeldUntilTransactionCompletes() throws Exception {
        TransactionSynchronizationManager.initSynchronization();
        ledgerLock.acquire();
        ledgerLock.acquire();
        assertTrue(ledgerLock.isHeldByCurrentThread());

        CompletableFuture<Boolean> other = CompletableFuture.supplyAsync(() -> {
            TransactionSynchronizationManager.initSynchronization();
            try {
                ledgerLock.acquire();
                return true;
            } finally {
                completeTransaction();
            }
        });
        Thread.sleep(100);
        assertFalse(other.isDone());

        completeTransaction();

        assertFalse(ledgerLock.isHeldByCurrentThread());
        assertTrue(other.get(5, TimeUnit.SECONDS));
    }

    private static void completeTransaction() {
        List<TransactionSynchronization> synchronizations = TransactionSynchronizationManager.getSynchronizations();
        TransactionSynchronizationManager.clearSynchronization();
        synchronizations.forEach(s -> s.afterCompletion(TransactionSynchronization.STATUS_COMMITTED));
    }
}
