package com.lendingengine.common;

import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Serializes state-changing ledger operations.
 *
 * The lock is taken inside the caller's transaction and released only once that
 * transaction has committed or rolled back, so the next operation reads the state
 * the previous one wrote. Nested acquisitions on the same thread (engine to token
 * ledger, callbacks back into the engine) are reentrant and released together.
 */
@Component
public class LedgerLock {

    private final ReentrantLock lock = new ReentrantLock(true);

    public void acquire() {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            throw new IllegalStateException("Ledger lock requires an active transaction");
        }
        lock.lock();
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                lock.unlock();
            }
        });
    }

    public boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }
}
