package com.lendingengine.token;

import java.math.BigInteger;

/**
 * Receive hook invoked after tokens are credited to a holder.
 */
@FunctionalInterface
public interface TransferHook {

    void onTokensReceived(String token, String from, BigInteger amount);
}
