package com.lendingengine.token;

import java.math.BigInteger;

/**
 * Fungible token movements performed by the engine.
 *
 * Both calls either fully succeed or throw; the engine treats a throw as fatal and
 * unwinds the whole operation.
 */
public interface AssetTransfer {

    /**
     * Move {@code amount} of {@code token} out of the engine's custody to {@code to}.
     */
    void transfer(String token, String to, BigInteger amount);

    /**
     * Pull {@code amount} of {@code token} from {@code from} into {@code to}.
     */
    void transferFrom(String token, String from, String to, BigInteger amount);
}
