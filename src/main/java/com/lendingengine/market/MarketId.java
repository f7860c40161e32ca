package com.lendingengine.market;

import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.util.List;
import java.util.Locale;

/**
 * Market identifier: keccak256 of the ABI encoding of the five market params,
 * each padded to a 32-byte word in declaration order.
 */
public final class MarketId {

    private MarketId() {}

    public static String of(MarketParams params) {
        String encoded = FunctionEncoder.encodeConstructor(List.of(
            new Address(params.getLoanToken()),
            new Address(params.getCollateralToken()),
            new Address(params.getOracle()),
            new Address(params.getIrm()),
            new Uint256(params.getLltv())
        ));
        return Numeric.toHexString(Hash.sha3(Numeric.hexStringToByteArray(encoded)));
    }

    public static String normalize(String marketId) {
        if (marketId == null || !marketId.startsWith("0x") || marketId.length() != 66) {
            throw new IllegalArgumentException("Invalid market id: " + marketId);
        }
        return marketId.toLowerCase(Locale.ROOT);
    }
}
