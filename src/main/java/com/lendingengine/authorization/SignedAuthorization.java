package com.lendingengine.authorization;

import com.lendingengine.common.Addresses;
import lombok.Builder;
import lombok.Value;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.List;

/**
 * Authorization message signed off-line by the authorizer and submitted by anyone.
 */
@Value
@Builder
public class SignedAuthorization {

    String authorizer;
    String authorized;

    /**
     * true to authorize the delegate, false to revoke it.
     */
    boolean enabled;
    long nonce;

    /**
     * Epoch second after which the signature is no longer accepted.
     */
    long deadline;

    /**
     * keccak256 of the ABI-encoded fields. This is the 32-byte message the authorizer
     * signs with the Ethereum signed-message prefix.
     */
    public byte[] digest() {
        String encoded = FunctionEncoder.encodeConstructor(List.of(
            new Address(Addresses.normalize(authorizer)),
            new Address(Addresses.normalize(authorized)),
            new Bool(enabled),
            new Uint256(BigInteger.valueOf(nonce)),
            new Uint256(BigInteger.valueOf(deadline))
        ));
        return Hash.sha3(Numeric.hexStringToByteArray(encoded));
    }
}
