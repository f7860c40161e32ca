package com.lendingengine.common;

import com.lendingengine.common.exception.InvalidInputException;

import java.util.Locale;

/**
 * Validators/normalizers for account, token, oracle and rate model addresses.
 * Addresses are 20-byte hex strings with a 0x prefix, kept lowercase.
 */
public final class Addresses {

    public static final String ZERO = "0x0000000000000000000000000000000000000000";

    private Addresses() {}

    public static String normalize(String addr) {
        if (addr == null) throw new IllegalArgumentException("address is null");
        if (!addr.startsWith("0x")) throw new IllegalArgumentException("address must start with 0x: " + addr);
        String hex = addr.substring(2);
        if (hex.length() != 40) throw new IllegalArgumentException("invalid address length (need 40 hex chars): " + addr);
        for (int i = 0; i < hex.length(); i++) {
            if (Character.digit(hex.charAt(i), 16) < 0) {
                throw new IllegalArgumentException("address contains non-hex characters: " + addr);
            }
        }
        return "0x" + hex.toLowerCase(Locale.ROOT);
    }

    public static boolean isZero(String addr) {
        return ZERO.equals(normalize(addr));
    }

    /**
     * Normalize and reject the zero address.
     */
    public static String requireNonZero(String addr, String field) {
        String normalized = normalize(addr);
        if (ZERO.equals(normalized)) {
            throw InvalidInputException.zeroAddress(field);
        }
        return normalized;
    }
}
