package com.copytraderadar.common;

import java.util.regex.Pattern;

/**
 * EVM address helpers: validation, case normalization and display shortening.
 */
public final class Addresses {

    public static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";
    /** Placeholder used by webhook payloads when an address field is absent. */
    public static final String UNKNOWN = "unknown";

    private static final Pattern EVM_ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    private Addresses() {
    }

    public static boolean isEvmAddress(String address) {
        return address != null && EVM_ADDRESS.matcher(address.strip()).matches();
    }

    /**
     * Lower-cased, stripped form; null stays null.
     */
    public static String normalize(String address) {
        return address == null ? null : address.strip().toLowerCase();
    }

    public static boolean isZero(String address) {
        return ZERO_ADDRESS.equalsIgnoreCase(address == null ? null : address.strip());
    }

    public static boolean isKnown(String address) {
        return address != null && !address.isBlank() && !UNKNOWN.equalsIgnoreCase(address.strip());
    }

    /**
     * "0x1234...abcd" form for chat messages. Values too short to shorten are returned as-is.
     */
    public static String shorten(String value) {
        if (value == null || value.length() <= 10) {
            return value;
        }
        return value.substring(0, 6) + "..." + value.substring(value.length() - 4);
    }
}
