package com.copytraderadar.common;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Raw on-chain integer amounts and their human-readable, decimal-scaled form.
 * Raw values are never rounded; only the display form is.
 */
public final class TokenAmounts {

    /** Display precision used in notifications and acknowledgements. */
    public static final int DISPLAY_SCALE = 6;

    private TokenAmounts() {
    }

    /**
     * Parses a raw amount given as a decimal integer string or a 0x-prefixed hex string.
     * Empty when the value is null, blank, negative or not an integer.
     */
    public static Optional<BigInteger> parseRaw(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String v = value.strip();
        try {
            BigInteger parsed;
            if (v.startsWith("0x") || v.startsWith("0X")) {
                String hex = v.substring(2);
                parsed = hex.isEmpty() ? BigInteger.ZERO : new BigInteger(hex, 16);
            } else {
                parsed = new BigInteger(v, 10);
            }
            return parsed.signum() < 0 ? Optional.empty() : Optional.of(parsed);
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * raw / 10^decimals, rounded half-up to {@link #DISPLAY_SCALE} places, plain notation (e.g. "1.000000").
     */
    public static String toDisplay(BigInteger raw, int decimals) {
        if (decimals < 0) {
            throw new IllegalArgumentException("decimals must be >= 0: " + decimals);
        }
        return new BigDecimal(raw, decimals)
                .setScale(DISPLAY_SCALE, RoundingMode.HALF_UP)
                .toPlainString();
    }

    /**
     * Parses an ETH-style decimal string ("0.25"); empty when malformed.
     */
    public static Optional<BigDecimal> parseDecimal(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BigDecimal(value.strip()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
