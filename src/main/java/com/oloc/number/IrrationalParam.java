package com.oloc.number;

import com.oloc.token.TokenGrammar;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Parameter declared on an irrational with the {@code ?} suffix: a bare sign
 * ({@code x+?}) or a value ({@code x2.5?}, {@code π3?}). For π and 𝑒 the value is
 * the number of decimal places retained when converting to a decimal.
 *
 * @param sign  declared sign, {@code 0} when only a value was given
 * @param value declared value, or {@code null} for a bare sign
 */
public record IrrationalParam(int sign, Fraction value) {

    /** Most decimal places π or 𝑒 may declare. */
    public static final int MAX_PLACES = 10_000;

    /**
     * Parse the text of an irrational parameter token, e.g. "+?", "-2?", "3.5?".
     */
    public static IrrationalParam parse(String text) {
        String body = text.endsWith(String.valueOf(TokenGrammar.QUESTION))
                ? text.substring(0, text.length() - 1) : text;
        if (body.equals(String.valueOf(TokenGrammar.PLUS))) {
            return new IrrationalParam(1, null);
        }
        if (body.equals(String.valueOf(TokenGrammar.MINUS))) {
            return new IrrationalParam(-1, null);
        }
        return new IrrationalParam(0, Fraction.of(new BigDecimal(body)));
    }

    public boolean hasValue() {
        return value != null;
    }

    /**
     * Sign implied by the declaration, {@code 0} when unknown or zero.
     */
    public int knownSign() {
        return value != null ? value.signum() : sign;
    }

    /**
     * Retained decimal places when attached to π or 𝑒, or {@code -1} when none was declared.
     * Counts above {@link #MAX_PLACES} report {@code MAX_PLACES + 1}.
     */
    public int places() {
        if (value == null) {
            return -1;
        }
        BigInteger places = value.abs().floor();
        return places.compareTo(BigInteger.valueOf(MAX_PLACES)) > 0 ? MAX_PLACES + 1 : places.intValue();
    }
}
