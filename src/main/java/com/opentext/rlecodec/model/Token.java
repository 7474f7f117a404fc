package com.opentext.rlecodec.model;

import lombok.Data;

/**
 * Atomic unit of an encoded body: one literal code point repeated {@code count} times.
 * <p>
 * A count of 1 is written without digits; larger counts follow the literal as a decimal
 * number without leading zeros.
 * </p>
 */
@Data
public class Token {
    private final int literal;
    private final int count;

    public static Token of(Run run) {
        return new Token(run.getCodePoint(), run.getLength());
    }

    /** @return true if the count must be written after the literal */
    public boolean hasCount() {
        return count > 1;
    }
}
