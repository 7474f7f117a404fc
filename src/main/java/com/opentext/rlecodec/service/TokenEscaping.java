package com.opentext.rlecodec.service;

/**
 * Escape-token mapping shared by the escaped encoder and the token reader.
 * <p>
 * Literal {@code #} is written as {@code ##}, a literal ASCII digit {@code d} as {@code #d},
 * and every other code point as itself. Counts are the only unescaped digits in a body.
 * </p>
 */
final class TokenEscaping {

    static final char ESCAPE = '#';
    static final String HEADER = "##00";

    private TokenEscaping() {}

    static boolean isAsciiDigit(int codePoint) {
        return codePoint >= '0' && codePoint <= '9';
    }

    static boolean isAsciiLetter(int codePoint) {
        return (codePoint >= 'A' && codePoint <= 'Z') || (codePoint >= 'a' && codePoint <= 'z');
    }

    static boolean needsEscape(int codePoint) {
        return codePoint == ESCAPE || isAsciiDigit(codePoint);
    }

    /** Append the token representation of a literal, before any count. */
    static void appendLiteral(StringBuilder out, int codePoint) {
        if (needsEscape(codePoint)) {
            out.append(ESCAPE);
        }
        out.appendCodePoint(codePoint);
    }

    /** Render a code point for error messages; lone surrogates are shown as U+XXXX. */
    static String describe(int codePoint) {
        if (codePoint <= Character.MAX_VALUE && Character.isSurrogate((char) codePoint)) {
            return String.format("U+%04X", codePoint);
        }
        return "'" + new String(Character.toChars(codePoint)) + "'";
    }
}
