package com.opentext.rlecodec.service;

import com.opentext.rlecodec.model.CodecFormat;

import static com.opentext.rlecodec.service.RleCodecException.Kind.EMPTY_INPUT;
import static com.opentext.rlecodec.service.RleCodecException.Kind.INVALID_CHARACTER;

/**
 * Plain run-length codec for ASCII letters only, without header or escaping
 * (e.g. "AAABCC" -> "A3BC2", "x12Y" -> "xxxxxxxxxxxxY"). Case is preserved.
 * Any digit in the input marks it as encoded.
 */
public class LetterRunLengthCodec extends AbstractRunLengthCodec {

    public LetterRunLengthCodec() {
        this(DEFAULT_MAX_DECODED_LENGTH);
    }

    public LetterRunLengthCodec(int maxDecodedLength) {
        super(maxDecodedLength);
    }

    @Override
    public CodecFormat getFormat() {
        return CodecFormat.LETTERS;
    }

    @Override
    public String encode(String text) {
        requireText(text, "text");
        if (text.isEmpty()) {
            throw new RleCodecException(EMPTY_INPUT, "text must be non-empty");
        }
        for (int i = 0; i < text.length(); ) {
            int codePoint = text.codePointAt(i);
            if (!TokenEscaping.isAsciiLetter(codePoint)) {
                throw new RleCodecException(INVALID_CHARACTER,
                        "text must contain alphabetic characters only (A-Z or a-z), got: "
                                + TokenEscaping.describe(codePoint) + " at position " + i, i);
            }
            i += Character.charCount(codePoint);
        }
        StringBuilder out = new StringBuilder(text.length());
        appendRuns(text, out);
        return out.toString();
    }

    @Override
    public String decode(String encoded) {
        requireText(encoded, "encoded input");
        if (encoded.isEmpty()) {
            throw new RleCodecException(EMPTY_INPUT, "encoded input must be non-empty");
        }
        return expand(encoded, 0);
    }

    @Override
    public boolean looksEncoded(String input) {
        return input != null && input.chars().anyMatch(TokenEscaping::isAsciiDigit);
    }

    @Override
    protected void appendLiteral(StringBuilder out, int codePoint) {
        out.appendCodePoint(codePoint);
    }
}
