package com.opentext.rlecodec.service;

import com.opentext.rlecodec.model.CodecFormat;

import static com.opentext.rlecodec.service.RleCodecException.Kind.EMPTY_BODY;
import static com.opentext.rlecodec.service.RleCodecException.Kind.EMPTY_INPUT;
import static com.opentext.rlecodec.service.RleCodecException.Kind.MISSING_HEADER;

/**
 * Run-length codec able to represent any text.
 * <p>
 * Encoded streams start with the header {@code ##00}. Each run becomes one token: {@code ##} for
 * {@code #}, {@code #d} for a digit, the code point itself otherwise, followed by the run length
 * when it is greater than one. Examples: "AAAA" -> "##00A4", "555" -> "##00#53",
 * "B12" -> "##00B#1#2".
 * </p>
 * <p>
 * A stream holding only the header is rejected: empty text cannot be encoded, so no encoder
 * output has an empty body.
 * </p>
 */
public class EscapedRunLengthCodec extends AbstractRunLengthCodec {

    public static final String HEADER = TokenEscaping.HEADER;

    public EscapedRunLengthCodec() {
        this(DEFAULT_MAX_DECODED_LENGTH);
    }

    public EscapedRunLengthCodec(int maxDecodedLength) {
        super(maxDecodedLength);
    }

    @Override
    public CodecFormat getFormat() {
        return CodecFormat.ESCAPED;
    }

    @Override
    public String encode(String text) {
        requireText(text, "text");
        if (text.isEmpty()) {
            throw new RleCodecException(EMPTY_INPUT, "text must be non-empty");
        }
        StringBuilder out = new StringBuilder(HEADER.length() + text.length()).append(HEADER);
        appendRuns(text, out);
        return out.toString();
    }

    @Override
    public String decode(String encoded) {
        requireText(encoded, "encoded input");
        if (!encoded.startsWith(HEADER)) {
            throw new RleCodecException(MISSING_HEADER, "Encoded input must begin with the '" + HEADER + "' header", 0);
        }
        if (encoded.length() == HEADER.length()) {
            throw new RleCodecException(EMPTY_BODY,
                    "Encoded input has no tokens after the '" + HEADER + "' header", HEADER.length());
        }
        return expand(encoded, HEADER.length());
    }

    @Override
    public boolean looksEncoded(String input) {
        return input != null && input.startsWith(HEADER);
    }

    @Override
    protected void appendLiteral(StringBuilder out, int codePoint) {
        TokenEscaping.appendLiteral(out, codePoint);
    }
}
