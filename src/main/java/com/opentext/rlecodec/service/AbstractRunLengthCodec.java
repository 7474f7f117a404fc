package com.opentext.rlecodec.service;

import com.opentext.rlecodec.model.Run;
import com.opentext.rlecodec.model.TextCodec;
import com.opentext.rlecodec.model.Token;

import java.util.Iterator;

import static com.opentext.rlecodec.service.RleCodecException.Kind.INVALID_INPUT_TYPE;
import static com.opentext.rlecodec.service.RleCodecException.Kind.OUTPUT_TOO_LARGE;

/**
 * Shared run grouping and token expansion for the run-length codecs.
 * Subclasses decide how a literal is written and where the body starts.
 */
public abstract class AbstractRunLengthCodec implements TextCodec {

    private final int maxDecodedLength;

    protected AbstractRunLengthCodec(int maxDecodedLength) {
        if (maxDecodedLength <= 0) {
            throw new IllegalArgumentException("maxDecodedLength must be positive, got: " + maxDecodedLength);
        }
        this.maxDecodedLength = maxDecodedLength;
    }

    public int getMaxDecodedLength() {
        return maxDecodedLength;
    }

    /** Write the token representation of a literal, before any count. */
    protected abstract void appendLiteral(StringBuilder out, int codePoint);

    protected static String requireText(String value, String name) {
        if (value == null) {
            throw new RleCodecException(INVALID_INPUT_TYPE, name + " must be a string, got: null");
        }
        return value;
    }

    /** Append one token per run of {@code text}; counts are only written for runs longer than one. */
    protected void appendRuns(String text, StringBuilder out) {
        Iterator<Run> runs = new RunScannerIterator(text);
        while (runs.hasNext()) {
            Token token = Token.of(runs.next());
            appendLiteral(out, token.getLiteral());
            if (token.hasCount()) {
                out.append(token.getCount());
            }
        }
    }

    /** Read tokens of {@code input} from {@code start} and expand each literal by its count. */
    protected String expand(String input, int start) {
        Iterator<Token> tokens = new TokenReaderIterator(input, start, getFormat());
        StringBuilder out = new StringBuilder(input.length());
        while (tokens.hasNext()) {
            Token token = tokens.next();
            long produced = (long) token.getCount() * Character.charCount(token.getLiteral());
            if (out.length() + produced > maxDecodedLength) {
                throw new RleCodecException(OUTPUT_TOO_LARGE,
                        "Decoded text exceeds maximum length of " + maxDecodedLength + " characters");
            }
            for (int i = 0; i < token.getCount(); i++) {
                out.appendCodePoint(token.getLiteral());
            }
        }
        return out.toString();
    }
}
