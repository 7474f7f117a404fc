package com.opentext.rlecodec.service;

/**
 * Signals that input could not be encoded or that an encoded form is not valid.
 * <p>
 * Every failure is detected synchronously during the single scan over the input and is
 * deterministic: repeating the call with the same input fails the same way.
 * Decoding failures carry the zero-based position in the encoded input where the problem
 * was found, or -1 when the failure concerns the input as a whole.
 * </p>
 */
public class RleCodecException extends IllegalArgumentException {

    /** Category of a codec failure. */
    public enum Kind {
        /** Input is null rather than text. */
        INVALID_INPUT_TYPE,
        /** Text to encode, or a headerless encoded form, is empty. */
        EMPTY_INPUT,
        /** Encoded input does not start with the exact header. */
        MISSING_HEADER,
        /** Encoded input ends with a lone escape character. */
        DANGLING_ESCAPE,
        /** Escape character followed by something other than the escape character or a digit. */
        INVALID_ESCAPE,
        /** Count with a leading zero, a zero count, an overflowing count or a count without a literal. */
        MALFORMED_COUNT,
        /** Header present but no tokens follow it. */
        EMPTY_BODY,
        /** Decoded text would exceed the configured maximum length. */
        OUTPUT_TOO_LARGE,
        /** Character not allowed by the active format. */
        INVALID_CHARACTER
    }

    private final Kind kind;
    private final int position;

    public RleCodecException(Kind kind, String message) {
        this(kind, message, -1);
    }

    public RleCodecException(Kind kind, String message, int position) {
        super(message);
        this.kind = kind;
        this.position = position;
    }

    public RleCodecException(Kind kind, String message, int position, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.position = position;
    }

    public Kind getKind() {
        return kind;
    }

    /** @return zero-based offset into the encoded input, or -1 if not tied to a position */
    public int getPosition() {
        return position;
    }
}
