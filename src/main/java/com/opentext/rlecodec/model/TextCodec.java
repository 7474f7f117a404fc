package com.opentext.rlecodec.model;

/**
 * A reversible text codec.
 * <p>
 * Implementations are immutable and hold no per-call state, so a single instance may be shared
 * between threads. Both operations signal invalid input with
 * {@link com.opentext.rlecodec.service.RleCodecException}.
 * </p>
 */
public interface TextCodec {

    /** Default upper bound on the number of characters a single decode may produce. */
    int DEFAULT_MAX_DECODED_LENGTH = 16 * 1024 * 1024;

    /** @return the wire format this codec reads and writes */
    CodecFormat getFormat();

    /**
     * Encode raw text.
     * @param text non-empty raw text
     * @return the encoded form
     */
    String encode(String text);

    /**
     * Decode an encoded form produced by {@link #encode(String)}.
     * @param encoded the encoded form
     * @return the original raw text
     */
    String decode(String encoded);

    /**
     * Decide whether the given input is already in encoded form and should be decoded.
     * This is a cheap check; {@link #decode(String)} still validates strictly.
     */
    boolean looksEncoded(String input);
}
