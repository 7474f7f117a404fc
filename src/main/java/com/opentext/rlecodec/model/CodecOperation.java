package com.opentext.rlecodec.model;

/**
 * Operation applied to a line of input.
 */
public enum CodecOperation {
    /** Turn raw text into its run-length encoded form. */
    ENCODE,
    /** Turn an encoded form back into raw text. */
    DECODE
}
