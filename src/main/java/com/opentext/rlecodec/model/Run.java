package com.opentext.rlecodec.model;

import lombok.Data;

/**
 * A maximal consecutive repetition of one code point in the raw text.
 * Produced by the encoder's scan and turned into exactly one {@link Token}.
 */
@Data
public class Run {
    private final int codePoint;
    private final int length;
}
