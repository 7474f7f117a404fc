package com.opentext.rlecodec.model;

import lombok.Data;

/** Output of a detected operation together with the operation that produced it. */
@Data
public class CodecResult {
    private final CodecOperation operation;
    private final String output;
}
