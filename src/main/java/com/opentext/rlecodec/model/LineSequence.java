package com.opentext.rlecodec.model;

import java.util.stream.Stream;

/**
 * A source of input lines for the console processor.
 * Lines are consumed lazily, so a blocking reader may back the stream.
 */
public interface LineSequence {
    /** @return the lines to process in order of encounter, without line terminators */
    Stream<String> getLines();
}
