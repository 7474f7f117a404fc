package com.opentext.rlecodec.service;

import com.opentext.rlecodec.model.CodecFormat;
import com.opentext.rlecodec.model.CodecOperation;
import com.opentext.rlecodec.model.CodecResult;
import com.opentext.rlecodec.model.TextCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Stateless service that encodes or decodes text with the configured codec.
 * It decides between the two operations by asking the codec whether the input is already
 * in encoded form: the {@code ##00} header for ESCAPED, any digit for LETTERS.
 * Codec errors propagate to the caller unchanged.
 */
@Slf4j
@Service
public class CodecService {

    @Value("${codec.format:ESCAPED}")
    private CodecFormat format;

    @Value("${codec.decode.max-length:16777216}")
    private int maxDecodedLength;

    /** Codec built from configuration on first use. */
    private volatile TextCodec codec;

    /** @return the configured format, ESCAPED when none is set */
    public CodecFormat getFormat() {
        return format != null ? format : CodecFormat.ESCAPED;
    }

    /**
     * Ensure a codec exists for the configured format and decode limit.
     */
    public synchronized TextCodec ensureCodec() {
        if (codec == null) {
            int effectiveMax = maxDecodedLength > 0 ? maxDecodedLength : TextCodec.DEFAULT_MAX_DECODED_LENGTH;
            if (maxDecodedLength <= 0 && log.isDebugEnabled()) {
                log.debug("Invalid codec.decode.max-length={}, falling back to {}", maxDecodedLength, effectiveMax);
            }
            codec = switch (getFormat()) {
                case ESCAPED -> new EscapedRunLengthCodec(effectiveMax);
                case LETTERS -> new LetterRunLengthCodec(effectiveMax);
            };
            if (log.isDebugEnabled()) {
                log.debug("Created {} codec with decode limit {}", codec.getFormat(), effectiveMax);
            }
        }
        return codec;
    }

    /** Decide which operation applies to the given input. */
    public CodecOperation detect(String input) {
        return ensureCodec().looksEncoded(input) ? CodecOperation.DECODE : CodecOperation.ENCODE;
    }

    /**
     * Detect the operation for the input and apply it.
     * @return the output together with the operation that produced it
     */
    public CodecResult process(String input) {
        CodecOperation operation = detect(input);
        return new CodecResult(operation, processOperation(input, operation));
    }

    /**
     * Apply the given operation to the input.
     * @throws RleCodecException if the input cannot be encoded or is not a valid encoded form
     */
    public String processOperation(String input, CodecOperation operation) {
        TextCodec activeCodec = ensureCodec();
        if (log.isDebugEnabled()) {
            log.debug("Applying {} with {} codec to {} characters", operation, activeCodec.getFormat(),
                    input == null ? 0 : input.length());
        }
        return switch (operation) {
            case ENCODE -> activeCodec.encode(input);
            case DECODE -> activeCodec.decode(input);
        };
    }
}
