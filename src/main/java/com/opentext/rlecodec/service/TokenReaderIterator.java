package com.opentext.rlecodec.service;

import com.opentext.rlecodec.model.CodecFormat;
import com.opentext.rlecodec.model.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.NoSuchElementException;

import static com.opentext.rlecodec.service.RleCodecException.Kind.DANGLING_ESCAPE;
import static com.opentext.rlecodec.service.RleCodecException.Kind.INVALID_CHARACTER;
import static com.opentext.rlecodec.service.RleCodecException.Kind.INVALID_ESCAPE;
import static com.opentext.rlecodec.service.RleCodecException.Kind.MALFORMED_COUNT;

/**
 * Iterator that reads the tokens of an encoded body.
 * <p>
 * In {@link CodecFormat#ESCAPED} a token is {@code ##}, {@code #d} or any other single code point,
 * optionally followed by a count (e.g. "#53" -> ('5',3), "##" -> ('#',1), "A10" -> ('A',10)).
 * In {@link CodecFormat#LETTERS} a token is an ASCII letter with an optional count.
 * Counts are positive integers without leading zeros that fit in an int.
 * Throws {@link RleCodecException} at the first syntax error, with its position in the input.
 * </p>
 */
public class TokenReaderIterator implements Iterator<Token> {
    private static final Logger log = LoggerFactory.getLogger(TokenReaderIterator.class);
    private final String input;
    private final CodecFormat format;
    private int index;
    private Token nextToken;
    private boolean initialized;

    /**
     * @param input the full encoded input
     * @param start offset of the first token, i.e. the header length
     * @param format grammar to read
     */
    public TokenReaderIterator(String input, int start, CodecFormat format) {
        this.input = input;
        this.index = start;
        this.format = format;
        this.initialized = false;
    }

    private void ensureInitialized() {
        if (!initialized) {
            advanceGroup();
            initialized = true;
        }
    }

    private void advanceGroup() {
        if (index >= input.length()) {
            nextToken = null;
            return;
        }
        int tokenStart = index;
        int literal = readLiteral();
        int count = readCount();
        nextToken = new Token(literal, count);
        if (log.isDebugEnabled()) {
            log.debug("Read token at {}: literal={}, count={}", tokenStart, TokenEscaping.describe(literal), count);
        }
    }

    private int readLiteral() {
        int currentChar = input.codePointAt(index);
        if (TokenEscaping.isAsciiDigit(currentChar)) {
            throw new RleCodecException(MALFORMED_COUNT,
                    "Count at position " + index + " has no preceding character", index);
        }
        if (format == CodecFormat.ESCAPED && currentChar == TokenEscaping.ESCAPE) {
            return readEscaped();
        }
        if (format == CodecFormat.LETTERS && !TokenEscaping.isAsciiLetter(currentChar)) {
            throw new RleCodecException(INVALID_CHARACTER,
                    "Expected letter at position " + index + ", got: " + TokenEscaping.describe(currentChar), index);
        }
        index += Character.charCount(currentChar);
        return currentChar;
    }

    private int readEscaped() {
        int escapeAt = index;
        if (escapeAt + 1 >= input.length()) {
            throw new RleCodecException(DANGLING_ESCAPE,
                    "Dangling escape '#' at end of encoded string", escapeAt);
        }
        int escaped = input.codePointAt(escapeAt + 1);
        if (escaped != TokenEscaping.ESCAPE && !TokenEscaping.isAsciiDigit(escaped)) {
            throw new RleCodecException(INVALID_ESCAPE,
                    "Invalid escape sequence at position " + escapeAt
                            + ": '#' must be followed by '#' or a digit, got: " + TokenEscaping.describe(escaped),
                    escapeAt);
        }
        index += 2;
        return escaped;
    }

    private int readCount() {
        int countStart = index;
        while (index < input.length() && TokenEscaping.isAsciiDigit(input.charAt(index))) {
            index++;
        }
        if (index == countStart) {
            return 1;
        }
        String countStr = input.substring(countStart, index);
        if (countStr.charAt(0) == '0') {
            throw new RleCodecException(MALFORMED_COUNT,
                    "Count at position " + countStart + " must be a positive integer without leading zeros, got: " + countStr,
                    countStart);
        }
        return parseCount(countStr, countStart);
    }

    private int parseCount(String countStr, int position) {
        try {
            return Integer.parseInt(countStr);
        } catch (NumberFormatException e) {
            throw new RleCodecException(MALFORMED_COUNT,
                    "Count at position " + position + " exceeds maximum " + Integer.MAX_VALUE + ": " + countStr,
                    position, e);
        }
    }

    @Override
    public boolean hasNext() {
        ensureInitialized();
        return nextToken != null;
    }

    @Override
    public Token next() {
        ensureInitialized();
        if (!hasNext()) throw new NoSuchElementException();
        Token toReturn = nextToken;
        advanceGroup();
        return toReturn;
    }
}
