package com.opentext.rlecodec.service;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EscapedRunLengthCodecTest {

    private final EscapedRunLengthCodec codec = new EscapedRunLengthCodec();

    private RleCodecException.Kind decodeFailure(String encoded) {
        return assertThrows(RleCodecException.class, () -> codec.decode(encoded)).getKind();
    }

    @Test
    void testEncodeExamples() {
        assertEquals("##00A", codec.encode("A"));
        assertEquals("##00A4", codec.encode("AAAA"));
        assertEquals("##00##", codec.encode("#"));
        assertEquals("##00##3", codec.encode("###"));
        assertEquals("##00#5", codec.encode("5"));
        assertEquals("##00#53", codec.encode("555"));
        assertEquals("##00B#1#2", codec.encode("B12"));
    }

    @Test
    void testDecodeExamples() {
        assertEquals("A", codec.decode("##00A"));
        assertEquals("AAAA", codec.decode("##00A4"));
        assertEquals("#", codec.decode("##00##"));
        assertEquals("###", codec.decode("##00##3"));
        assertEquals("5", codec.decode("##00#5"));
        assertEquals("555", codec.decode("##00#53"));
        assertEquals("B12", codec.decode("##00B#1#2"));
        assertEquals("Z0##A", codec.decode("##00Z#10##2A"));
    }

    @Test
    void testMultiDigitRunLength() {
        assertEquals("##00A10#712", codec.encode("A".repeat(10) + "7".repeat(12)));
    }

    @Test
    void testWhitespaceAndSymbolsArePlainTokens() {
        assertEquals("##00a 3-b", codec.encode("a   -b"));
        assertEquals("a   -b", codec.decode("##00a 3-b"));
    }

    @Test
    void testHeaderInsideTextIsEscaped() {
        String encoded = codec.encode("##00");
        assertEquals("##00##2#02", encoded);
        assertEquals("##00", codec.decode(encoded));
    }

    @Test
    void testSingletonRunsCarryNoCount() {
        String text = "ab#1c2";
        String encoded = codec.encode(text);
        assertEquals("##00ab###1c#2", encoded);
        assertEquals(text, codec.decode(encoded));
    }

    @Test
    void testSupplementaryCodePoints() {
        String smile = new String(Character.toChars(0x1F600));
        String text = smile.repeat(3) + "9" + smile;
        String encoded = codec.encode(text);
        assertEquals("##00" + smile + "3#9" + smile, encoded);
        assertEquals(text, codec.decode(encoded));
    }

    @Test
    void testRoundTripOfRandomText() {
        char[] alphabet = {'#', '0', '1', '9', 'A', 'a', ' ', '\n', 'é', '٣'};
        Random random = new Random(42);
        for (int i = 0; i < 500; i++) {
            StringBuilder text = new StringBuilder();
            int runs = 1 + random.nextInt(20);
            for (int r = 0; r < runs; r++) {
                text.append(String.valueOf(alphabet[random.nextInt(alphabet.length)]).repeat(1 + random.nextInt(12)));
            }
            String encoded = codec.encode(text.toString());
            assertTrue(encoded.startsWith(EscapedRunLengthCodec.HEADER));
            assertEquals(text.toString(), codec.decode(encoded));
        }
    }

    @Test
    void testEncodeRejectsEmptyText() {
        RleCodecException e = assertThrows(RleCodecException.class, () -> codec.encode(""));
        assertEquals(RleCodecException.Kind.EMPTY_INPUT, e.getKind());
    }

    @Test
    void testNullInput() {
        assertEquals(RleCodecException.Kind.INVALID_INPUT_TYPE,
                assertThrows(RleCodecException.class, () -> codec.encode(null)).getKind());
        assertEquals(RleCodecException.Kind.INVALID_INPUT_TYPE, decodeFailure(null));
    }

    @Test
    void testDecodeRejectsMalformedStreams() {
        assertEquals(RleCodecException.Kind.MISSING_HEADER, decodeFailure("A4"));
        assertEquals(RleCodecException.Kind.MISSING_HEADER, decodeFailure("#00A"));
        assertEquals(RleCodecException.Kind.DANGLING_ESCAPE, decodeFailure("##00#"));
        assertEquals(RleCodecException.Kind.INVALID_ESCAPE, decodeFailure("##00#x"));
        assertEquals(RleCodecException.Kind.MALFORMED_COUNT, decodeFailure("##00A01"));
        assertEquals(RleCodecException.Kind.MALFORMED_COUNT, decodeFailure("##00A0"));
        assertEquals(RleCodecException.Kind.MALFORMED_COUNT, decodeFailure("##005A"));
    }

    @Test
    void testHeaderOnlyStreamIsRejected() {
        RleCodecException e = assertThrows(RleCodecException.class, () -> codec.decode("##00"));
        assertEquals(RleCodecException.Kind.EMPTY_BODY, e.getKind());
        assertEquals(4, e.getPosition());
    }

    @Test
    void testErrorPositionIsRelativeToWholeStream() {
        RleCodecException e = assertThrows(RleCodecException.class, () -> codec.decode("##00AB#q"));
        assertEquals(6, e.getPosition());
    }

    @Test
    void testDecodedLengthLimit() {
        EscapedRunLengthCodec limited = new EscapedRunLengthCodec(10);
        assertEquals("A".repeat(10), limited.decode("##00A10"));
        RleCodecException e = assertThrows(RleCodecException.class, () -> limited.decode("##00A10B"));
        assertEquals(RleCodecException.Kind.OUTPUT_TOO_LARGE, e.getKind());
        assertEquals(RleCodecException.Kind.OUTPUT_TOO_LARGE, decodeFailure("##00A2000000000"));
    }

    @Test
    void testLooksEncoded() {
        assertTrue(codec.looksEncoded("##00A4"));
        assertFalse(codec.looksEncoded("A4"));
        assertFalse(codec.looksEncoded(null));
    }

    @Test
    void testNonPositiveLimitIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new EscapedRunLengthCodec(0));
    }
}
