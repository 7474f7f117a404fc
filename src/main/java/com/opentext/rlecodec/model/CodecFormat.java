package com.opentext.rlecodec.model;

import java.util.Optional;

/**
 * Supported wire formats.
 * <p>
 * ESCAPED handles any text: encoded streams start with the {@code ##00} header and literal
 * {@code #} or digits are escaped. LETTERS is the older plain form restricted to ASCII letters,
 * where any digit in the input marks it as encoded.
 * </p>
 * <p>
 * Each format also carries its console behaviour: the prompt, how a line is cleaned before use,
 * which lines are refused before reaching the codec, and how results are labelled.
 * </p>
 */
public enum CodecFormat {
    ESCAPED("Enter text (starts with '##00' to decode; otherwise encode): ",
            "Invalid input: input cannot be empty.",
            "Encoded") {
        @Override
        public String normalize(String line) {
            return line;
        }

        @Override
        public Optional<String> screen(String line) {
            return Optional.empty();
        }
    },
    LETTERS("Enter a string (alphabetic to encode, or RLE to decode): ",
            "Invalid input: Input cannot be empty.",
            "Encoded (compressed)") {
        @Override
        public String normalize(String line) {
            return line.strip();
        }

        @Override
        public Optional<String> screen(String line) {
            boolean lettersAndDigits = line.chars().allMatch(c ->
                    (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9'));
            return lettersAndDigits
                    ? Optional.empty()
                    : Optional.of("Invalid input: Use only letters A–Z/a–z and digits 0–9 (no spaces).");
        }
    };

    private final String prompt;
    private final String emptyInputMessage;
    private final String encodedLabel;

    CodecFormat(String prompt, String emptyInputMessage, String encodedLabel) {
        this.prompt = prompt;
        this.emptyInputMessage = emptyInputMessage;
        this.encodedLabel = encodedLabel;
    }

    /** @return the console prompt shown when this format is active */
    public String getPrompt() {
        return prompt;
    }

    /** @return the message printed when a line is empty after {@link #normalize(String)} */
    public String getEmptyInputMessage() {
        return emptyInputMessage;
    }

    /** @return the label printed in front of a result produced by {@code operation} */
    public String resultLabel(CodecOperation operation) {
        return operation == CodecOperation.DECODE ? "Decoded" : encodedLabel;
    }

    /** Clean a console line before it is checked and processed. ESCAPED keeps surrounding spaces. */
    public abstract String normalize(String line);

    /**
     * Check a non-empty, normalized console line before it reaches the codec.
     * @return the message to print and re-prompt with, or empty if the line is acceptable
     */
    public abstract Optional<String> screen(String line);
}
