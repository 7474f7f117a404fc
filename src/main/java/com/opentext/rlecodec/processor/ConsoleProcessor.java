package com.opentext.rlecodec.processor;

import com.opentext.rlecodec.model.CodecFormat;
import com.opentext.rlecodec.model.CodecResult;
import com.opentext.rlecodec.model.LineSequence;
import com.opentext.rlecodec.service.CodecService;
import com.opentext.rlecodec.service.RleCodecException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.Iterator;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Interactive front end: prompts for a line, encodes or decodes it and prints the result.
 * <p>
 * Lines are cleaned and screened according to the active {@link CodecFormat}; empty or refused
 * lines are reported and the prompt is repeated. Codec errors are printed as
 * {@code Error: <message>}. Unless {@code console.continuous} is set, processing stops after the
 * first non-empty line; it always stops when the input is exhausted.
 * </p>
 */
@Slf4j
@Component
public class ConsoleProcessor {

    private final CodecService codecService;

    @Value("${console.prompt:}")
    private String prompt;

    @Value("${console.continuous:false}")
    private boolean continuous;

    @Autowired
    public ConsoleProcessor(CodecService codecService) {
        this.codecService = codecService;
    }

    /**
     * Consume lines from the sequence and write prompts and results to {@code out}.
     * @return the number of lines that were encoded or decoded successfully
     */
    public int process(LineSequence sequence, PrintStream out) {
        CodecFormat format = codecService.getFormat();
        String effectivePrompt = prompt != null && !prompt.isBlank() ? prompt : format.getPrompt();
        int succeeded = 0;
        try (Stream<String> lines = sequence.getLines()) {
            Iterator<String> iterator = lines.iterator();
            while (true) {
                out.print(effectivePrompt);
                out.flush();
                if (!iterator.hasNext()) {
                    out.println();
                    break;
                }
                String line = format.normalize(iterator.next());
                if (line.isEmpty()) {
                    out.println(format.getEmptyInputMessage());
                    continue;
                }
                Optional<String> rejection = format.screen(line);
                if (rejection.isPresent()) {
                    out.println(rejection.get());
                    continue;
                }
                if (handleLine(line, format, out)) {
                    succeeded++;
                }
                if (!continuous) {
                    break;
                }
            }
        }
        return succeeded;
    }

    private boolean handleLine(String line, CodecFormat format, PrintStream out) {
        try {
            CodecResult result = codecService.process(line);
            out.println(format.resultLabel(result.getOperation()) + " => " + result.getOutput());
            return true;
        } catch (RleCodecException e) {
            if (log.isDebugEnabled()) {
                log.debug("Rejected input ({}): {}", e.getKind(), e.getMessage());
            }
            out.println("Error: " + e.getMessage());
            return false;
        }
    }
}
