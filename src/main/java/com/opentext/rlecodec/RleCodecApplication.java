package com.opentext.rlecodec;

import com.opentext.rlecodec.processor.ConsoleProcessor;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ApplicationContext;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Spring Boot entry point. After startup it reads lines from standard input and encodes
 * or decodes them with the configured codec.
 */
@SpringBootApplication
public class RleCodecApplication {

    public static void main(String[] args) {
        ApplicationContext context = SpringApplication.run(RleCodecApplication.class, args);
        ConsoleProcessor processor = context.getBean(ConsoleProcessor.class);

        BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        processor.process(reader::lines, System.out);
    }
}
