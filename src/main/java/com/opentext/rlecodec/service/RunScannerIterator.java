package com.opentext.rlecodec.service;

import com.opentext.rlecodec.model.Run;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Iterator that groups text into maximal runs of identical code points.
 * A new run starts exactly when the next code point differs from the current one
 * (e.g. "AAB#" -> (A,2), (B,1), (#,1)). Surrogate pairs are scanned as one code point.
 */
public class RunScannerIterator implements Iterator<Run> {
    private final String text;
    private int index;
    private Run nextRun;

    public RunScannerIterator(String text) {
        this.text = text;
        advanceGroup();
    }

    private void advanceGroup() {
        if (index >= text.length()) {
            nextRun = null;
            return;
        }
        int currentChar = text.codePointAt(index);
        int width = Character.charCount(currentChar);
        int count = 1;
        index += width;
        while (index < text.length() && text.codePointAt(index) == currentChar) {
            count++;
            index += width;
        }
        nextRun = new Run(currentChar, count);
    }

    @Override
    public boolean hasNext() {
        return nextRun != null;
    }

    @Override
    public Run next() {
        if (!hasNext()) throw new NoSuchElementException();
        Run toReturn = nextRun;
        advanceGroup();
        return toReturn;
    }
}
