package com.example.circlecrawler;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Removes the {@code CIRCLE_SHA1=} lines CircleCI prints into every action log. The commit
 * hash looks like a high-entropy secret to scanners and would otherwise be reported in
 * every build.
 */
public final class LogSanitizer {
    static final byte[] MARKER = "CIRCLE_SHA1=".getBytes(StandardCharsets.US_ASCII);
    private static final byte NEWLINE = '\n';

    private LogSanitizer() {
    }

    /**
     * Splits on {@code '\n'}, drops segments containing the marker and joins the rest with
     * {@code '\n'}. Empty segments are kept, so the result is exactly filter-then-join.
     */
    public static byte[] sanitize(byte[] input) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(input.length);
        boolean first = true;
        int start = 0;
        for (int i = 0; i <= input.length; i++) {
            if (i < input.length && input[i] != NEWLINE) {
                continue;
            }
            if (!contains(input, start, i, MARKER)) {
                if (!first) {
                    out.write(NEWLINE);
                }
                out.write(input, start, i - start);
                first = false;
            }
            start = i + 1;
        }
        return out.toByteArray();
    }

    private static boolean contains(byte[] data, int from, int to, byte[] needle) {
        outer:
        for (int i = from; i <= to - needle.length; i++) {
            for (int j = 0; j < needle.length; j++) {
                if (data[i + j] != needle[j]) {
                    continue outer;
                }
            }
            return true;
        }
        return false;
    }
}
