package com.example.circlecrawler;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void dropsShaLine() {
        assertThat(sanitize("line1\nCIRCLE_SHA1=abcd\nline3")).isEqualTo("line1\nline3");
    }

    @Test
    void keepsEmptySegmentsAndTrailingNewline() {
        assertThat(sanitize("\nfirst\n\nexport CIRCLE_SHA1=ff00\nlast\n")).isEqualTo("\nfirst\n\nlast\n");
    }

    @Test
    void markerOnFirstOrLastLineLeavesNoDanglingNewline() {
        assertThat(sanitize("CIRCLE_SHA1=1\nbody")).isEqualTo("body");
        assertThat(sanitize("body\nCIRCLE_SHA1=1")).isEqualTo("body");
        assertThat(sanitize("CIRCLE_SHA1=1")).isEmpty();
    }

    @Test
    void leavesPartialMarkersAndCarriageReturnsAlone() {
        assertThat(sanitize("CIRCLE_SHA1 is printed below\r\nCIRCLE_SHA=1\r\n"))
                .isEqualTo("CIRCLE_SHA1 is printed below\r\nCIRCLE_SHA=1\r\n");
    }

    @Test
    void emptyInputStaysEmpty() {
        assertThat(LogSanitizer.sanitize(new byte[0])).isEmpty();
    }

    @Test
    void nonUtf8BytesPassThroughUntouched() {
        byte[] input = {(byte) 0xff, (byte) 0xfe, '\n', 'o', 'k'};

        assertThat(LogSanitizer.sanitize(input)).containsExactly(input);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "\n",
            "\n\n\n",
            "a\nCIRCLE_SHA1=\nb",
            "CIRCLE_SHA1=x\nCIRCLE_SHA1=y\n",
            "x CIRCLE_SHA1=CIRCLE_SHA1= y\nz\n\n",
            "#!/bin/bash -eo pipefail\nexport CIRCLE_SHA1=deadbeef\nnpm test\n\nok"
    })
    void outputHasNoMarkerKeepsOtherLinesInOrderAndIsIdempotent(String input) {
        String once = sanitize(input);

        assertThat(once).doesNotContain("CIRCLE_SHA1=");
        assertThat(lines(once)).isEqualTo(Arrays.stream(input.split("\n", -1))
                .filter(line -> !line.contains("CIRCLE_SHA1="))
                .collect(Collectors.toList()));
        assertThat(sanitize(once)).isEqualTo(once);
    }

    private static List<String> lines(String value) {
        return Arrays.asList(value.split("\n", -1));
    }

    private static String sanitize(String value) {
        return new String(LogSanitizer.sanitize(value.getBytes(StandardCharsets.UTF_8)), StandardCharsets.UTF_8);
    }
}
