package com.oracle.optmcts.search;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Generated programs print the optimal objective value last; the answer is the last number in stdout.
 */
public final class AnswerExtractor {

    private static final Pattern NUMBER = Pattern.compile("[-+]?(?:\\d+\\.\\d*|\\.\\d+|\\d+)(?:[eE][-+]?\\d+)?");

    private AnswerExtractor() {
    }

    public static Optional<Double> lastNumber(String output) {
        if (output == null || output.isBlank()) {
            return Optional.empty();
        }
        Matcher m = NUMBER.matcher(output);
        String last = null;
        while (m.find()) {
            last = m.group();
        }
        if (last == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Double.parseDouble(last));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
