package com.modelmonitor.service;

import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives the next version label from the current one: the trailing number is incremented
 * ({@code v3 → v4}, {@code 1.2 → 1.3}); a label without one gets {@code .1} appended.
 */
final class ModelVersionNaming {

    private static final Pattern TRAILING_NUMBER = Pattern.compile("^(.*?)(\\d+)$");

    private ModelVersionNaming() {
    }

    static String next(String current) {
        Matcher m = TRAILING_NUMBER.matcher(current);
        if (m.matches()) {
            String digits = m.group(2);
            long incremented = Long.parseLong(digits) + 1;
            return m.group(1) + String.format("%0" + digits.length() + "d", incremented);
        }
        return current + ".1";
    }

    /**
     * Keeps incrementing while {@code taken} reports the label as used.
     */
    static String next(String current, Predicate<String> taken) {
        String candidate = next(current);
        while (taken.test(candidate)) {
            candidate = next(candidate);
        }
        return candidate;
    }
}
