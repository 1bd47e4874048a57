package io.kneo.programmer.service.catalog;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Expands {@code 6}, {@code "2..10"} or {@code [1, "3..6", 9]} into a set of ints.
 */
public final class RangeExpander {
    private static final String RANGE_SEPARATOR = "..";

    private RangeExpander() {
    }

    public static Set<Integer> expand(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Collection<?> items) {
            Set<Integer> result = new HashSet<>();
            for (Object item : items) {
                result.addAll(parseOne(item));
            }
            return result;
        }
        return parseOne(value);
    }

    private static Set<Integer> parseOne(Object value) {
        if (value instanceof Number number) {
            return Set.of(number.intValue());
        }
        String text = String.valueOf(value).trim();
        int separator = text.indexOf(RANGE_SEPARATOR);
        if (separator >= 0) {
            try {
                int lo = Integer.parseInt(text.substring(0, separator).trim());
                int hi = Integer.parseInt(text.substring(separator + RANGE_SEPARATOR.length()).trim());
                Set<Integer> result = new HashSet<>();
                for (int i = lo; i <= hi; i++) {
                    result.add(i);
                }
                return result;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid range syntax: '" + text + "'", e);
            }
        }
        try {
            return Set.of(Integer.parseInt(text));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Cannot parse as integer or range: '" + text + "'", e);
        }
    }
}
