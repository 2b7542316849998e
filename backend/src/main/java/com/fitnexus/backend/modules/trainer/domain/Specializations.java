package com.fitnexus.backend.modules.trainer.domain;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Converts between the stored comma-delimited specialization column and its list form.
 */
public final class Specializations {

    public static final String DELIMITER = ",";

    private Specializations() {
    }

    public static String join(Collection<String> specializations) {
        if (specializations == null || specializations.isEmpty()) {
            return "";
        }
        return specializations.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .peek(Specializations::rejectDelimiter)
                .collect(Collectors.toCollection(LinkedHashSet::new))
                .stream()
                .collect(Collectors.joining(DELIMITER));
    }

    public static List<String> split(String stored) {
        if (stored == null || stored.isBlank()) {
            return List.of();
        }
        return Arrays.stream(stored.split(DELIMITER))
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .toList();
    }

    private static void rejectDelimiter(String value) {
        if (value.contains(DELIMITER)) {
            throw new IllegalArgumentException("specialization must not contain '" + DELIMITER + "': " + value);
        }
    }
}
