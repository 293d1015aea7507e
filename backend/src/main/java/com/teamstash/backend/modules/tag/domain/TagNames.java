package com.teamstash.backend.modules.tag.domain;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Parsing and normalisation of free-text tag input. Comparison always happens on the
 * trimmed, lower-cased form.
 */
public final class TagNames {

    public static final int MAX_LENGTH = 50;

    private TagNames() {
    }

    public static String normalize(String raw) {
        return raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Normalised, de-duplicated, non-empty names. Input order and repetitions do not matter.
     */
    public static Set<String> normalize(Collection<String> rawNames) {
        Set<String> names = new LinkedHashSet<>();
        if (rawNames == null) {
            return names;
        }
        for (String raw : rawNames) {
            String name = normalize(raw);
            if (!name.isEmpty()) {
                names.add(name);
            }
        }
        return names;
    }

    /**
     * Splits comma-separated input such as {@code "food, dairy,,frozen "}.
     */
    public static List<String> splitCsv(String csv) {
        if (csv == null || csv.isBlank()) {
            return List.of();
        }
        return Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(name -> !name.isEmpty())
                .toList();
    }

    public static List<String> tooLong(Collection<String> rawNames) {
        return normalize(rawNames).stream()
                .filter(name -> name.length() > MAX_LENGTH)
                .toList();
    }
}
