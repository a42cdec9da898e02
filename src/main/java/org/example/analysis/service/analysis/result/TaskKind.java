package org.example.analysis.service.analysis.result;

import java.util.Locale;
import java.util.Optional;

public enum TaskKind {
    CHARACTERS,
    FORESHADOWING,
    PLOT_OUTLINE,
    THEME;

    /**
     * Parses path-style names such as {@code plot-outline} as well as enum names.
     */
    public static Optional<TaskKind> fromString(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (TaskKind kind : values()) {
            if (kind.name().equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
