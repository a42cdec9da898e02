package org.example.analysis.model;

import java.util.Optional;

/**
 * Story structure elements, declared in narrative arc order.
 */
public enum PlotPointType {
    EXPOSITION("Exposition"),
    INCITING_INCIDENT("Inciting Incident"),
    RISING_ACTION("Rising Action"),
    MIDPOINT("Midpoint"),
    CLIMAX("Climax"),
    FALLING_ACTION("Falling Action"),
    RESOLUTION("Resolution");

    private final String displayName;

    PlotPointType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Accepts either the enum name ("RISING_ACTION", "rising action") or the display name.
     */
    public static Optional<PlotPointType> fromString(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().replace(' ', '_').replace('-', '_');
        for (PlotPointType type : values()) {
            if (type.name().equalsIgnoreCase(normalized) || type.displayName.equalsIgnoreCase(value.trim())) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
