package org.example.analysis.model;

import java.util.ArrayList;
import java.util.List;

public record VoiceProfile(
    String gender,
    String age,
    String accent,
    double pitch,
    double speed
) {
    public static final String DEFAULT_GENDER = "male";
    public static final String DEFAULT_AGE = "middle-aged";
    public static final String DEFAULT_ACCENT = "neutral";

    /**
     * Parses the compact "Gender,Age,Accent[,Pitch,Speed]" form. Returns null when
     * fewer than three comma-separated parts are present.
     */
    public static VoiceProfile fromCompact(String compact) {
        if (compact == null || !compact.contains(",")) {
            return null;
        }
        List<String> parts = new ArrayList<>();
        for (String part : compact.split(",")) {
            parts.add(part.trim());
        }
        if (parts.size() < 3) {
            return null;
        }
        return new VoiceProfile(
            orDefault(parts.get(0), DEFAULT_GENDER),
            orDefault(parts.get(1), DEFAULT_AGE),
            orDefault(parts.get(2), DEFAULT_ACCENT),
            parts.size() > 3 ? parseFactor(parts.get(3)) : 1.0,
            parts.size() > 4 ? parseFactor(parts.get(4)) : 1.0
        );
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }

    private static double parseFactor(String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            return 1.0;
        }
    }
}
