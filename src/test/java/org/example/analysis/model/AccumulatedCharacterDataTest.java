package org.example.analysis.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AccumulatedCharacterDataTest {

    private static final VoiceProfile YOUNG_WOMAN = new VoiceProfile("female", "young", "English", 1.0, 1.0);

    @Test
    void mergeWith_unionsTraitsInFirstSeenOrder() {
        AccumulatedCharacterData older = new AccumulatedCharacterData("Lizzy", List.of("brave"), null, null, List.of());
        AccumulatedCharacterData newer = new AccumulatedCharacterData("Lizzy", List.of("kind", "brave"), null, null, List.of());

        assertEquals(List.of("brave", "kind"), older.mergeWith(newer).traits());
    }

    @Test
    void mergeWith_newerVoiceAndSpeakerWinOnlyWhenPresent() {
        AccumulatedCharacterData older = new AccumulatedCharacterData("Lizzy", List.of(), YOUNG_WOMAN, 3, List.of());
        AccumulatedCharacterData newer = new AccumulatedCharacterData("Lizzy", List.of(), null, null, List.of());

        AccumulatedCharacterData merged = older.mergeWith(newer);

        assertEquals(YOUNG_WOMAN, merged.voiceProfile());
        assertEquals(3, merged.speakerId().intValue());
    }

    @Test
    void mergeWith_replacesRepeatedDialogAndSortsByPage() {
        AccumulatedCharacterData older = new AccumulatedCharacterData("Lizzy", List.of(), null, null, List.of(
                new DialogEntry(4, "Later line", "neutral", 0.5),
                new DialogEntry(1, "Early line", "neutral", 0.5)));
        AccumulatedCharacterData newer = new AccumulatedCharacterData("Lizzy", List.of(), null, null, List.of(
                new DialogEntry(4, "Later line", "angry", 0.9),
                new DialogEntry(2, "Middle line", "sad", 0.3)));

        AccumulatedCharacterData merged = older.mergeWith(newer);

        assertEquals(List.of(
                new DialogEntry(1, "Early line", "neutral", 0.5),
                new DialogEntry(2, "Middle line", "sad", 0.3),
                new DialogEntry(4, "Later line", "angry", 0.9)), merged.dialogs());
    }

    @Test
    void mergeWith_differentName_throws() {
        assertThrows(IllegalArgumentException.class,
                () -> AccumulatedCharacterData.named("Jane").mergeWith(AccumulatedCharacterData.named("Lydia")));
    }

    @Test
    void constructor_dropsDuplicateTraits() {
        AccumulatedCharacterData data = new AccumulatedCharacterData("Kitty", List.of("silly", "silly", "young"),
                null, null, null);

        assertEquals(List.of("silly", "young"), data.traits());
        assertEquals(List.of(), data.dialogs());
    }

    @Test
    void voiceProfile_fromCompact() {
        VoiceProfile profile = VoiceProfile.fromCompact("male, elderly, , 0.8");

        assertEquals("male", profile.gender());
        assertEquals("elderly", profile.age());
        assertEquals(VoiceProfile.DEFAULT_ACCENT, profile.accent());
        assertEquals(0.8, profile.pitch(), 0.0001);
        assertEquals(1.0, profile.speed(), 0.0001);
        assertNull(VoiceProfile.fromCompact("female"));
        assertNull(VoiceProfile.fromCompact("female,young"));
    }

    @Test
    void plotPointType_fromString() {
        assertEquals(PlotPointType.RISING_ACTION, PlotPointType.fromString("Rising Action").orElseThrow());
        assertEquals(PlotPointType.FALLING_ACTION, PlotPointType.fromString("falling-action").orElseThrow());
        assertEquals(PlotPointType.CLIMAX, PlotPointType.fromString("CLIMAX").orElseThrow());
        assertTrue(PlotPointType.fromString("Denouement").isEmpty());
    }
}
