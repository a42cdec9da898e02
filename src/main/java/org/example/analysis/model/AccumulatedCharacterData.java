package org.example.analysis.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Running aggregate for one character across the batches of a chapter. Traits keep
 * first-seen order without duplicates; dialogs are kept in page order.
 */
public record AccumulatedCharacterData(
    String name,
    List<String> traits,
    VoiceProfile voiceProfile,
    Integer speakerId,
    List<DialogEntry> dialogs
) {

    public AccumulatedCharacterData {
        Objects.requireNonNull(name, "name");
        traits = traits == null ? List.of() : List.copyOf(new LinkedHashSet<>(traits));
        dialogs = dialogs == null ? List.of() : List.copyOf(dialogs);
    }

    public static AccumulatedCharacterData named(String name) {
        return new AccumulatedCharacterData(name, List.of(), null, null, List.of());
    }

    /**
     * Folds a newer partial record for the same character into this one.
     * A repeated (pageNumber, text) dialog takes the newer emotion and intensity.
     */
    public AccumulatedCharacterData mergeWith(AccumulatedCharacterData newer) {
        if (!name.equals(newer.name())) {
            throw new IllegalArgumentException("Cannot merge '" + newer.name() + "' into '" + name + "'");
        }

        LinkedHashSet<String> mergedTraits = new LinkedHashSet<>(traits);
        mergedTraits.addAll(newer.traits());

        Map<String, DialogEntry> byKey = new LinkedHashMap<>();
        for (DialogEntry dialog : dialogs) {
            byKey.put(dialogKey(dialog), dialog);
        }
        for (DialogEntry dialog : newer.dialogs()) {
            byKey.put(dialogKey(dialog), dialog);
        }
        List<DialogEntry> mergedDialogs = new ArrayList<>(byKey.values());
        mergedDialogs.sort(Comparator.comparingInt(DialogEntry::pageNumber));

        return new AccumulatedCharacterData(
            name,
            new ArrayList<>(mergedTraits),
            newer.voiceProfile() != null ? newer.voiceProfile() : voiceProfile,
            newer.speakerId() != null ? newer.speakerId() : speakerId,
            mergedDialogs
        );
    }

    private static String dialogKey(DialogEntry dialog) {
        return dialog.pageNumber() + "\u0000" + dialog.text();
    }
}
