package org.example.analysis.service.analysis.task;

import org.example.analysis.model.AccumulatedCharacterData;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-chapter running aggregate of characters keyed by exact name. Owned by a single
 * task; not thread-safe.
 */
public class CharacterAccumulator {

    private final Map<String, AccumulatedCharacterData> characters = new LinkedHashMap<>();

    public void merge(AccumulatedCharacterData partial) {
        characters.merge(partial.name(), partial, AccumulatedCharacterData::mergeWith);
    }

    public void mergeAll(List<AccumulatedCharacterData> partials) {
        for (AccumulatedCharacterData partial : partials) {
            merge(partial);
        }
    }

    /** Replaces the current state with a checkpointed snapshot. */
    public void restore(List<AccumulatedCharacterData> snapshot) {
        characters.clear();
        mergeAll(snapshot);
    }

    public AccumulatedCharacterData get(String name) {
        return characters.get(name);
    }

    public List<String> names() {
        return new ArrayList<>(characters.keySet());
    }

    public List<AccumulatedCharacterData> snapshot() {
        return List.copyOf(characters.values());
    }

    public int size() {
        return characters.size();
    }
}
