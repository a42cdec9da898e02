package org.example.analysis.service.analysis.prompt;

import org.example.analysis.model.Foreshadowing;

import java.util.List;

public record ForeshadowingOutput(List<Foreshadowing> foreshadowings) {

    public static ForeshadowingOutput empty() {
        return new ForeshadowingOutput(List.of());
    }
}
