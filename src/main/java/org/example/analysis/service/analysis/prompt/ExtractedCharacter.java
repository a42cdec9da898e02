package org.example.analysis.service.analysis.prompt;

import org.example.analysis.model.VoiceProfile;

import java.util.List;

public record ExtractedCharacter(
    String name,
    List<String> dialogs,
    List<String> traits,
    VoiceProfile voiceProfile
) {}
