package org.example.analysis.service.analysis.prompt;

import java.util.List;

public record DialogExtractionInput(List<String> characterNames, String text) {}
