package org.example.analysis.service.analysis.prompt;

public record BatchTextInput(String text, int batchIndex, int totalBatches) {}
