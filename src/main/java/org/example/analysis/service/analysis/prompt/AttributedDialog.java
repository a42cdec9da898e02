package org.example.analysis.service.analysis.prompt;

public record AttributedDialog(String speaker, String text, String emotion, double intensity) {}
