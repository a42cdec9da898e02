package org.example.analysis.service.analysis.prompt;

import org.example.analysis.model.PlotPoint;
import org.example.analysis.model.PlotPointType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PlotPointPromptTest {

    private final PlotPointPrompt prompt = new PlotPointPrompt();

    @Test
    void parseResponse_sortsByArcOrderAndDropsInvalid() {
        String response = """
                [
                  {"type": "Climax", "chapter": 9, "description": "The duel", "confidence": 0.9},
                  {"type": "Exposition", "chapter": 1, "description": "The Bennets at home"},
                  {"type": "Epilogue", "chapter": 10, "description": "Unknown type"},
                  {"type": "Midpoint", "chapter": 5, "description": " "},
                  {"type": "inciting incident", "chapter": 0, "description": "Bingley arrives"}
                ]""";

        List<PlotPoint> points = prompt.parseResponse(response).plotPoints();

        assertEquals(3, points.size());
        assertEquals(PlotPointType.EXPOSITION, points.get(0).type());
        assertEquals(0, points.get(0).chapterIndex());
        assertEquals(0.8, points.get(0).confidence(), 0.0001);
        assertEquals(PlotPointType.INCITING_INCIDENT, points.get(1).type());
        assertEquals(0, points.get(1).chapterIndex());
        assertEquals(PlotPointType.CLIMAX, points.get(2).type());
        assertEquals(8, points.get(2).chapterIndex());
    }

    @Test
    void parseResponse_malformed_returnsEmpty() {
        assertTrue(prompt.parseResponse("The story has no clear structure.").plotPoints().isEmpty());
        assertTrue(prompt.parseResponse("{\"summary\": \"nothing\"}").plotPoints().isEmpty());
    }
}
