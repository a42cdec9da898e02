package org.example.analysis.service.analysis.prompt;

import com.fasterxml.jackson.databind.JsonNode;
import org.example.analysis.model.PlotPoint;
import org.example.analysis.model.PlotPointType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Extracts the major story structure elements from sampled chapters.
 */
@Component
public class PlotPointPrompt implements PromptDefinition<ChapterSamplesInput, PlotPointOutput> {

    private static final Logger log = LoggerFactory.getLogger(PlotPointPrompt.class);

    private final TokenBudget tokenBudget = new TokenBudget(350, 2700, 900);

    @Override
    public String promptId() {
        return "plot_point_extraction_v1";
    }

    @Override
    public String displayName() {
        return "Plot Point Extraction";
    }

    @Override
    public String purpose() {
        return "Extract major story structure elements from chapters";
    }

    @Override
    public TokenBudget tokenBudget() {
        return tokenBudget;
    }

    @Override
    public double temperature() {
        return 0.2;
    }

    @Override
    public String systemPrompt() {
        return "You are a literary analyst specializing in narrative structure. "
                + "Analyze the following chapters to identify the major plot points.";
    }

    @Override
    public ChapterSamplesInput prepareInput(ChapterSamplesInput input) {
        return input.fairlyTruncated(tokenBudget.maxInputChars());
    }

    @Override
    public String buildUserPrompt(ChapterSamplesInput input) {
        return """
                Analyze these chapters and identify the major plot points:

                %s

                Identify where these story elements occur:
                1. Exposition - introduction of setting, characters, and initial situation
                2. Inciting Incident - the event that sets the main conflict in motion
                3. Rising Action - events building tension toward the climax
                4. Midpoint - a turning point that changes the story's direction
                5. Climax - the peak of conflict and tension
                6. Falling Action - events after the climax
                7. Resolution - final outcome and closure

                Return JSON array:
                [
                  {"type": "Exposition", "chapter": 1, "description": "Brief description", "confidence": 0.9},
                  {"type": "Inciting Incident", "chapter": 2, "description": "Brief description", "confidence": 0.85}
                ]

                Only include plot points you can identify with confidence. Return ONLY the JSON array.""".formatted(input.renderChapters());
    }

    @Override
    public PlotPointOutput parseResponse(String response) {
        try {
            Optional<JsonNode> extracted = JsonResponseExtractor.extract(response);
            if (extracted.isEmpty()) {
                log.warn("No JSON in plot point response");
                return PlotPointOutput.empty();
            }
            JsonNode root = extracted.get();
            JsonNode array = root.isArray() ? root : root.get("plot_points");
            if (array == null || !array.isArray()) {
                return PlotPointOutput.empty();
            }

            List<PlotPoint> plotPoints = new ArrayList<>();
            for (JsonNode item : array) {
                if (!item.isObject()) {
                    continue;
                }
                Optional<PlotPointType> type = PlotPointType.fromString(
                        JsonResponseExtractor.textOrDefault(item, "type", null));
                String description = JsonResponseExtractor.textOrDefault(item, "description", "");
                if (type.isEmpty() || description.isBlank()) {
                    continue;
                }
                JsonNode chapter = item.get("chapter");
                int chapterNumber = chapter != null && chapter.canConvertToInt() ? chapter.asInt() : 1;
                plotPoints.add(new PlotPoint(
                        type.get(),
                        Math.max(0, chapterNumber - 1),
                        description,
                        JsonResponseExtractor.doubleOrDefault(item, "confidence", 0.8)
                ));
            }
            plotPoints.sort(Comparator.comparing(PlotPoint::type));
            return new PlotPointOutput(plotPoints);
        } catch (RuntimeException e) {
            log.warn("Error parsing plot points response: {}", e.getMessage());
            return PlotPointOutput.empty();
        }
    }
}
