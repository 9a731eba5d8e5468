package com.eainde.specmap.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Validates raw model output against the extraction record schema.
 *
 * <pre>
 * [
 *   {"spec_name": "Luminance", "value": 1000, "unit": "cd/m²",
 *    "condition": "25°C", "confidence": 0.95, "source_text": "Luminance: ≥ 1000 cd/m²"}
 * ]
 * </pre>
 *
 * <p>The response is treated as untrusted: one invalid element rejects the whole response so
 * the corrective retry sees every problem at once. A markdown code fence around the array is
 * tolerated. An empty array is a valid answer.</p>
 */
public class ExtractionResponseParser {

    private static final Pattern FENCE = Pattern.compile("^```(?:json)?\\s*(.*?)\\s*```$", Pattern.DOTALL);
    private static final Pattern NUMERIC = Pattern.compile("[-+]?\\d+(\\.\\d+)?");

    private final ObjectMapper objectMapper;

    public ExtractionResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ParsedResponse parse(String response) {
        if (response == null || response.isBlank()) {
            return ParsedResponse.rejected(List.of("response is empty"));
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(stripFence(response.strip()));
        } catch (JsonProcessingException e) {
            return ParsedResponse.rejected(List.of("response is not valid JSON: " + e.getOriginalMessage()));
        }
        if (root == null || !root.isArray()) {
            return ParsedResponse.rejected(List.of("response must be a JSON array of records"));
        }

        List<ExtractedRecord> records = new ArrayList<>();
        List<String> violations = new ArrayList<>();
        for (int i = 0; i < root.size(); i++) {
            validate(root.get(i), i, records, violations);
        }
        return violations.isEmpty() ? ParsedResponse.accepted(records) : ParsedResponse.rejected(violations);
    }

    public static String stripFence(String text) {
        Matcher m = FENCE.matcher(text);
        return m.matches() ? m.group(1) : text;
    }

    private void validate(JsonNode node, int index, List<ExtractedRecord> records, List<String> violations) {
        String at = "record " + index + ": ";
        if (!node.isObject()) {
            violations.add(at + "is not an object");
            return;
        }
        int before = violations.size();

        JsonNode name = node.get("spec_name");
        if (name == null || !name.isTextual() || name.asText().isBlank()) {
            violations.add(at + "spec_name is missing or blank");
        }

        Double value = numeric(node.get("value"));
        if (value == null) {
            violations.add(at + "value is missing or not numeric");
        }

        JsonNode unit = node.get("unit");
        if (unit == null || !unit.isTextual()) {
            violations.add(at + "unit is missing or not a string");
        }

        JsonNode confidence = node.get("confidence");
        if (confidence == null || !confidence.isNumber()) {
            violations.add(at + "confidence is missing or not a number");
        } else if (confidence.asDouble() < 0.0 || confidence.asDouble() > 1.0) {
            violations.add(at + "confidence " + confidence.asDouble() + " is outside [0,1]");
        }

        JsonNode condition = node.get("condition");
        if (condition != null && !condition.isNull() && !condition.isTextual()) {
            violations.add(at + "condition must be a string or null");
        }

        if (violations.size() > before) {
            return;
        }
        records.add(new ExtractedRecord(
                name.asText().strip(),
                value,
                unit.asText().strip(),
                textOrNull(condition),
                confidence.asDouble(),
                textOrNull(node.get("source_text"))));
    }

    private static Double numeric(JsonNode node) {
        if (node == null) {
            return null;
        }
        if (node.isNumber()) {
            double v = node.asDouble();
            return Double.isFinite(v) ? v : null;
        }
        if (node.isTextual() && NUMERIC.matcher(node.asText().strip()).matches()) {
            return Double.parseDouble(node.asText().strip());
        }
        return null;
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isNull() || !node.isTextual() || node.asText().isBlank()) {
            return null;
        }
        return node.asText().strip();
    }
}
