package com.gladlabs.orchestrator.core.quality;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Lenient parser for QA model responses.
 * <p>
 * Accepts JSON wrapped in markdown fences or surrounded by prose, reads the score from
 * {@code score} or {@code quality_score}, and normalizes 0-10 and 0-100 scales to [0,1].
 */
public class QualityAssessmentParser {

    private static final Logger log = LoggerFactory.getLogger(QualityAssessmentParser.class);

    private final ObjectMapper mapper;

    public QualityAssessmentParser() {
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public QualityAssessment parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new AssessmentParseException("QA response was empty");
        }
        String cleaned = extractJson(raw);
        JsonNode root;
        try {
            root = mapper.readTree(cleaned);
        } catch (JsonProcessingException e) {
            log.debug("Raw QA response: {}", raw);
            throw new AssessmentParseException("QA response is not valid JSON: " + e.getOriginalMessage(), e);
        }
        JsonNode scoreNode = root.has("score") ? root.get("score") : root.get("quality_score");
        if (scoreNode == null || !(scoreNode.isNumber() || scoreNode.isTextual())) {
            throw new AssessmentParseException("QA response has no score field");
        }
        double score;
        try {
            score = scoreNode.isNumber() ? scoreNode.asDouble() : Double.parseDouble(scoreNode.asText().trim());
        } catch (NumberFormatException e) {
            throw new AssessmentParseException("QA score is not a number: " + scoreNode.asText(), e);
        }
        return new QualityAssessment(normalize(score), text(root.get("feedback")), suggestions(root.get("suggestions")));
    }

    static double normalize(double score) {
        if (score > 10.0) {
            return score / 100.0;
        }
        if (score > 1.0) {
            return score / 10.0;
        }
        return score;
    }

    public static String extractJson(String raw) {
        String cleaned = raw.trim();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        int start = cleaned.indexOf('{');
        int end = cleaned.lastIndexOf('}');
        if (start >= 0 && end > start) {
            cleaned = cleaned.substring(start, end + 1);
        }
        return cleaned.trim();
    }

    private static String text(JsonNode node) {
        return node == null || node.isNull() ? "" : node.asText();
    }

    private static List<String> suggestions(JsonNode node) {
        List<String> out = new ArrayList<>();
        if (node == null || node.isNull()) {
            return out;
        }
        if (node.isArray()) {
            node.forEach(n -> out.add(n.asText()));
        } else {
            out.add(node.asText());
        }
        return out;
    }
}
