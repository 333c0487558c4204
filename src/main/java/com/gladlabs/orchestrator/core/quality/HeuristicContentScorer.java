package com.gladlabs.orchestrator.core.quality;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Offline scorer based on text metrics: structure, readability, length, keyword
 * coverage and punctuation. Produces a 0-100 score, normalized to [0,1].
 */
public class HeuristicContentScorer implements QualityScorer {

    private static final Logger log = LoggerFactory.getLogger(HeuristicContentScorer.class);

    record Metrics(int wordCount, boolean hasStructure, double readability, boolean hasKeywords, int score) {}

    @Override
    public QualityAssessment assess(QualityRequest request) {
        String content = request.content();
        if (content == null || content.isBlank()) {
            return new QualityAssessment(0.0, "No content provided for critique", List.of("Content is empty"));
        }
        Metrics metrics = measure(content, keywords(request.input().get("keywords")));
        log.debug("Heuristic score for {}: {}/100 ({} words)", request.phaseName(), metrics.score(), metrics.wordCount());
        return new QualityAssessment(metrics.score() / 100.0, feedback(metrics), suggestions(metrics));
    }

    Metrics measure(String content, List<String> keywords) {
        String[] words = content.trim().split("\\s+");
        int wordCount = words.length;
        boolean hasStructure = content.lines().anyMatch(l -> l.strip().startsWith("#"));

        long paragraphs = Arrays.stream(content.split("\n\n")).filter(p -> !p.isBlank()).count();
        double avgParagraph = wordCount / (double) Math.max(paragraphs, 1);
        double readability = Math.max(0, Math.min(100, 100 - (avgParagraph / 150.0) * 30));

        String lower = content.toLowerCase(Locale.ROOT);
        boolean hasKeywords = keywords.stream().anyMatch(k -> lower.contains(k.toLowerCase(Locale.ROOT)));

        double score = 50;
        score += hasStructure ? 15 : 5;
        score += Math.min(20, readability / 5);
        if (wordCount >= 300) {
            score += 15;
        } else if (wordCount >= 150) {
            score += 10;
        } else {
            score += 5;
        }
        if (hasKeywords) {
            score += 10;
        }
        long sentences = content.chars().filter(c -> c == '.').count();
        if (sentences > wordCount / 50.0) {
            score += 10;
        }
        return new Metrics(wordCount, hasStructure, readability, hasKeywords, (int) Math.min(100, score));
    }

    private static String feedback(Metrics m) {
        List<String> parts = new ArrayList<>();
        if (m.score() >= 90) {
            parts.add("Excellent content quality");
        } else if (m.score() >= 80) {
            parts.add("Good content quality");
        } else if (m.score() >= 70) {
            parts.add("Acceptable content with room for improvement");
        } else {
            parts.add("Content needs significant improvement");
        }
        if (m.wordCount() < 150) {
            parts.add("Consider expanding content for more depth");
        } else if (m.wordCount() > 3000) {
            parts.add("Consider breaking into multiple posts");
        }
        if (!m.hasStructure()) {
            parts.add("Add headings to improve structure and readability");
        }
        if (m.readability() < 60) {
            parts.add("Break up long paragraphs for better readability");
        }
        if (!m.hasKeywords()) {
            parts.add("Include target keywords naturally in content");
        }
        return String.join(". ", parts);
    }

    private static List<String> suggestions(Metrics m) {
        List<String> out = new ArrayList<>();
        if (!m.hasStructure()) {
            out.add("Add section headings (## Heading)");
        }
        if (m.wordCount() < 300) {
            out.add("Expand to at least 300 words");
        }
        if (m.readability() < 60) {
            out.add("Keep paragraphs under 150 words");
        }
        if (!m.hasKeywords()) {
            out.add("Mention the target keywords");
        }
        return out;
    }

    static List<String> keywords(Object raw) {
        if (raw instanceof Collection<?> c) {
            return c.stream().map(String::valueOf).toList();
        }
        if (raw instanceof String s && !s.isBlank()) {
            return Arrays.stream(s.split(",")).map(String::trim).filter(k -> !k.isEmpty()).toList();
        }
        return List.of();
    }
}
