package com.astradesk.reviewtracker.integration.jira;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Flattens Atlassian Document Format bodies to plain text: every {@code text}
 * node in document order, joined by single spaces.
 */
public final class AdfText {

    private AdfText() {
    }

    public static String flatten(JsonNode document) {
        if (document == null || document.isNull() || document.isMissingNode()) {
            return "";
        }
        if (document.isTextual()) {
            return document.asText();
        }
        List<String> parts = new ArrayList<>();
        collect(document, parts);
        return String.join(" ", parts);
    }

    private static void collect(JsonNode node, List<String> parts) {
        if (node.isArray()) {
            for (JsonNode child : node) {
                collect(child, parts);
            }
            return;
        }
        if (!node.isObject()) {
            return;
        }
        if ("text".equals(node.path("type").asText())) {
            parts.add(node.path("text").asText(""));
        }
        JsonNode content = node.get("content");
        if (content != null && content.isArray()) {
            collect(content, parts);
        }
    }
}
