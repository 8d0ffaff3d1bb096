package com.oracle.optmcts.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Shape validation for raw model text. Every failure is a {@link ModelOutputException} so callers
 * can retry with the same prompt.
 */
@Component
@Slf4j
public class StructuredOutputParser {

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Extract a JSON object from the model response, supporting:
     * pure JSON, JSON inside ```json fences, or the largest parseable {...} slice.
     */
    public JsonNode parseObject(String response) {
        String trimmed = response == null ? "" : response.trim();
        if (trimmed.isEmpty()) {
            throw new ModelOutputException("Empty model response");
        }
        if (trimmed.charAt(0) == '{') {
            JsonNode node = readQuietly(trimmed);
            if (node != null && node.isObject()) {
                return node;
            }
        }

        int fenceStart = trimmed.indexOf("```");
        while (fenceStart != -1) {
            int fenceEnd = trimmed.indexOf("```", fenceStart + 3);
            if (fenceEnd == -1) break;

            int headerEnd = trimmed.indexOf('\n', fenceStart + 3);
            String header = "";
            int contentStart;
            if (headerEnd != -1 && headerEnd < fenceEnd) {
                header = trimmed.substring(fenceStart + 3, headerEnd).trim().toLowerCase(Locale.ROOT);
                contentStart = headerEnd + 1;
            } else {
                contentStart = fenceStart + 3;
            }
            if (header.isEmpty() || header.contains("json")) {
                JsonNode node = readQuietly(trimmed.substring(contentStart, fenceEnd).trim());
                if (node != null && node.isObject()) {
                    return node;
                }
            }
            fenceStart = trimmed.indexOf("```", fenceEnd + 3);
        }

        int firstBrace = trimmed.indexOf('{');
        int lastBrace = trimmed.lastIndexOf('}');
        while (firstBrace != -1 && lastBrace != -1 && lastBrace > firstBrace) {
            JsonNode node = readQuietly(trimmed.substring(firstBrace, lastBrace + 1));
            if (node != null && node.isObject()) {
                return node;
            }
            lastBrace = trimmed.lastIndexOf('}', lastBrace - 1);
        }

        log.warn("No JSON object in model response. Snippet: {}", abbreviate(response, 400));
        throw new ModelOutputException("No JSON object found in response");
    }

    /**
     * Free-text answer with surrounding code fences removed; blank answers are rejected.
     */
    public String parseText(String response) {
        String text = stripCodeFences(response);
        if (text.isBlank()) {
            throw new ModelOutputException("Blank model response");
        }
        return text;
    }

    /**
     * Remove a leading ```lang line and a trailing ``` from generated code or text.
     */
    public String stripCodeFences(String response) {
        if (response == null) return "";
        String s = response.trim();
        if (s.startsWith("```")) {
            int headerEnd = s.indexOf('\n');
            s = headerEnd == -1 ? s.substring(3) : s.substring(headerEnd + 1);
        }
        if (s.endsWith("```")) {
            s = s.substring(0, s.length() - 3);
        }
        return s.trim();
    }

    public static String abbreviate(String s, int maxLen) {
        if (s == null) return "null";
        return StringUtils.abbreviate(s, Math.max(4, maxLen));
    }

    private JsonNode readQuietly(String candidate) {
        try {
            return objectMapper.readTree(candidate);
        } catch (Exception e) {
            log.trace("Candidate slice is not JSON: {}", e.getMessage());
            return null;
        }
    }
}
