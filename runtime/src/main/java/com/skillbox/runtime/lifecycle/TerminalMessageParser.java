package com.skillbox.runtime.lifecycle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Recognises the terminal message in a skill process' stdout: a single line
 * holding a JSON object with a {@code success} field. Any other line is
 * ordinary output.
 */
final class TerminalMessageParser {

    private static final Logger log = LoggerFactory.getLogger(TerminalMessageParser.class);

    private final ObjectMapper objectMapper;

    TerminalMessageParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    Optional<TerminalResult> parse(String line, String sessionId, String skillId, Instant at) {
        String trimmed = line == null ? "" : line.trim();
        if (!trimmed.startsWith("{") || !trimmed.endsWith("}")) {
            return Optional.empty();
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(trimmed);
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
        if (node == null || !node.isObject() || !node.has("success")) {
            return Optional.empty();
        }
        JsonNode reportedSession = node.get("session_id");
        if (reportedSession != null && !reportedSession.isNull()
                && !reportedSession.asText().equals(sessionId)) {
            log.warn("Discarding result for session {} on channel of session {}", reportedSession.asText(), sessionId);
            return Optional.empty();
        }
        Map<String, Object> fields = objectMapper.convertValue(node, new TypeReference<>() {});
        return Optional.of(TerminalResult.fromSkillResult(sessionId, skillId, fields, at));
    }
}
