package com.example.batch.service;

import com.example.batch.error.InvalidSpecException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * parameters / result_data / error_details 的 JSON 读写。调度核心不解释其内容。
 */
@Component
@RequiredArgsConstructor
public class PayloadMapper {

    private final ObjectMapper mapper;

    public String write(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return null;
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new InvalidSpecException("Payload is not serializable: " + trimErr(e.getOriginalMessage()));
        }
    }

    public JsonNode read(String json) {
        try {
            return mapper.readTree(safePayload(json));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored payload is not valid JSON: " + trimErr(e.getOriginalMessage()), e);
        }
    }

    public JsonNode error(String message) {
        ObjectNode n = mapper.createObjectNode();
        n.put("message", trimErr(message));
        return n;
    }

    public JsonNode error(Throwable t) {
        ObjectNode n = mapper.createObjectNode();
        n.put("type", t.getClass().getSimpleName());
        n.put("message", trimErr(t.getMessage()));
        return n;
    }

    private static String safePayload(String payload) {
        return (payload == null || payload.trim().isEmpty()) ? "{}" : payload;
    }

    static String trimErr(String m) {
        if (m == null) return null;
        m = m.replaceAll("\\s+", " ").trim();
        return m.length() > 1900 ? m.substring(0, 1900) : m;
    }
}
