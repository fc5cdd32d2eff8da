package com.flareweather.insight.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class InsightPayloadParser {

    private static final Logger log = LoggerFactory.getLogger(InsightPayloadParser.class);

    private final ObjectMapper objectMapper;

    public InsightPayloadParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public RawInsightPayload parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return new RawInsightPayload.Legacy("");
        }
        String candidate = stripCodeFence(raw.trim());
        if (!candidate.startsWith("{")) {
            return new RawInsightPayload.Legacy(raw);
        }
        try {
            Map<String, Object> fields = objectMapper.readValue(candidate, new TypeReference<Map<String, Object>>() {});
            return new RawInsightPayload.Structured(fields);
        } catch (JsonProcessingException ex) {
            log.debug("Insight payload is not valid JSON, treating as legacy text: {}", ex.getOriginalMessage());
            return new RawInsightPayload.Legacy(raw);
        }
    }

    private String stripCodeFence(String text) {
        if (!text.startsWith("```")) {
            return text;
        }
        String s = text;
        int firstNl = s.indexOf('\n');
        if (firstNl > 0) s = s.substring(firstNl + 1);
        int fence = s.lastIndexOf("```");
        if (fence >= 0) s = s.substring(0, fence);
        return s.trim();
    }
}
