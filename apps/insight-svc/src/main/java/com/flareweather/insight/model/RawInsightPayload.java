package com.flareweather.insight.model;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Upstream analysis payload, decided once as either a JSON object or opaque legacy text.
 */
public interface RawInsightPayload {

    record Structured(Map<String, Object> fields) implements RawInsightPayload {

        public Structured {
            fields = fields == null ? Map.of() : fields;
        }

        /**
         * Returns the named field when it is present and a string; wrong-typed values count as absent.
         */
        public Optional<String> text(String key) {
            Object value = fields.get(key);
            return value instanceof String str ? Optional.of(str) : Optional.empty();
        }

        public Optional<Structured> nested(String key) {
            return fields.get(key) instanceof Map<?, ?> map ? Optional.of(new Structured(castMap(map))) : Optional.empty();
        }

        public Optional<List<?>> list(String key) {
            return fields.get(key) instanceof List<?> list ? Optional.of(list) : Optional.empty();
        }

        @SuppressWarnings("unchecked")
        private static Map<String, Object> castMap(Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
    }

    record Legacy(String text) implements RawInsightPayload {

        public Legacy {
            text = text == null ? "" : text;
        }
    }
}
