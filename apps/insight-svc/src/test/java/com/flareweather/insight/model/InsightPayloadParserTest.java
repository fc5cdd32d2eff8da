package com.flareweather.insight.model;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class InsightPayloadParserTest {

    private final InsightPayloadParser parser = new InsightPayloadParser(new ObjectMapper());

    @Test
    void jsonObjectIsStructured() {
        RawInsightPayload payload = parser.parse("{\"summary\": \"Cooler air.\", \"count\": 3}");

        assertThat(payload).isInstanceOf(RawInsightPayload.Structured.class);
        RawInsightPayload.Structured structured = (RawInsightPayload.Structured) payload;
        assertThat(structured.text("summary")).contains("Cooler air.");
        assertThat(structured.text("count")).isEmpty();
        assertThat(structured.fields()).containsKey("count");
    }

    @Test
    void codeFencedJsonIsStructured() {
        RawInsightPayload payload = parser.parse("```json\n{\"summary\": \"Cooler air.\"}\n```");

        assertThat(payload).isInstanceOf(RawInsightPayload.Structured.class);
    }

    @Test
    void nestedObjectsAreReachable() {
        RawInsightPayload.Structured payload = (RawInsightPayload.Structured) parser.parse(
                "{\"daily_insight\": {\"why_line\": \"Because.\"}, \"daily_breakdown\": [1, 2]}");

        assertThat(payload.nested("daily_insight").flatMap(inner -> inner.text("why_line"))).contains("Because.");
        assertThat(payload.list("daily_breakdown")).hasValueSatisfying(list -> assertThat(list).hasSize(2));
    }

    @Test
    void everythingElseIsLegacy() {
        assertThat(parser.parse("Plain text insight.")).isEqualTo(new RawInsightPayload.Legacy("Plain text insight."));
        assertThat(parser.parse("{broken")).isEqualTo(new RawInsightPayload.Legacy("{broken"));
        assertThat(parser.parse("[1, 2]")).isEqualTo(new RawInsightPayload.Legacy("[1, 2]"));
        assertThat(parser.parse(null)).isEqualTo(new RawInsightPayload.Legacy(""));
        assertThat(parser.parse("  ")).isEqualTo(new RawInsightPayload.Legacy(""));
    }
}
