package com.flareweather.insight.config;

import static org.junit.jupiter.api.Assertions.*;

import java.time.ZoneId;
import org.junit.jupiter.api.Test;

class InsightPropertiesTest {

    @Test
    void defaultsMatchTunedValues() {
        InsightProperties props = InsightProperties.defaults();

        assertEquals(0.8d, props.similarity().containmentRatio());
        assertEquals(0.7d, props.similarity().wordOverlap());
        assertEquals(10, props.templateRepair().minLength());
        assertFalse(props.selection().hasSeed());
        assertEquals(ZoneId.of("UTC"), props.zone());
    }

    @Test
    void rejectsOutOfRangeRatios() {
        assertThrows(IllegalArgumentException.class, () -> new InsightProperties.Similarity(0d, null));
        assertThrows(IllegalArgumentException.class, () -> new InsightProperties.Similarity(null, 1.5d));
    }

    @Test
    void rejectsNegativeMinLength() {
        assertThrows(IllegalArgumentException.class, () -> new InsightProperties.TemplateRepair(-1));
    }

    @Test
    void rejectsUnknownZone() {
        assertThrows(IllegalArgumentException.class, () -> new InsightProperties(null, null, null, "Mars/Olympus"));
    }

    @Test
    void configuredZoneIsUsed() {
        InsightProperties props = new InsightProperties(null, null, new InsightProperties.Selection(5L), "Asia/Tokyo");

        assertEquals(ZoneId.of("Asia/Tokyo"), props.zone());
        assertTrue(props.selection().hasSeed());
    }
}
