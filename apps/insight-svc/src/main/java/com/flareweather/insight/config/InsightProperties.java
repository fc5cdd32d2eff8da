package com.flareweather.insight.config;

import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "insight")
public record InsightProperties(
        Similarity similarity,
        TemplateRepair templateRepair,
        Selection selection,
        String zoneId
) {

    @ConstructorBinding
    public InsightProperties {
        if (zoneId != null && !zoneId.isBlank()) {
            try {
                ZoneId.of(zoneId);
            } catch (RuntimeException ex) {
                throw new IllegalArgumentException("zoneId is not a valid zone: " + zoneId, ex);
            }
        }
        // similarity, templateRepair and selection may be null; accessors below supply defaults
    }

    public static InsightProperties defaults() {
        return new InsightProperties(null, null, null, null);
    }

    public Similarity similarity() {
        return similarity != null ? similarity : new Similarity(null, null);
    }

    public TemplateRepair templateRepair() {
        return templateRepair != null ? templateRepair : new TemplateRepair(null);
    }

    public Selection selection() {
        return selection != null ? selection : new Selection(null);
    }

    public ZoneId zone() {
        return (zoneId != null && !zoneId.isBlank()) ? ZoneId.of(zoneId) : ZoneId.of("UTC");
    }

    public record Similarity(Double containmentRatio, Double wordOverlap) {
        public Similarity {
            if (containmentRatio == null) {
                containmentRatio = 0.8d;
            }
            if (wordOverlap == null) {
                wordOverlap = 0.7d;
            }
            if (containmentRatio <= 0d || containmentRatio > 1d) {
                throw new IllegalArgumentException("containmentRatio must be in (0, 1]");
            }
            if (wordOverlap <= 0d || wordOverlap > 1d) {
                throw new IllegalArgumentException("wordOverlap must be in (0, 1]");
            }
        }
    }

    public record TemplateRepair(Integer minLength) {
        public TemplateRepair {
            if (minLength == null) {
                minLength = 10;
            }
            if (minLength < 0) {
                throw new IllegalArgumentException("minLength must not be negative");
            }
        }
    }

    public record Selection(Long seed) {
        // seed is optional; when absent catalog picks are unseeded
        public boolean hasSeed() {
            return seed != null;
        }
    }
}
