package com.flareweather.insight.config;

import java.time.Clock;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    @Bean
    public Clock insightClock(InsightProperties properties) {
        return Clock.system(properties.zone());
    }

    @Bean
    public Random catalogRandom(InsightProperties properties) {
        InsightProperties.Selection selection = properties.selection();
        if (selection.hasSeed()) {
            log.info("Catalog selection seeded with {}", selection.seed());
            return new Random(selection.seed());
        }
        return new Random();
    }
}
