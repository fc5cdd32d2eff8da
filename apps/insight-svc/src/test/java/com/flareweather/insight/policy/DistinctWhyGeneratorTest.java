package com.flareweather.insight.policy;

import static org.assertj.core.api.Assertions.assertThat;

import com.flareweather.insight.config.InsightProperties;
import com.flareweather.insight.model.WeatherFactor;
import com.flareweather.insight.text.SimilarityEngine;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

class DistinctWhyGeneratorTest {

    private final SimilarityEngine similarityEngine = new SimilarityEngine(InsightProperties.defaults());
    private final VagueLanguageGuard guard = new VagueLanguageGuard(new Random(7L));
    private final DistinctWhyGenerator generator = new DistinctWhyGenerator(guard, similarityEngine);

    @Test
    void usesSummaryFactorCatalog() {
        assertThat(generator.generateDistinctWhy("Pressure drops today.", WeatherFactor.WIND))
                .isEqualTo("Pressure drops can make the body feel heavy or slow.");
    }

    @Test
    void skipsCatalogSentenceThatRepeatsSummary() {
        assertThat(generator.generateDistinctWhy("Pressure drops can make the body feel heavy or slow.", WeatherFactor.PRESSURE))
                .isEqualTo("Stable pressure can ease tension in sensitive joints.");
    }

    @Test
    void fallsBackToPassedFactorWhenSummaryNamesNone() {
        assertThat(generator.generateDistinctWhy("A quiet afternoon.", WeatherFactor.HUMIDITY))
                .isEqualTo("Thick air can make the body feel tiring.");
    }

    @Test
    void resultIsNeverSimilarNorVague() {
        List<String> summaries = List.of(
                "Pressure drops today.",
                "Humid conditions can make movement feel more effortful.",
                "Heat can drain energy and make the body feel sluggish.",
                "Calm air can ease tension in sensitive systems.",
                "Weather changes can make the body feel more effortful or tiring.");

        for (String summary : summaries) {
            String why = generator.generateDistinctWhy(summary, WeatherFactor.PRESSURE);
            assertThat(similarityEngine.areSimilar(summary, why)).as(summary).isFalse();
            assertThat(guard.containsVagueLanguage(why)).as(summary).isFalse();
        }
    }
}
