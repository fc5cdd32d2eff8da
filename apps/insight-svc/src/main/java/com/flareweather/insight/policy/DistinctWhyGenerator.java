package com.flareweather.insight.policy;

import com.flareweather.insight.model.WeatherFactor;
import com.flareweather.insight.text.SimilarityEngine;
import com.flareweather.insight.text.WeatherClassifier;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Produces a "why" line that explains the summary without restating it.
 */
@Component
public class DistinctWhyGenerator {

    static final String GENERIC_WHY = "Weather changes can make the body feel more effortful or tiring.";
    static final String SECONDARY_WHY = "The weather pattern today may make the body feel more effortful or tiring.";

    private final VagueLanguageGuard vagueLanguageGuard;
    private final SimilarityEngine similarityEngine;

    public DistinctWhyGenerator(VagueLanguageGuard vagueLanguageGuard, SimilarityEngine similarityEngine) {
        this.vagueLanguageGuard = vagueLanguageGuard;
        this.similarityEngine = similarityEngine;
    }

    public String generateDistinctWhy(String summary, WeatherFactor factor) {
        WeatherFactor target = WeatherClassifier.detectWeatherFactor(summary)
                .orElse(factor != null ? factor : WeatherFactor.PRESSURE);

        Optional<String> fromCatalog = firstQualifying(summary, target);
        if (fromCatalog.isPresent()) {
            return fromCatalog.get();
        }
        if (!similarityEngine.areSimilar(summary, GENERIC_WHY)) {
            return GENERIC_WHY;
        }
        if (!similarityEngine.areSimilar(summary, SECONDARY_WHY)) {
            return SECONDARY_WHY;
        }
        for (WeatherFactor other : WeatherFactor.values()) {
            if (other == target) {
                continue;
            }
            Optional<String> candidate = firstQualifying(summary, other);
            if (candidate.isPresent()) {
                return candidate.get();
            }
        }
        return GENERIC_WHY;
    }

    private Optional<String> firstQualifying(String summary, WeatherFactor factor) {
        return vagueLanguageGuard.catalog(factor).stream()
                .filter(sentence -> !vagueLanguageGuard.containsVagueLanguage(sentence))
                .filter(sentence -> !similarityEngine.areSimilar(summary, sentence))
                .findFirst();
    }
}
