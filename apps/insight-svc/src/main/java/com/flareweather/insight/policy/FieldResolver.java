package com.flareweather.insight.policy;

import com.flareweather.insight.text.InsightSanitizer;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Resolves one output field by folding a raw candidate through an ordered list of stages. A stage
 * may reject the value by returning empty; the first rejection, or a blank result, yields the
 * fallback.
 */
public final class FieldResolver {

    /** A single resolution step. */
    @FunctionalInterface
    public interface Stage extends Function<String, Optional<String>> {
    }

    public static final Stage SANITIZE = value -> Optional.of(InsightSanitizer.sanitize(value));
    public static final Stage FILTER_APP_REFERENCES = AppReferenceFilter::filter;
    public static final Stage NON_BLANK = value -> value.isBlank() ? Optional.empty() : Optional.of(value);

    /** sanitize, then drop app nudges, then reject blanks */
    public static final List<Stage> STANDARD = List.of(SANITIZE, FILTER_APP_REFERENCES, NON_BLANK);

    private FieldResolver() {
    }

    public static String resolve(String raw, String fallback, List<Stage> stages) {
        Optional<String> current = Optional.ofNullable(raw);
        for (Stage stage : stages) {
            current = current.flatMap(stage);
        }
        return current.filter(value -> !value.isBlank()).orElse(fallback);
    }

    public static String resolve(Optional<String> raw, String fallback, List<Stage> stages) {
        return resolve(raw.orElse(null), fallback, stages);
    }
}
