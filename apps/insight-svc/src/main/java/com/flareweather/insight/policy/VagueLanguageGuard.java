package com.flareweather.insight.policy;

import com.flareweather.insight.model.WeatherFactor;
import com.flareweather.insight.text.WeatherClassifier;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Enforces the rule that weather never "feels" anything; only the body does. Detects phrasing that
 * attributes a feeling to conditions and swaps it for a concrete body-sensation sentence.
 */
@Component
public class VagueLanguageGuard {

    private static final List<String> VAGUE_PHRASES = List.of(
            "a bit", "bit more", "a bit easier", "a bit achy",
            "supportive", "moody", "unusual", "gentle",
            "conditions remain stable", "keeps things steady", "keeps things gentle", "keeps things calm",
            "may feel different", "might feel different", "can feel different", "feels different",
            "may feel off", "feels off", "feels heavier", "feels unusual",
            "might impact comfort", "could feel easier", "you may notice changes", "can impact your comfort",
            "affects the body", "noticeable shifts",
            "stays stable", "remains calm", "feels gentle", "feels calm", "feels steady",
            "can affect", "may impact", "could affect", "might impact",
            "might help", "may help", "could help", "help with", "helps with",
            "pressure feels", "humidity feels", "humid feels", "temperature feels", "wind feels",
            "air feels", "weather feels", "conditions feel"
    );

    private static final Pattern VAGUE = Pattern.compile(VAGUE_PHRASES.stream()
            .map(Pattern::quote)
            .collect(Collectors.joining("|", "\\b(?:", ")\\b")));
    private static final Pattern LIGHTER = Pattern.compile("\\blighter\\b");
    private static final Pattern BODY_PART = Pattern.compile("\\b(?:muscles?|joints?|tightness)\\b");

    private static final Map<WeatherFactor, List<String>> CATALOG = new EnumMap<>(WeatherFactor.class);

    static {
        CATALOG.put(WeatherFactor.PRESSURE, List.of(
                "Pressure drops can make the body feel heavy or slow.",
                "Stable pressure can ease tension in sensitive joints.",
                "Rapid pressure changes can make muscles feel stiff or tense.",
                "Gradual pressure shifts can leave the body feeling drained and sensitive.",
                "Low pressure can make movement feel more effortful and tiring.",
                "Steady pressure may ease stiffness in joints."
        ));
        CATALOG.put(WeatherFactor.HUMIDITY, List.of(
                "Thick air can make the body feel tiring.",
                "Humid conditions can make movement feel more effortful.",
                "Heavy humidity can drain energy and make the body feel sluggish.",
                "Dense air can make breathing feel more effortful.",
                "Rising humidity can make joints feel stiff.",
                "Moist air can increase sensitivity in the body."
        ));
        CATALOG.put(WeatherFactor.TEMPERATURE, List.of(
                "Heat can drain energy and make the body feel sluggish.",
                "Cool air can stiffen muscles and increase sensitivity.",
                "Warm temperatures can make movement feel tiring and effortful.",
                "Cooler air may make joints feel stiff or tense.",
                "High heat can leave the body feeling heavy and drained.",
                "Stable temperatures may ease tension in tight muscles."
        ));
        CATALOG.put(WeatherFactor.WIND, List.of(
                "Calm air can ease tension in sensitive systems.",
                "Gusty winds can make movement feel tiring and draining.",
                "Stable air may make movement feel less effortful.",
                "Steady breezes can loosen tightness in stiff muscles."
        ));
    }

    private final Random random;

    public VagueLanguageGuard(Random random) {
        this.random = random;
    }

    public boolean containsVagueLanguage(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        if (VAGUE.matcher(lower).find()) {
            return true;
        }
        // "lighter" is only concrete when it is about a body part
        return LIGHTER.matcher(lower).find() && !BODY_PART.matcher(lower).find();
    }

    /**
     * Picks a catalog sentence for the factor the text talks about, or {@code factor} when the text
     * names none.
     */
    public String rewriteVague(String text, WeatherFactor factor) {
        WeatherFactor target = WeatherClassifier.detectWeatherFactor(text)
                .orElse(factor != null ? factor : WeatherFactor.PRESSURE);
        List<String> candidates = CATALOG.get(target).stream()
                .filter(sentence -> !containsVagueLanguage(sentence))
                .toList();
        return candidates.get(random.nextInt(candidates.size()));
    }

    public List<String> catalog(WeatherFactor factor) {
        return CATALOG.get(factor);
    }
}
