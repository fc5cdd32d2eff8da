package com.flareweather.insight.daily;

import java.util.List;
import java.util.Locale;
import java.util.Random;
import org.springframework.stereotype.Component;

/**
 * Pre-approved comfort tips and sign-offs used whenever the upstream ones are missing or fail the
 * content rules.
 */
@Component
public class ApprovedPhrases {

    static final List<String> COMFORT_TIPS = List.of(
            "Chinese medicine suggests a 5-minute tai-chi routine to ease muscle tension.",
            "Chinese medicine suggests warm ginger tea to support circulation during cold shifts.",
            "Chinese medicine recommends gentle qigong movements to ease joint stiffness.",
            "Chinese medicine recommends massaging the GB20 points at the base of the skull for tension relief.",
            "Ayurveda suggests warm oil massage to support joint mobility.",
            "Ayurveda recommends gentle yoga stretches to ease muscle tension.",
            "Ayurveda suggests staying warm with layers during temperature drops.",
            "Western medicine suggests gentle stretching to ease muscle tension.",
            "Western medicine recommends staying warm and hydrated during weather shifts.",
            "Western medicine suggests taking short breaks throughout the day.",
            "Take short pauses through the day when your body needs them.",
            "Stay warm and keep hydrated to support your body through shifts."
    );

    static final List<String> SIGN_OFFS = List.of(
            "Move at the pace that feels right.",
            "Take things one moment at a time.",
            "Wishing you a steadier day ahead."
    );

    private static final double EASTERN_TIP_SHARE = 0.7d;

    private final List<String> easternTips;
    private final Random random;

    public ApprovedPhrases(Random random) {
        this.random = random;
        this.easternTips = COMFORT_TIPS.stream()
                .filter(tip -> {
                    String lower = tip.toLowerCase(Locale.ROOT);
                    return lower.contains("chinese medicine") || lower.contains("ayurveda");
                })
                .toList();
    }

    /**
     * Eastern-medicine tips are favoured, the rest of the catalog is still reachable.
     */
    public String comfortTip() {
        if (random.nextDouble() < EASTERN_TIP_SHARE) {
            return easternTips.get(random.nextInt(easternTips.size()));
        }
        return COMFORT_TIPS.get(random.nextInt(COMFORT_TIPS.size()));
    }

    public String signOff() {
        return SIGN_OFFS.get(random.nextInt(SIGN_OFFS.size()));
    }
}
