package com.recoveryos.risk;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Deterministic reflection text keyed by band only. The crisis notice is fixed
 * and always closes a high-band reflection.
 */
public final class Reflections {

    public static final String CRISIS_NOTICE =
            "You're not alone. If you're in crisis, call or text 988 (or your local emergency number).";

    public static final String NEUTRAL_REFLECTION =
            "Thanks for checking in. Your entry has been recorded.";

    private static final Map<RiskBand, String> TEMPLATES = new EnumMap<>(RiskBand.class);

    static {
        TEMPLATES.put(RiskBand.INSUFFICIENT_DATA,
                "We don't have enough check-ins yet to reflect on a trend. Keep checking in; every entry helps.");
        TEMPLATES.put(RiskBand.LOW,
                "You're steady today. Keep building on what's working, one small healthy choice at a time.");
        TEMPLATES.put(RiskBand.ELEVATED,
                "Some stress signals showed up. What's one support or coping tool you can use in the next hour?");
        TEMPLATES.put(RiskBand.MODERATE,
                "Several stress points are present. Consider pausing now to breathe, text a supporter, or use a coping skill.");
        TEMPLATES.put(RiskBand.HIGH,
                "Today looks tough. Reach out to your supports now. Safety first, one step at a time.");
    }

    private Reflections() {
    }

    public static String reflectionFor(RiskBand band) {
        String template = TEMPLATES.get(Objects.requireNonNull(band, "band"));
        if (band == RiskBand.HIGH) {
            return template + " " + CRISIS_NOTICE;
        }
        return template;
    }

    /**
     * Text served when a band reflection is withheld. Keeps the crisis notice
     * for the high band.
     */
    public static String neutralFor(RiskBand band) {
        if (Objects.requireNonNull(band, "band") == RiskBand.HIGH) {
            return NEUTRAL_REFLECTION + " " + CRISIS_NOTICE;
        }
        return NEUTRAL_REFLECTION;
    }
}
