package com.recoveryos.metrics;

import com.recoveryos.checkin.CheckinStore;
import com.recoveryos.risk.RiskBand;
import com.recoveryos.safety.AuditRule;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Service counters registered on the application's {@link MeterRegistry} and
 * served by the actuator metrics endpoint.
 */
public class RecoveryMetrics {

    public static final String CHECKIN_COMPLETED = "recovery.checkin.completed";
    public static final String CHECKIN_STORED = "recovery.checkin.stored";
    public static final String REFLECTION_VIEWED = "recovery.reflection.viewed";
    public static final String REFLECTION_WITHHELD = "recovery.reflection.withheld";
    public static final String CONSENT_WRITES = "recovery.consent.writes";
    public static final String BAND_TAG = "band";
    public static final String RULE_TAG = "rule";

    private final Map<RiskBand, Counter> checkinsByBand = new EnumMap<>(RiskBand.class);
    private final Counter reflectionsViewed;
    private final Counter consentWrites;
    private final MeterRegistry meterRegistry;

    public RecoveryMetrics(MeterRegistry meterRegistry, CheckinStore checkinStore) {
        this.meterRegistry = meterRegistry;
        for (RiskBand band : RiskBand.values()) {
            checkinsByBand.put(band, Counter.builder(CHECKIN_COMPLETED)
                    .description("Completed check-ins by risk band")
                    .tag(BAND_TAG, band.wireName())
                    .register(meterRegistry));
        }
        this.reflectionsViewed = Counter.builder(REFLECTION_VIEWED)
                .description("Reflections returned to clients")
                .register(meterRegistry);
        this.consentWrites = Counter.builder(CONSENT_WRITES)
                .description("Consent records written")
                .register(meterRegistry);
        Gauge.builder(CHECKIN_STORED, checkinStore, CheckinStore::count)
                .description("Check-in records held in memory")
                .strongReference(true)
                .register(meterRegistry);
    }

    public void recordCheckin(RiskBand band) {
        checkinsByBand.get(band).increment();
        reflectionsViewed.increment();
    }

    public void recordReflectionWithheld(List<AuditRule> rules) {
        for (AuditRule rule : rules) {
            meterRegistry.counter(REFLECTION_WITHHELD, RULE_TAG, rule.name().toLowerCase(Locale.ROOT)).increment();
        }
    }

    public void recordConsentWrite() {
        consentWrites.increment();
    }
}
