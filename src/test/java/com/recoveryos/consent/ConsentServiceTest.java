package com.recoveryos.consent;

import com.recoveryos.checkin.CheckinStore;
import com.recoveryos.metrics.RecoveryMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class ConsentServiceTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void confirmsOnlyAcceptedConsent() {
        AtomicInteger confirmations = new AtomicInteger();
        MeterRegistry registry = new SimpleMeterRegistry();
        RecoveryMetrics metrics = new RecoveryMetrics(registry, new CheckinStore());
        ConsentService service = new ConsentService(
                new ConsentStore(), (subject, record) -> confirmations.incrementAndGet(), metrics);

        service.record("s", new ConsentRecord(true, "v1", null, NOW));
        service.record("s", new ConsentRecord(false, "v1", null, NOW.plusSeconds(1)));

        assertEquals(1, confirmations.get());
        assertEquals(2.0, registry.get(RecoveryMetrics.CONSENT_WRITES).counter().count());
        assertFalse(service.current("s").orElseThrow().accepted());
    }
}
