package com.recoveryos.consent;

import com.recoveryos.metrics.RecoveryMetrics;

import java.util.Optional;

public class ConsentService {

    private final ConsentStore store;
    private final ConsentConfirmationListener confirmationListener;
    private final RecoveryMetrics metrics;

    public ConsentService(
            ConsentStore store,
            ConsentConfirmationListener confirmationListener,
            RecoveryMetrics metrics
    ) {
        this.store = store;
        this.confirmationListener = confirmationListener;
        this.metrics = metrics;
    }

    public ConsentRecord record(String subject, ConsentRecord record) {
        store.put(subject, record);
        metrics.recordConsentWrite();
        if (record.accepted()) {
            confirmationListener.onConsentAccepted(subject, record);
        }
        return record;
    }

    public Optional<ConsentRecord> current(String subject) {
        return store.get(subject);
    }
}
