package com.recoveryos.consent;

import java.time.Instant;

public record ConsentView(
        String subject,
        boolean accepted,
        String termsVersion,
        String scope,
        Instant recordedAt
) {
    public static ConsentView of(String subject, ConsentRecord record) {
        return new ConsentView(subject, record.accepted(), record.termsVersion(), record.scope(), record.recordedAt());
    }

    /** What a subject who never answered sees: not accepted, nothing recorded. */
    public static ConsentView notRecorded(String subject) {
        return new ConsentView(subject, false, null, ConsentRecord.DEFAULT_SCOPE, null);
    }
}
