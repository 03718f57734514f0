package com.recoveryos.consent;

import java.time.Instant;
import java.util.Objects;

public record ConsentRecord(
        boolean accepted,
        String termsVersion,
        String scope,
        Instant recordedAt
) {
    public static final String DEFAULT_SCOPE = "weekly_summary";

    public ConsentRecord {
        Objects.requireNonNull(recordedAt, "recordedAt");
        scope = scope == null || scope.isBlank() ? DEFAULT_SCOPE : scope;
    }
}
