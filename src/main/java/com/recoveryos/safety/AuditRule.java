package com.recoveryos.safety;

public enum AuditRule {
    CRISIS_LANGUAGE,
    STIGMA_LANGUAGE,
    PII_REDACTED,
    CRISIS_NOTICE_MISSING
}
