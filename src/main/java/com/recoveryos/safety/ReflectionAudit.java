package com.recoveryos.safety;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of auditing one outbound reflection. {@code content} is the text
 * that may be sent, with any personal data already redacted; it is only
 * meaningful when {@code approved} is true.
 */
public record ReflectionAudit(boolean approved, List<AuditRule> rulesTriggered, String content) {

    public ReflectionAudit {
        rulesTriggered = List.copyOf(Objects.requireNonNull(rulesTriggered, "rulesTriggered"));
        Objects.requireNonNull(content, "content");
    }

    static ReflectionAudit approved(List<AuditRule> rulesTriggered, String content) {
        return new ReflectionAudit(true, rulesTriggered, content);
    }

    static ReflectionAudit blocked(List<AuditRule> rulesTriggered, String content) {
        return new ReflectionAudit(false, rulesTriggered, content);
    }
}
