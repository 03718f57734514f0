package com.recoveryos.safety;

import com.recoveryos.risk.Reflections;
import com.recoveryos.risk.RiskBand;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Last check on reflection text before it leaves the service. Rules run in a
 * fixed order and are deterministic:
 * <ol>
 *   <li>self-harm language blocks, unless the text is itself a safety resource;</li>
 *   <li>stigmatizing language blocks, unless it appears in a clinical phrase;</li>
 *   <li>a high-band reflection without the crisis notice blocks;</li>
 *   <li>personal data (SSN, phone, email, street address) is redacted.</li>
 * </ol>
 */
public class ReflectionAuditor {

    private static final List<Pattern> CRISIS_PATTERNS = compile(
            "\\b(kill|harm|hurt)\\s+(myself|yourself|themselves)\\b",
            "\\bsuicid(e|al)\\b",
            "\\bend\\s+(my|your|their)\\s+life\\b",
            "\\bwant\\s+to\\s+die\\b",
            "\\bbetter\\s+off\\s+dead\\b",
            "\\bno\\s+reason\\s+to\\s+live\\b"
    );

    private static final List<Pattern> SAFETY_RESOURCE_PATTERNS = compile(
            "crisis\\s+(line|hotline)",
            "\\b988\\b",
            "emergency\\s+(services|number)",
            "if\\s+you\\s+are\\s+in\\s+danger"
    );

    private static final List<Pattern> STIGMA_PATTERNS = compile(
            "\\baddict\\b",
            "\\bjunkie\\b",
            "\\bcrackhead\\b",
            "\\bdrug\\s+abuse\\b",
            "\\bclean\\b",
            "\\bdirty\\b",
            "\\brelapse\\b.*\\bfail(ed|ure)\\b"
    );

    private static final List<Pattern> CLINICAL_PATTERNS = compile(
            "craving\\s+assessment",
            "craving\\s+scale",
            "substance\\s+use\\s+disorder",
            "recovery\\s+plan"
    );

    private static final List<Redaction> REDACTIONS = List.of(
            new Redaction(Pattern.compile("\\b\\d{3}-\\d{2}-\\d{4}\\b"), "[SSN_REDACTED]"),
            new Redaction(Pattern.compile("\\b\\d{3}-\\d{3}-\\d{4}\\b"), "[PHONE_REDACTED]"),
            new Redaction(Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b"), "[EMAIL_REDACTED]"),
            new Redaction(Pattern.compile(
                    "\\b\\d{1,5}\\s+[\\w\\s]+?\\s(?:street|st|avenue|ave|road|rd|boulevard|blvd)\\b",
                    Pattern.CASE_INSENSITIVE), "[ADDRESS_REDACTED]")
    );

    public ReflectionAudit audit(String reflection, RiskBand band) {
        Objects.requireNonNull(reflection, "reflection");
        Objects.requireNonNull(band, "band");
        List<AuditRule> triggered = new ArrayList<>();

        if (anyMatch(CRISIS_PATTERNS, reflection)) {
            triggered.add(AuditRule.CRISIS_LANGUAGE);
            if (!anyMatch(SAFETY_RESOURCE_PATTERNS, reflection)) {
                return ReflectionAudit.blocked(triggered, reflection);
            }
        }
        if (anyMatch(STIGMA_PATTERNS, reflection) && !anyMatch(CLINICAL_PATTERNS, reflection)) {
            triggered.add(AuditRule.STIGMA_LANGUAGE);
            return ReflectionAudit.blocked(triggered, reflection);
        }
        if (band == RiskBand.HIGH && !reflection.contains(Reflections.CRISIS_NOTICE)) {
            triggered.add(AuditRule.CRISIS_NOTICE_MISSING);
            return ReflectionAudit.blocked(triggered, reflection);
        }

        String sanitized = redact(reflection);
        if (!sanitized.equals(reflection)) {
            triggered.add(AuditRule.PII_REDACTED);
        }
        return ReflectionAudit.approved(triggered, sanitized);
    }

    private static String redact(String text) {
        String out = text;
        for (Redaction redaction : REDACTIONS) {
            out = redaction.pattern().matcher(out).replaceAll(Matcher.quoteReplacement(redaction.replacement()));
        }
        return out;
    }

    private static boolean anyMatch(List<Pattern> patterns, String text) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }

    private static List<Pattern> compile(String... regexes) {
        List<Pattern> patterns = new ArrayList<>(regexes.length);
        for (String regex : regexes) {
            patterns.add(Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
        }
        return List.copyOf(patterns);
    }

    private record Redaction(Pattern pattern, String replacement) {
    }
}
