package com.recoveryos.checkin;

import com.recoveryos.metrics.RecoveryMetrics;
import com.recoveryos.risk.Reflections;
import com.recoveryos.risk.RiskAssessment;
import com.recoveryos.risk.RiskBand;
import com.recoveryos.risk.RiskScorer;
import com.recoveryos.safety.ReflectionAudit;
import com.recoveryos.safety.ReflectionAuditor;
import com.recoveryos.utils.SubjectPseudonymizer;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Ingestion path for an admitted check-in: store it, score the history that
 * now contains it, and pick the reflection for the resulting band. A
 * reflection the auditor rejects is replaced by the neutral text.
 */
@Slf4j
public class CheckinService {

    private final CheckinStore store;
    private final RiskScorer scorer;
    private final RecoveryMetrics metrics;
    private final SubjectPseudonymizer pseudonymizer;
    private final ReflectionAuditor auditor;

    public CheckinService(
            CheckinStore store,
            RiskScorer scorer,
            RecoveryMetrics metrics,
            SubjectPseudonymizer pseudonymizer,
            ReflectionAuditor auditor
    ) {
        this.store = store;
        this.scorer = scorer;
        this.metrics = metrics;
        this.pseudonymizer = pseudonymizer;
        this.auditor = auditor;
    }

    public CheckinOutcome submit(String subject, CheckinRecord record) {
        List<CheckinRecord> history = store.appendAndRead(subject, record);
        RiskAssessment assessment = scorer.evaluate(history);
        String reflection = reflectionFor(subject, assessment.band());
        metrics.recordCheckin(assessment.band());
        log.info("check-in scored subject={} score={} band={} historySize={}",
                pseudonymizer.pseudonym(subject), assessment.score(), assessment.band().wireName(), history.size());
        return new CheckinOutcome(assessment, reflection, history.size());
    }

    private String reflectionFor(String subject, RiskBand band) {
        ReflectionAudit audit = auditor.audit(Reflections.reflectionFor(band), band);
        if (audit.approved()) {
            return audit.content();
        }
        log.warn("reflection withheld subject={} band={} rules={}",
                pseudonymizer.pseudonym(subject), band.wireName(), audit.rulesTriggered());
        metrics.recordReflectionWithheld(audit.rulesTriggered());
        return Reflections.neutralFor(band);
    }
}
