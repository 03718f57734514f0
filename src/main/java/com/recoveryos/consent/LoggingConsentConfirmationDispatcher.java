package com.recoveryos.consent;

import com.recoveryos.utils.SubjectPseudonymizer;
import lombok.extern.slf4j.Slf4j;

/**
 * Stands in for an outbound confirmation message. Only the subject's pseudonym
 * and the consent metadata reach the log.
 */
@Slf4j
public class LoggingConsentConfirmationDispatcher implements ConsentConfirmationListener {

    private final SubjectPseudonymizer pseudonymizer;

    public LoggingConsentConfirmationDispatcher(SubjectPseudonymizer pseudonymizer) {
        this.pseudonymizer = pseudonymizer;
    }

    @Override
    public void onConsentAccepted(String subject, ConsentRecord record) {
        log.info("consent confirmation queued subject={} scope={} termsVersion={}",
                pseudonymizer.pseudonym(subject), record.scope(), record.termsVersion());
    }
}
