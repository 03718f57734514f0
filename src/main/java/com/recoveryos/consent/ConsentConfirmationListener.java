package com.recoveryos.consent;

public interface ConsentConfirmationListener {
    void onConsentAccepted(String subject, ConsentRecord record);
}
