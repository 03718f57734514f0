package com.recoveryos.utils;

/**
 * Stable, salted pseudonym for subject identifiers that are about to be logged.
 */
public class SubjectPseudonymizer {

    private static final int LENGTH = 16;

    private final String salt;

    public SubjectPseudonymizer(String salt) {
        this.salt = salt;
    }

    public String pseudonym(String subject) {
        if (subject == null) {
            return "none";
        }
        return Hashing.salted(salt, subject).substring(0, LENGTH);
    }
}
