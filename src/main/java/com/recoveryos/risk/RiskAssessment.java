package com.recoveryos.risk;

import java.util.Objects;

/**
 * Derived classification of a history. {@code score} is null exactly when the
 * band is {@link RiskBand#INSUFFICIENT_DATA}; otherwise the band is the one the
 * score falls in.
 */
public record RiskAssessment(Integer score, RiskBand band) {

    private static final RiskAssessment INSUFFICIENT = new RiskAssessment(null, RiskBand.INSUFFICIENT_DATA);

    public RiskAssessment {
        Objects.requireNonNull(band, "band");
        if ((score == null) != (band == RiskBand.INSUFFICIENT_DATA)) {
            throw new IllegalArgumentException("score " + score + " does not match band " + band);
        }
        if (score != null && RiskBand.fromScore(score) != band) {
            throw new IllegalArgumentException("score " + score + " does not match band " + band);
        }
    }

    public static RiskAssessment insufficientData() {
        return INSUFFICIENT;
    }

    public static RiskAssessment scored(int score) {
        return new RiskAssessment(score, RiskBand.fromScore(score));
    }
}
