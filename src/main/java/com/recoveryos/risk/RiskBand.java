package com.recoveryos.risk;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RiskBand {
    LOW("low"),
    ELEVATED("elevated"),
    MODERATE("moderate"),
    HIGH("high"),
    INSUFFICIENT_DATA("insufficient_data");

    private final String wireName;

    RiskBand(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Band for a clamped score: [0,30) low, [30,55) elevated, [55,75) moderate,
     * [75,100] high.
     */
    public static RiskBand fromScore(int score) {
        if (score < 0 || score > 100) {
            throw new IllegalArgumentException("score out of range: " + score);
        }
        if (score >= 75) {
            return HIGH;
        }
        if (score >= 55) {
            return MODERATE;
        }
        if (score >= 30) {
            return ELEVATED;
        }
        return LOW;
    }
}
