package com.recoveryos.risk;

import com.recoveryos.checkin.CheckinRecord;

import java.util.List;

/**
 * Fixed additive policy over the latest check-in. At least
 * {@value #MINIMUM_HISTORY} records are required before any score is produced;
 * earlier records only count toward that floor.
 */
public class DefaultRiskScorer implements RiskScorer {

    public static final int MINIMUM_HISTORY = 3;

    @Override
    public RiskAssessment evaluate(List<CheckinRecord> history) {
        if (history == null || history.size() < MINIMUM_HISTORY) {
            return RiskAssessment.insufficientData();
        }
        CheckinRecord latest = history.get(history.size() - 1);

        int score = adherenceComponent(latest.adherence())
                + moodComponent(latest.moodTrend())
                + cravingComponent(latest.cravings())
                + sleepComponent(latest.sleepHours())
                + isolationComponent(latest.isolation());

        return RiskAssessment.scored(Math.max(0, Math.min(100, score)));
    }

    // 0..25
    static int adherenceComponent(int adherence) {
        return Math.max(0, 100 - adherence) / 4;
    }

    // 0..30
    static int moodComponent(int moodTrend) {
        return Math.max(0, -moodTrend) * 3;
    }

    // 0..33
    static int cravingComponent(int cravings) {
        return cravings / 3;
    }

    // 0..32
    static int sleepComponent(double sleepHours) {
        return (int) Math.floor(Math.max(0.0, 8.0 - sleepHours) * 4);
    }

    // 0..50
    static int isolationComponent(int isolation) {
        return isolation / 2;
    }
}
