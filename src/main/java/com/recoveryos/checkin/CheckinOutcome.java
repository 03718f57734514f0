package com.recoveryos.checkin;

import com.recoveryos.risk.RiskAssessment;

public record CheckinOutcome(RiskAssessment assessment, String reflection, int historySize) {
}
