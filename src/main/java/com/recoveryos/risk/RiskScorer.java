package com.recoveryos.risk;

import com.recoveryos.checkin.CheckinRecord;

import java.util.List;

public interface RiskScorer {
    RiskAssessment evaluate(List<CheckinRecord> history);
}
