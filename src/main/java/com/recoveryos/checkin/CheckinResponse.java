package com.recoveryos.checkin;

import com.recoveryos.risk.RiskBand;

public record CheckinResponse(
        String riskScoreVersion,
        Integer score,
        RiskBand band,
        String reflection,
        String crisisFooter,
        String promptVersion,
        int historySize
) {
}
