package com.recoveryos.checkin;

import com.recoveryos.config.RecoveryProperties;
import com.recoveryos.risk.Reflections;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;

@RestController
@RequiredArgsConstructor
public class CheckinController {

    private final CheckinService checkinService;
    private final RecoveryProperties properties;
    private final Clock clock;

    @PostMapping("/check-in")
    public CheckinResponse checkIn(@Valid @RequestBody CheckinRequest request) {
        CheckinOutcome outcome = checkinService.submit(request.getSubject(), request.toRecord(clock.instant()));
        return new CheckinResponse(
                properties.getRiskScoreVersion(),
                outcome.assessment().score(),
                outcome.assessment().band(),
                outcome.reflection(),
                Reflections.CRISIS_NOTICE,
                properties.getPromptVersion(),
                outcome.historySize()
        );
    }
}
