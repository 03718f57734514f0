package com.recoveryos.consent;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;

@RestController
@RequestMapping("/consents")
@RequiredArgsConstructor
public class ConsentController {

    private final ConsentService consentService;
    private final Clock clock;

    @GetMapping
    public ConsentView get(@RequestParam String subject) {
        return consentService.current(subject)
                .map(record -> ConsentView.of(subject, record))
                .orElseGet(() -> ConsentView.notRecorded(subject));
    }

    @PostMapping
    public ConsentView put(@Valid @RequestBody ConsentRequest request) {
        ConsentRecord stored = consentService.record(request.getSubject(), request.toRecord(clock.instant()));
        return ConsentView.of(request.getSubject(), stored);
    }
}
