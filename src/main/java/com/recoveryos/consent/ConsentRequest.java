package com.recoveryos.consent;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.time.Instant;

@Data
public class ConsentRequest {
    @NotBlank
    @Size(max = 128)
    private String subject;

    @NotNull
    private Boolean accepted;

    @NotBlank
    @Size(max = 32)
    private String termsVersion;

    @Size(max = 64)
    private String scope;

    private Instant recordedAt;

    public ConsentRecord toRecord(Instant now) {
        return new ConsentRecord(accepted, termsVersion, scope, recordedAt != null ? recordedAt : now);
    }
}
