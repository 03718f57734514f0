package com.recoveryos.checkin;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.time.Instant;

@Data
public class CheckinRequest {
    @NotBlank
    @Size(max = 128)
    private String subject;

    @NotNull
    @Min(0)
    @Max(100)
    private Integer adherence;

    @NotNull
    @Min(-10)
    @Max(10)
    private Integer moodTrend;

    @NotNull
    @Min(0)
    @Max(100)
    private Integer cravings;

    @NotNull
    @DecimalMin("0.0")
    @DecimalMax("24.0")
    private Double sleepHours;

    @NotNull
    @Min(0)
    @Max(100)
    private Integer isolation;

    private Instant recordedAt;

    public CheckinRecord toRecord(Instant now) {
        return new CheckinRecord(
                adherence,
                moodTrend,
                cravings,
                sleepHours,
                isolation,
                recordedAt != null ? recordedAt : now
        );
    }
}
