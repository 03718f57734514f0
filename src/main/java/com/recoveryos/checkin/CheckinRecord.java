package com.recoveryos.checkin;

import java.time.Instant;
import java.util.Objects;

/**
 * One self-reported check-in. Ranges are enforced by the request layer before
 * a record is built; the record itself only rejects a missing timestamp.
 *
 * @param adherence  0..100, 100 means fully on plan
 * @param moodTrend  -10..10, negative means mood is falling
 * @param cravings   0..100
 * @param sleepHours 0..24
 * @param isolation  0..100
 * @param recordedAt client-declared or server-assigned capture time
 */
public record CheckinRecord(
        int adherence,
        int moodTrend,
        int cravings,
        double sleepHours,
        int isolation,
        Instant recordedAt
) {
    public CheckinRecord {
        Objects.requireNonNull(recordedAt, "recordedAt");
    }
}
