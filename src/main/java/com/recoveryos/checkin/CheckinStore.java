package com.recoveryos.checkin;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Append-only, per-subject check-in histories held in memory.
 * <p>
 * Every subject has its own monitor; appends for one subject are linearized in
 * the order they acquire it, and different subjects never contend. Histories
 * are never evicted.
 */
public class CheckinStore {

    private final ConcurrentMap<String, SubjectHistory> histories = new ConcurrentHashMap<>();
    private final AtomicLong total = new AtomicLong();

    public void append(String subject, CheckinRecord record) {
        Objects.requireNonNull(record, "record");
        historyOf(subject).append(record);
    }

    /**
     * Snapshot of the subject's history. Includes every append that returned
     * before this call started; unknown subjects yield an empty list.
     */
    public List<CheckinRecord> readAll(String subject) {
        SubjectHistory history = histories.get(Objects.requireNonNull(subject, "subject"));
        return history == null ? List.of() : history.snapshot();
    }

    /**
     * Appends and snapshots under the same per-subject lock, so the returned
     * history always ends with {@code record}.
     */
    public List<CheckinRecord> appendAndRead(String subject, CheckinRecord record) {
        Objects.requireNonNull(record, "record");
        return historyOf(subject).appendAndSnapshot(record);
    }

    public long count() {
        return total.get();
    }

    private SubjectHistory historyOf(String subject) {
        return histories.computeIfAbsent(Objects.requireNonNull(subject, "subject"), s -> new SubjectHistory());
    }

    private final class SubjectHistory {
        private final List<CheckinRecord> records = new ArrayList<>();

        private synchronized void append(CheckinRecord record) {
            records.add(record);
            total.incrementAndGet();
        }

        private synchronized List<CheckinRecord> snapshot() {
            return List.copyOf(records);
        }

        private synchronized List<CheckinRecord> appendAndSnapshot(CheckinRecord record) {
            append(record);
            return snapshot();
        }
    }
}
