package com.recoveryos.consent;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Current consent per subject. Records are immutable and swapped whole, so a
 * reader sees either the previous or the new record, never a mix. Concurrent
 * writers to one subject resolve last-write-wins.
 */
public class ConsentStore {

    private final ConcurrentMap<String, ConsentRecord> records = new ConcurrentHashMap<>();

    public void put(String subject, ConsentRecord record) {
        records.put(Objects.requireNonNull(subject, "subject"), Objects.requireNonNull(record, "record"));
    }

    public Optional<ConsentRecord> get(String subject) {
        return Optional.ofNullable(records.get(Objects.requireNonNull(subject, "subject")));
    }
}
