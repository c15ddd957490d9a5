package com.datafetch.infrastructure.cache;

import lombok.Value;

import java.util.UUID;

/**
 * Outcome of a dedup lookup: the job id a fingerprint points to, whether this caller created
 * that job, and whether the lookup was skipped because Redis was unavailable.
 */
@Value
public class DedupReservation {

    UUID jobId;
    boolean created;
    boolean bypassed;

    public static DedupReservation existing(UUID jobId) {
        return new DedupReservation(jobId, false, false);
    }

    public static DedupReservation created(UUID jobId) {
        return new DedupReservation(jobId, true, false);
    }

    public static DedupReservation bypassed(UUID jobId) {
        return new DedupReservation(jobId, true, true);
    }
}
