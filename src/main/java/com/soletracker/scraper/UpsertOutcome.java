package com.soletracker.scraper;

/**
 * Result of writing one canonical record.
 *
 * @param recordId canonical id of the record
 * @param status what happened
 * @param reason failure or skip reason, null on success
 * @param target name of the write path used, null when nothing was written
 * @param attempts write attempts made
 */
public record UpsertOutcome(String recordId, Status status, String reason, String target, int attempts) {

    public enum Status { INSERTED, UPDATED, SKIPPED, FAILED }

    public static UpsertOutcome written(String recordId, Status status, String target, int attempts) {
        return new UpsertOutcome(recordId, status, null, target, attempts);
    }

    public static UpsertOutcome skipped(String recordId, String reason) {
        return new UpsertOutcome(recordId, Status.SKIPPED, reason, null, 0);
    }

    public static UpsertOutcome failed(String recordId, String reason, String target, int attempts) {
        return new UpsertOutcome(recordId, Status.FAILED, reason, target, attempts);
    }

    public boolean isPersisted() {
        return status == Status.INSERTED || status == Status.UPDATED;
    }
}
