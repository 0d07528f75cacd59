package com.copytraderadar.ingestion.pipeline;

/**
 * What happened for one matched config.
 *
 * @param eventId               stored (or pre-existing) event id; null when persistence failed
 * @param notificationAttempted true when an alert was handed to the dispatcher
 */
public record BranchOutcome(
        String configId,
        String accountName,
        Status status,
        String eventId,
        boolean notificationAttempted,
        String error
) {

    public enum Status {
        /** New event row written. */
        PERSISTED,
        /** Row already existed: re-delivered webhook. */
        DUPLICATE,
        /** Storage error; sibling branches are unaffected. */
        FAILED
    }
}
