package com.copytraderadar.ingestion.classifier;

import java.util.Optional;

/**
 * Outcome of classifying a webhook: either a tracked transfer or "received but irrelevant".
 * Ignored results still carry the event type and network so they can be acknowledged.
 */
public record ClassificationResult(String eventType, String network, ClassifiedTransfer transfer, String ignoreReason) {

    public static ClassificationResult tracked(String eventType, String network, ClassifiedTransfer transfer) {
        return new ClassificationResult(eventType, network, transfer, null);
    }

    public static ClassificationResult ignored(String eventType, String network, String reason) {
        return new ClassificationResult(eventType, network, null, reason);
    }

    public boolean isIgnored() {
        return transfer == null;
    }

    public Optional<ClassifiedTransfer> trackedTransfer() {
        return Optional.ofNullable(transfer);
    }
}
