package com.copytraderadar.ingestion.pipeline;

import com.copytraderadar.ingestion.classifier.ClassificationResult;
import com.copytraderadar.ingestion.payload.WebhookPayload;

import java.util.List;

/**
 * Summary of one authenticated webhook, used to build the acknowledgement.
 *
 * @param matchError set when no branch could run: the config lookup failed or the transfer has no transaction hash
 */
public record IngestionOutcome(
        WebhookPayload payload,
        boolean signatureVerified,
        ClassificationResult classification,
        List<BranchOutcome> branches,
        String matchError
) {

    public long count(BranchOutcome.Status status) {
        return branches.stream().filter(b -> b.status() == status).count();
    }

    public long notificationsAttempted() {
        return branches.stream().filter(BranchOutcome::notificationAttempted).count();
    }
}
