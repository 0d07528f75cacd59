package com.copytraderadar.ingestion.classifier;

import java.math.BigInteger;

/**
 * A transfer of a tracked token.
 *
 * @param rawValue     integer amount before decimal scaling; this is what gets persisted
 * @param displayValue rawValue scaled by the token's decimals to six places, for messages only
 */
public record ClassifiedTransfer(
        TransferKind kind,
        TrackedToken token,
        String transactionHash,
        String network,
        String from,
        String to,
        BigInteger rawValue,
        String displayValue
) {
}
