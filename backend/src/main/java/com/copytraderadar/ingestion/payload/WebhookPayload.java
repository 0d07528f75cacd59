package com.copytraderadar.ingestion.payload;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Typed, total view of an inbound webhook body. Every field is non-null; absent fields carry
 * their defaults ("unknown" for event type, network and addresses, "0" for value).
 *
 * @param contractAddress token contract, defaulting to {@code to} when the payload has none
 * @param raw             the parsed JSON tree, echoed back in acknowledgements
 */
public record WebhookPayload(
        String eventType,
        String transactionHash,
        String network,
        String from,
        String to,
        String value,
        String contractAddress,
        JsonNode raw
) {

    public static final String UNKNOWN = "unknown";
    public static final String NO_HASH = "no hash";
    public static final String EVENT_ERC20_TRANSFER = "erc20_transfer";
    public static final String EVENT_TRANSACTION = "transaction";
}
