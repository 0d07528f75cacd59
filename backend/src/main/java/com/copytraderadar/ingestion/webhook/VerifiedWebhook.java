package com.copytraderadar.ingestion.webhook;

/**
 * Result of applying the signature policy to an inbound body.
 *
 * @param processed always true when returned (failures throw)
 * @param data      the raw body exactly as received
 * @param verified  true only when a signature was present and matched
 */
public record VerifiedWebhook(boolean processed, String data, boolean verified) {
}
