package com.copytraderadar.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Acknowledgement for every authenticated webhook, whether the event was ignored, matched or partly failed.
 * Tracked-event fields are omitted for ignored events.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WebhookAckResponse(
        String message,
        Instant timestamp,
        @JsonProperty("event_type") String eventType,
        String network,
        @JsonProperty("signature_verified") boolean signatureVerified,
        @JsonProperty("received_data") JsonNode receivedData,
        @JsonProperty("token_info") TokenInfo tokenInfo,
        @JsonProperty("token_type") String tokenType,
        Matches matches
) {

    /**
     * Per-config results for a tracked event.
     */
    public record Matches(
            @JsonProperty("matched_configs") long matchedConfigs,
            long persisted,
            long duplicates,
            long failed,
            @JsonProperty("notifications_attempted") long notificationsAttempted,
            String error
    ) {
    }
}
