package com.copytraderadar.ingestion.payload;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Parses the raw webhook body into a {@link WebhookPayload}. Never fails: a body that is not a
 * JSON object yields a payload made entirely of defaults, which the classifier then ignores.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class WebhookPayloadParser {

    private final ObjectMapper objectMapper;

    public WebhookPayload parse(String rawBody) {
        JsonNode root = readTree(rawBody);
        String to = text(root, "to", WebhookPayload.UNKNOWN);
        String value = text(root, "value", null);
        if (value == null) {
            value = text(root, "valueString", "0");
        }
        String contract = text(root, "contractAddress", null);
        if (contract == null) {
            contract = WebhookPayload.UNKNOWN.equals(to) ? "" : to;
        }
        return new WebhookPayload(
                text(root, "eventType", WebhookPayload.UNKNOWN),
                text(root, "transactionHash", WebhookPayload.NO_HASH),
                text(root, "network", WebhookPayload.UNKNOWN),
                text(root, "from", WebhookPayload.UNKNOWN),
                to,
                value,
                contract,
                root);
    }

    private JsonNode readTree(String rawBody) {
        if (rawBody == null || rawBody.isBlank()) {
            return NullNode.getInstance();
        }
        try {
            JsonNode node = objectMapper.readTree(rawBody);
            return node != null ? node : NullNode.getInstance();
        } catch (JsonProcessingException e) {
            log.debug("Webhook body is not valid JSON: {}", e.getOriginalMessage());
            return NullNode.getInstance();
        }
    }

    /**
     * Field as text; numbers are rendered in plain notation. Missing, null and empty values fall back.
     */
    private static String text(JsonNode root, String field, String fallback) {
        if (root == null || !root.isObject()) {
            return fallback;
        }
        JsonNode node = root.get(field);
        if (node == null || node.isNull() || node.isContainerNode()) {
            return fallback;
        }
        String s;
        if (node.isIntegralNumber()) {
            s = node.bigIntegerValue().toString();
        } else if (node.isNumber()) {
            s = node.decimalValue().toPlainString();
        } else {
            s = node.asText();
        }
        return s == null || s.isEmpty() ? fallback : s;
    }
}
