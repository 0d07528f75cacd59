package com.copytraderadar.ingestion.webhook;

public class InvalidSignatureException extends WebhookAuthenticationException {

    public InvalidSignatureException() {
        super("Invalid webhook signature");
    }

    @Override
    public String getCode() {
        return "INVALID_SIGNATURE";
    }
}
