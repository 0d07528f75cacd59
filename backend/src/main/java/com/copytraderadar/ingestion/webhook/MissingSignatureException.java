package com.copytraderadar.ingestion.webhook;

public class MissingSignatureException extends WebhookAuthenticationException {

    public MissingSignatureException() {
        super("Webhook signature required but not provided");
    }

    @Override
    public String getCode() {
        return "MISSING_SIGNATURE";
    }
}
