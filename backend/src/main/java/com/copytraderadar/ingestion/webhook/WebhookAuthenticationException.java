package com.copytraderadar.ingestion.webhook;

/**
 * Signature policy violation at the webhook boundary. The request is rejected with no side effects.
 */
public abstract class WebhookAuthenticationException extends RuntimeException {

    protected WebhookAuthenticationException(String message) {
        super(message);
    }

    /** Machine-readable code for the error body. */
    public abstract String getCode();
}
