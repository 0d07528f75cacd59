package com.copytraderadar.ingestion.config;

import jakarta.validation.constraints.AssertTrue;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Inbound webhook signature policy.
 */
@ConfigurationProperties(prefix = "copytrade.webhook")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class WebhookProperties {

    /** Shared HMAC-SHA256 secret. Blank means signatures are accepted unchecked. */
    private String secret = "";

    /** When true, requests without a signature header are rejected. Default false. */
    private boolean requireSignature = false;

    /** Requiring signatures without a secret to check them against is a startup error. */
    @AssertTrue(message = "copytrade.webhook.secret must be set when copytrade.webhook.require-signature is true")
    public boolean isSecretConfiguredWhenRequired() {
        return !requireSignature || (secret != null && !secret.isBlank());
    }
}
