package com.copytraderadar.ingestion.webhook;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * HMAC-SHA256 webhook authentication. The digest is computed over the exact bytes received,
 * never over a re-serialized form, and compared in constant time.
 */
@Component
@Slf4j
public class WebhookSignatureVerifier {

    public static final String COINBASE_SIGNATURE_HEADER = "x-coinbase-signature";
    public static final String GENERIC_SIGNATURE_HEADER = "x-webhook-signature";

    private static final String HMAC_SHA256 = "HmacSHA256";

    /**
     * True when signatureHex is the hex HMAC-SHA256 of rawBody under sharedSecret.
     * Any decoding problem (odd length, non-hex, missing input) yields false; nothing is thrown.
     */
    public boolean verify(String signatureHex, String rawBody, String sharedSecret) {
        if (signatureHex == null || rawBody == null || sharedSecret == null || sharedSecret.isEmpty()) {
            return false;
        }
        try {
            byte[] supplied = HexFormat.of().parseHex(stripPrefix(signatureHex.strip()));
            byte[] expected = hmac(rawBody.getBytes(StandardCharsets.UTF_8), sharedSecret);
            return MessageDigest.isEqual(supplied, expected);
        } catch (IllegalArgumentException | GeneralSecurityException e) {
            log.debug("Webhook signature could not be decoded: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Applies the signature policy. A present signature must verify when a secret is configured;
     * with a blank secret it is accepted unchecked and reported as not verified. An absent signature
     * is only rejected when requireSignature is set.
     *
     * @throws MissingSignatureException when required and absent
     * @throws InvalidSignatureException when present and not matching
     */
    public VerifiedWebhook process(String rawBody, String signature, String secret, boolean requireSignature) {
        boolean present = signature != null && !signature.isBlank();
        if (!present) {
            if (requireSignature) {
                throw new MissingSignatureException();
            }
            return new VerifiedWebhook(true, rawBody, false);
        }
        if (secret == null || secret.isBlank()) {
            log.warn("Webhook carries a signature but no shared secret is configured; signature not checked");
            return new VerifiedWebhook(true, rawBody, false);
        }
        if (!verify(signature, rawBody, secret)) {
            throw new InvalidSignatureException();
        }
        return new VerifiedWebhook(true, rawBody, true);
    }

    /**
     * Lower-case hex HMAC-SHA256 of the body; what a correctly configured sender puts in the header.
     */
    public String sign(String rawBody, String sharedSecret) {
        try {
            return HexFormat.of().formatHex(hmac(rawBody.getBytes(StandardCharsets.UTF_8), sharedSecret));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }

    /**
     * Signature from x-coinbase-signature, else x-webhook-signature, else null.
     */
    public static String extractSignature(HttpHeaders headers) {
        if (headers == null) {
            return null;
        }
        String coinbase = headers.getFirst(COINBASE_SIGNATURE_HEADER);
        if (coinbase != null && !coinbase.isBlank()) {
            return coinbase;
        }
        String generic = headers.getFirst(GENERIC_SIGNATURE_HEADER);
        return generic != null && !generic.isBlank() ? generic : null;
    }

    private static byte[] hmac(byte[] body, String secret) throws GeneralSecurityException {
        Mac mac = Mac.getInstance(HMAC_SHA256);
        mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_SHA256));
        return mac.doFinal(body);
    }

    private static String stripPrefix(String hex) {
        if (hex.startsWith("sha256=")) {
            return hex.substring("sha256=".length());
        }
        return hex;
    }
}
