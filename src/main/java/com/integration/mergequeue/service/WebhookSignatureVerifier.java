package com.integration.mergequeue.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Optional;

/**
 * Checks the X-Hub-Signature-256 header GitHub computes over the webhook body.
 * Without a configured secret every delivery is accepted.
 */
@Component
@Slf4j
public class WebhookSignatureVerifier {

    private static final String HMAC_SHA256 = "HmacSHA256";
    private static final String SIGNATURE_PREFIX = "sha256=";

    private final Optional<SecretKeySpec> signingKey;

    public WebhookSignatureVerifier(@Value("${github.webhook.secret:}") String webhookSecret) {
        if (webhookSecret == null || webhookSecret.isBlank()) {
            log.warn("Webhook secret not configured, signature validation is disabled");
            this.signingKey = Optional.empty();
        } else {
            this.signingKey = Optional.of(
                    new SecretKeySpec(webhookSecret.getBytes(StandardCharsets.UTF_8), HMAC_SHA256));
        }
    }

    public boolean isValid(byte[] payload, String signature) {
        if (signingKey.isEmpty()) {
            return true;
        }
        Optional<byte[]> received = decode(signature);
        if (received.isEmpty()) {
            log.error("Invalid or missing webhook signature header");
            return false;
        }
        boolean valid = MessageDigest.isEqual(digest(signingKey.get(), payload), received.get());
        if (!valid) {
            log.error("Webhook signature validation failed");
        }
        return valid;
    }

    private static Optional<byte[]> decode(String signature) {
        if (signature == null || !signature.startsWith(SIGNATURE_PREFIX)) {
            return Optional.empty();
        }
        try {
            return Optional.of(HexFormat.of().parseHex(signature.substring(SIGNATURE_PREFIX.length())));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    private static byte[] digest(SecretKeySpec key, byte[] payload) {
        try {
            Mac mac = Mac.getInstance(HMAC_SHA256);
            mac.init(key);
            return mac.doFinal(payload != null ? payload : new byte[0]);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 is not available", e);
        }
    }
}
