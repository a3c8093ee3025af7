package com.integration.mergequeue.service;

import org.junit.jupiter.api.Test;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.util.HexFormat;

import static org.assertj.core.api.Assertions.assertThat;

class WebhookSignatureVerifierTest {

    private static final String SECRET = "It's a Secret to Everybody";
    private static final byte[] PAYLOAD = "{\"action\":\"created\"}".getBytes(StandardCharsets.UTF_8);

    @Test
    void acceptsSignatureComputedWithSharedSecret() throws Exception {
        WebhookSignatureVerifier verifier = new WebhookSignatureVerifier(SECRET);

        assertThat(verifier.isValid(PAYLOAD, sign(SECRET, PAYLOAD))).isTrue();
    }

    @Test
    void rejectsSignatureComputedWithAnotherSecret() throws Exception {
        WebhookSignatureVerifier verifier = new WebhookSignatureVerifier(SECRET);

        assertThat(verifier.isValid(PAYLOAD, sign("another secret", PAYLOAD))).isFalse();
    }

    @Test
    void rejectsTamperedPayload() throws Exception {
        WebhookSignatureVerifier verifier = new WebhookSignatureVerifier(SECRET);
        String signature = sign(SECRET, PAYLOAD);

        assertThat(verifier.isValid("{\"action\":\"deleted\"}".getBytes(StandardCharsets.UTF_8), signature))
                .isFalse();
    }

    @Test
    void rejectsMissingOrMalformedHeader() {
        WebhookSignatureVerifier verifier = new WebhookSignatureVerifier(SECRET);

        assertThat(verifier.isValid(PAYLOAD, null)).isFalse();
        assertThat(verifier.isValid(PAYLOAD, "sha1=abcdef")).isFalse();
    }

    @Test
    void rejectsSignatureThatIsNotHex() {
        WebhookSignatureVerifier verifier = new WebhookSignatureVerifier(SECRET);

        assertThat(verifier.isValid(PAYLOAD, "sha256=not-a-digest")).isFalse();
        assertThat(verifier.isValid(PAYLOAD, "sha256=")).isFalse();
    }

    @Test
    void acceptsUppercaseHexDigest() throws Exception {
        WebhookSignatureVerifier verifier = new WebhookSignatureVerifier(SECRET);
        String signature = sign(SECRET, PAYLOAD);

        assertThat(verifier.isValid(PAYLOAD, "sha256=" + signature.substring(7).toUpperCase())).isTrue();
    }

    @Test
    void acceptsEverythingWithoutSecret() {
        WebhookSignatureVerifier verifier = new WebhookSignatureVerifier("");

        assertThat(verifier.isValid(PAYLOAD, null)).isTrue();
        assertThat(verifier.isValid(PAYLOAD, "sha256=garbage")).isTrue();
    }

    private static String sign(String secret, byte[] payload) throws Exception {
        Mac mac = Mac.getInstance("HmacSHA256");
        mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
        return "sha256=" + HexFormat.of().formatHex(mac.doFinal(payload));
    }
}
