/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.hubrelay.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Verifies GitHub webhook deliveries against the shared secret.
 *
 * <p>
 * GitHub signs the raw request body with HMAC-SHA256 and sends the hex digest
 * in {@code X-Hub-Signature-256} as {@code sha256=<hex>}. The comparison is
 * constant-time to prevent timing attacks.
 *
 * <p>
 * An empty secret disables verification and every delivery is accepted. This
 * never throws: malformed input yields {@code false}.
 */
@Component
@Slf4j
public class WebhookSignatureVerifier {

    public static final String SIGNATURE_PREFIX = "sha256=";
    private static final String HMAC_ALGORITHM = "HmacSHA256";

    /**
     * @param secret
     *            shared webhook secret, {@code null} or empty to disable
     *            verification
     * @param body
     *            raw request body bytes
     * @param signatureHeader
     *            value of {@code X-Hub-Signature-256}, may be {@code null}
     * @return {@code true} if the signature is valid or verification is disabled
     */
    public boolean verify(String secret, byte[] body, String signatureHeader) {
        if (secret == null || secret.isEmpty()) {
            log.warn("[Webhook] No webhook secret configured, skipping signature verification");
            return true;
        }
        if (signatureHeader == null) {
            log.warn("[Webhook] No signature header provided");
            return false;
        }
        if (!signatureHeader.startsWith(SIGNATURE_PREFIX)) {
            log.warn("[Webhook] Invalid signature format");
            return false;
        }

        String expected = computeHmacSha256(secret, body != null ? body : new byte[0]);
        if (expected == null) {
            return false;
        }
        String provided = signatureHeader.substring(SIGNATURE_PREFIX.length());
        return constantTimeEquals(expected, provided);
    }

    String computeHmacSha256(String secret, byte[] data) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(data));
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            log.error("[Webhook] Failed to compute HMAC: {}", e.getMessage());
            return null;
        }
    }

    private boolean constantTimeEquals(String expected, String provided) {
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                provided.getBytes(StandardCharsets.UTF_8));
    }
}
