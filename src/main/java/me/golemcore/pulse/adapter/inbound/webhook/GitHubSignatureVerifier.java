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

package me.golemcore.pulse.adapter.inbound.webhook;

import me.golemcore.pulse.infrastructure.config.PulseProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Verifies the {@code X-Hub-Signature-256} HMAC of inbound GitHub deliveries
 * against {@code pulse.webhooks.secret}.
 *
 * <p>
 * With no secret configured every delivery is accepted. Comparison is
 * constant-time.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GitHubSignatureVerifier {

    static final String SIGNATURE_HEADER = "X-Hub-Signature-256";
    private static final String SIGNATURE_PREFIX = "sha256=";
    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private final PulseProperties properties;

    public boolean verify(HttpHeaders headers, byte[] body) {
        String secret = properties.getWebhooks().getSecret();
        if (secret == null || secret.isBlank()) {
            return true;
        }

        String signatureHeader = headers.getFirst(SIGNATURE_HEADER);
        if (signatureHeader == null || !signatureHeader.startsWith(SIGNATURE_PREFIX)) {
            log.debug("[Webhooks] Missing or malformed {} header", SIGNATURE_HEADER);
            return false;
        }

        String expected = computeHmacSha256(secret, body);
        if (expected == null) {
            return false;
        }
        return constantTimeEquals(expected, signatureHeader.substring(SIGNATURE_PREFIX.length()));
    }

    static String computeHmacSha256(String secret, byte[] data) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(data));
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            log.error("[Webhooks] Failed to compute HMAC: {}", e.getMessage());
            return null;
        }
    }

    private static boolean constantTimeEquals(String expected, String provided) {
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8),
                provided.getBytes(StandardCharsets.UTF_8));
    }
}
