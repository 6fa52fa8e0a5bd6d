package me.golemcore.pulse.adapter.inbound.webhook;

import me.golemcore.pulse.infrastructure.config.PulseProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class GitHubSignatureVerifierTest {

    private static final byte[] BODY = "{\"zen\":\"Keep it logically awesome.\"}".getBytes(StandardCharsets.UTF_8);

    private PulseProperties properties;
    private GitHubSignatureVerifier verifier;

    @BeforeEach
    void setUp() {
        properties = new PulseProperties();
        properties.getWebhooks().setSecret("It's a Secret to Everybody");
        verifier = new GitHubSignatureVerifier(properties);
    }

    @Test
    void shouldMatchGitHubReferenceSignature() {
        String signature = GitHubSignatureVerifier.computeHmacSha256("It's a Secret to Everybody",
                "Hello, World!".getBytes(StandardCharsets.UTF_8));

        assertEquals("757107ea0eb2509fc211221cce984b8a37570b6d7586c22c46f4379c8b043e17", signature);
    }

    @Test
    void shouldAcceptValidSignature() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(GitHubSignatureVerifier.SIGNATURE_HEADER,
                "sha256=" + GitHubSignatureVerifier.computeHmacSha256("It's a Secret to Everybody", BODY));

        assertTrue(verifier.verify(headers, BODY));
    }

    @Test
    void shouldRejectWrongOrMissingSignature() {
        HttpHeaders wrong = new HttpHeaders();
        wrong.set(GitHubSignatureVerifier.SIGNATURE_HEADER,
                "sha256=" + GitHubSignatureVerifier.computeHmacSha256("other", BODY));
        HttpHeaders legacy = new HttpHeaders();
        legacy.set(GitHubSignatureVerifier.SIGNATURE_HEADER, "sha1=abc");

        assertFalse(verifier.verify(wrong, BODY));
        assertFalse(verifier.verify(legacy, BODY));
        assertFalse(verifier.verify(new HttpHeaders(), BODY));
    }

    @Test
    void shouldSkipVerificationWithoutSecret() {
        properties.getWebhooks().setSecret("");

        assertTrue(verifier.verify(new HttpHeaders(), BODY));
    }
}
