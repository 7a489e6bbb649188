package com.appforge.orchestrator.api;

import com.appforge.orchestrator.config.AppForgeProperties;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;

/**
 * Checks the shared secret carried by a submission.
 *
 * With no secret configured every submission is refused, so a missing
 * environment variable cannot open the endpoint.
 */
@Component
public class SharedSecretVerifier {

    private final List<byte[]> accepted;

    public SharedSecretVerifier(AppForgeProperties properties) {
        this.accepted = properties.auth().acceptedSecrets().stream()
                .map(s -> s.getBytes(StandardCharsets.UTF_8))
                .toList();
    }

    public boolean isConfigured() {
        return !accepted.isEmpty();
    }

    /** Constant-time comparison against every accepted secret. */
    public boolean matches(String presented) {
        if (presented == null) {
            return false;
        }
        byte[] candidate = presented.getBytes(StandardCharsets.UTF_8);
        boolean match = false;
        for (byte[] secret : accepted) {
            match |= MessageDigest.isEqual(secret, candidate);
        }
        return match;
    }
}
