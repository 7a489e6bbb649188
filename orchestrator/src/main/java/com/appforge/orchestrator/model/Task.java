package com.appforge.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * One accepted request to generate and deploy an application.
 *
 * Immutable: retries and recovery re-runs operate on the same Task value,
 * which is persisted as JSON next to its TaskRecord.
 */
public record Task(
        String           email,
        String           task,
        int              round,
        String           nonce,
        String           brief,
        List<String>     checks,
        List<Attachment> attachments,
        String           evaluationUrl
) {

    public Task {
        checks      = checks == null      ? List.of() : List.copyOf(checks);
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
        brief       = brief == null       ? ""        : brief;
    }

    /**
     * Idempotency key: SHA-256 over email, nonce and round.
     * Two submissions with the same triple map to the same repository.
     */
    @JsonIgnore
    public String key() {
        String material = email + "\n" + nonce + "\n" + round;
        try {
            MessageDigest sha = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(sha.digest(material.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @JsonIgnore
    public boolean hasEvaluationUrl() {
        return evaluationUrl != null && !evaluationUrl.isBlank();
    }
}
