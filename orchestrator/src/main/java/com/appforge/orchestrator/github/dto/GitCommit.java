package com.appforge.orchestrator.github.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Subset of a Git Data API commit: its own SHA and the SHA of its tree.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GitCommit(String sha, TreeRef tree) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TreeRef(String sha) {}

    public String treeSha() {
        return tree == null ? null : tree.sha();
    }
}
