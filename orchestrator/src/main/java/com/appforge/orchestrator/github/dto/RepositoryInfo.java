package com.appforge.orchestrator.github.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Subset of GET /repos/{owner}/{repo}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RepositoryInfo(
        String name,
        String html_url,
        String description,
        String default_branch,
        Owner  owner
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Owner(String login) {}
}
