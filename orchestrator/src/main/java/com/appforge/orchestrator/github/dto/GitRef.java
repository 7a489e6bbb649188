package com.appforge.orchestrator.github.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Response of GET /repos/{owner}/{repo}/git/ref/heads/{branch}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GitRef(String ref, Target object) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Target(String sha, String type) {}
}
