package com.appforge.orchestrator.github.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Subset of GET /repos/{owner}/{repo}/pages.
 * status is "built", "building", "errored" or null while nothing was built yet.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PagesInfo(String status, String html_url) {}
