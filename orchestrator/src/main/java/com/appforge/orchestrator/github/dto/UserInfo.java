package com.appforge.orchestrator.github.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Subset of GET /user: the account the token authenticates as.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UserInfo(String login) {}
