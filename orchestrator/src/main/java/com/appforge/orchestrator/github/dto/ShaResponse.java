package com.appforge.orchestrator.github.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** Blob and tree creation both answer with the new object's SHA. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ShaResponse(String sha) {}
