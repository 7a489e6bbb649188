package com.appforge.orchestrator.api.dto;

import jakarta.validation.constraints.NotBlank;

public record AttachmentRequest(@NotBlank String name, @NotBlank String url) {}
