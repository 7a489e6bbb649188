package com.appforge.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * A file the caller ships alongside the brief.
 *
 * url is either a data: URI (inline content) or an http(s) link that the
 * generated app is expected to reference.
 */
public record Attachment(String name, String url) {

    @JsonIgnore
    public boolean isInline() {
        return url != null && url.startsWith("data:");
    }
}
