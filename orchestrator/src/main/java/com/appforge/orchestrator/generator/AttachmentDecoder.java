package com.appforge.orchestrator.generator;

import com.appforge.orchestrator.model.Attachment;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Locale;
import java.util.Optional;

/**
 * Decodes inline {@code data:} attachments.
 *
 * Linked (http/https) attachments are left alone: the generated app
 * references them by URL and nothing here fetches them.
 */
public final class AttachmentDecoder {

    /** Content of an inline attachment. */
    public record Decoded(String name, String mediaType, byte[] bytes) {

        public boolean isText() {
            String t = mediaType.toLowerCase(Locale.ROOT);
            return t.startsWith("text/")
                    || t.endsWith("json")
                    || t.endsWith("xml")
                    || t.endsWith("javascript")
                    || t.endsWith("csv");
        }

        public String text() {
            return new String(bytes, StandardCharsets.UTF_8);
        }
    }

    private AttachmentDecoder() {}

    /**
     * Decode a data: URI attachment.
     *
     * @return empty for linked attachments and for data: URIs that do not decode
     */
    public static Optional<Decoded> decode(Attachment attachment) {
        if (!attachment.isInline()) {
            return Optional.empty();
        }
        String uri   = attachment.url();
        int    comma = uri.indexOf(',');
        if (comma < 0) {
            return Optional.empty();
        }
        String meta    = uri.substring("data:".length(), comma);
        String payload = uri.substring(comma + 1);
        boolean base64 = meta.endsWith(";base64");
        String mediaType = (base64 ? meta.substring(0, meta.length() - ";base64".length()) : meta);
        int semi = mediaType.indexOf(';');
        if (semi >= 0) {
            mediaType = mediaType.substring(0, semi);
        }
        if (mediaType.isBlank()) {
            mediaType = "text/plain";
        }
        try {
            byte[] bytes = base64
                    ? Base64.getMimeDecoder().decode(payload)
                    : URLDecoder.decode(payload, StandardCharsets.UTF_8).getBytes(StandardCharsets.UTF_8);
            return Optional.of(new Decoded(attachment.name(), mediaType, bytes));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
