package com.appforge.orchestrator.generator;

import com.appforge.orchestrator.model.GeneratedFileSet;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the model's reply into a {@link GeneratedFileSet}.
 *
 * Accepted shapes, tried in order:
 * <ol>
 *   <li>JSON {@code {"files":[{"path":"...","content":"...","encoding":"base64"?}]}},
 *       optionally wrapped in a Markdown fence or surrounded by prose;</li>
 *   <li>JSON {@code {"files":{"path":"content", ...}}};</li>
 *   <li>{@code ### FILE: path} headings, each followed by one fenced block.
 *       A section runs up to the next heading and its content up to the last
 *       fence before it, so fences inside a file (a README's code samples)
 *       are kept.</li>
 * </ol>
 * Anything else, or a listing with no files or an unsafe path, is a
 * {@link ParseResult.Failure}. This class holds all the validation of
 * untrusted model output.
 */
public final class FileListingParser {

    private static final ObjectMapper JSON = new ObjectMapper();

    // ```json ... ``` or ``` ... ``` around the whole payload
    private static final Pattern JSON_FENCE = Pattern.compile(
            "```(?:json)?\\s*\\n(.*?)\\n\\s*```",
            Pattern.DOTALL
    );

    // ### FILE: index.html
    private static final Pattern FILE_HEADING = Pattern.compile(
            "^#{1,6}[ \\t]*FILE:[ \\t]*`?([^`\\n]+?)`?[ \\t]*$",
            Pattern.MULTILINE
    );

    // opening fence (language label optional) at the start of a section
    private static final Pattern OPENING_FENCE = Pattern.compile("\\A\\s*```[^\\n]*\\n");

    private FileListingParser() {}

    public static ParseResult parse(String response) {
        if (response == null || response.isBlank()) {
            return ParseResult.failure("Empty model response");
        }

        String jsonCandidate = extractJson(response);
        String jsonProblem   = null;
        if (jsonCandidate != null) {
            try {
                JsonNode root = JSON.readTree(jsonCandidate);
                if (root.has("files")) {
                    return fromJson(root);
                }
                // a JSON file inside a section listing, e.g. manifest.json
                jsonProblem = "JSON response has no \"files\" field";
            } catch (JsonProcessingException e) {
                jsonProblem = "Response looked like JSON but could not be parsed";
            }
        }

        Map<String, byte[]> files = new LinkedHashMap<>();
        ParseResult.Failure sectionProblem = readSections(response, files);
        if (sectionProblem != null) {
            return sectionProblem;
        }
        if (!files.isEmpty()) {
            return build(files);
        }
        return ParseResult.failure(jsonProblem != null ? jsonProblem : "Response contains no file listing");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** The JSON object in the reply: fenced if fenced, else first '{' to last '}'. */
    private static String extractJson(String response) {
        Matcher fence = JSON_FENCE.matcher(response);
        if (fence.find() && fence.group(1).strip().startsWith("{")) {
            return fence.group(1).strip();
        }
        int start = response.indexOf('{');
        int end   = response.lastIndexOf('}');
        return (start >= 0 && end > start) ? response.substring(start, end + 1) : null;
    }

    /**
     * Collects every {@code ### FILE:} section into files.
     *
     * @return a failure for a duplicate path or a section whose fence is not
     *         closed, null otherwise
     */
    private static ParseResult.Failure readSections(String response, Map<String, byte[]> files) {
        Matcher heading = FILE_HEADING.matcher(response);
        if (!heading.find()) {
            return null;
        }
        while (true) {
            String path  = heading.group(1).strip();
            int    start = heading.end();
            boolean more = heading.find();
            String section = response.substring(start, more ? heading.start() : response.length());

            Matcher open = OPENING_FENCE.matcher(section);
            if (open.find()) {
                int close = section.lastIndexOf("\n```");
                if (close < open.end() - 1) {
                    return new ParseResult.Failure("Unclosed code fence for " + path);
                }
                String content = close < open.end() ? "" : section.substring(open.end(), close);
                if (files.put(path, content.getBytes(StandardCharsets.UTF_8)) != null) {
                    return new ParseResult.Failure("Duplicate path in listing: " + path);
                }
            }
            if (!more) {
                return null;
            }
        }
    }

    private static ParseResult fromJson(JsonNode root) {
        JsonNode filesNode = root.get("files");
        if (filesNode.isNull()) {
            return ParseResult.failure("JSON response has no \"files\" field");
        }

        Map<String, byte[]> files = new LinkedHashMap<>();
        if (filesNode.isArray()) {
            for (JsonNode entry : filesNode) {
                JsonNode path    = entry.get("path");
                JsonNode content = entry.get("content");
                if (path == null || !path.isTextual() || content == null || !content.isTextual()) {
                    return ParseResult.failure("File entry without textual path and content: " + entry);
                }
                byte[] bytes;
                try {
                    bytes = decode(content.asText(), entry.path("encoding").asText("utf-8"));
                } catch (IllegalArgumentException e) {
                    return ParseResult.failure("Bad content encoding for " + path.asText() + ": " + e.getMessage());
                }
                if (files.put(path.asText(), bytes) != null) {
                    return ParseResult.failure("Duplicate path in listing: " + path.asText());
                }
            }
        } else if (filesNode.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = filesNode.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                if (!e.getValue().isTextual()) {
                    return ParseResult.failure("Non-text content for " + e.getKey());
                }
                files.put(e.getKey(), e.getValue().asText().getBytes(StandardCharsets.UTF_8));
            }
        } else {
            return ParseResult.failure("\"files\" must be an array or an object");
        }
        return build(files);
    }

    private static byte[] decode(String content, String encoding) {
        if ("base64".equalsIgnoreCase(encoding)) {
            return Base64.getMimeDecoder().decode(content);
        }
        return content.getBytes(StandardCharsets.UTF_8);
    }

    private static ParseResult build(Map<String, byte[]> files) {
        if (files.isEmpty()) {
            return ParseResult.failure("File listing is empty");
        }
        try {
            return ParseResult.parsed(GeneratedFileSet.of(files));
        } catch (IllegalArgumentException e) {
            return ParseResult.failure(e.getMessage());
        }
    }
}
