package com.appforge.orchestrator.generator;

import com.appforge.orchestrator.model.Attachment;
import com.appforge.orchestrator.model.Task;

import java.util.Optional;

/**
 * Prompts for the single completion call the generator makes.
 *
 * The system prompt fixes the output contract (a JSON file listing); the
 * user prompt carries the task itself.
 */
public final class GenerationPrompts {

    /** Longest attachment excerpt embedded in the prompt, in characters. */
    static final int EXCERPT_LIMIT = 4000;

    private GenerationPrompts() {}

    public static final String SYSTEM_PROMPT = """
            You are a senior front-end engineer. You build complete, self-contained static
            web applications that are served as-is by GitHub Pages: no build step, no server,
            plain HTML, CSS and JavaScript, with libraries loaded from public CDNs only.

            OUTPUT FORMAT: reply with ONE JSON object and nothing else:
              {
                "files": [
                  {"path": "index.html", "content": "<!DOCTYPE html>..."},
                  {"path": "README.md",  "content": "# ..."},
                  {"path": "LICENSE",    "content": "MIT License ..."}
                ]
              }

            RULES:
              - index.html must exist at the repository root.
              - Include a README.md (summary, setup, usage, code explanation) and an MIT LICENSE.
              - Paths are relative, use forward slashes, and never contain "..".
              - Binary files are not allowed unless given as {"path", "content", "encoding": "base64"}.
              - Every acceptance check listed in the task must be satisfiable by the page.
              - Attachments named in the task are committed next to your files under the same
                name; reference them by relative path.
            """;

    public static String userPrompt(Task task, Optional<String> previousFailure) {
        StringBuilder sb = new StringBuilder();
        sb.append("TASK: ").append(task.task()).append(" (round ").append(task.round()).append(")\n\n");
        sb.append("BRIEF:\n").append(task.brief().strip()).append("\n\n");

        if (!task.checks().isEmpty()) {
            sb.append("ACCEPTANCE CHECKS:\n");
            for (int i = 0; i < task.checks().size(); i++) {
                sb.append("  ").append(i + 1).append(". ").append(task.checks().get(i)).append('\n');
            }
            sb.append('\n');
        }

        if (!task.attachments().isEmpty()) {
            sb.append("ATTACHMENTS:\n");
            for (Attachment a : task.attachments()) {
                sb.append("  - ").append(a.name());
                Optional<AttachmentDecoder.Decoded> decoded = AttachmentDecoder.decode(a);
                if (decoded.isEmpty()) {
                    sb.append(" (linked: ").append(a.url()).append(")\n");
                } else if (decoded.get().isText()) {
                    String text = decoded.get().text();
                    boolean cut = text.length() > EXCERPT_LIMIT;
                    sb.append(" (").append(decoded.get().mediaType()).append(", excerpt")
                      .append(cut ? ", truncated" : "").append("):\n");
                    sb.append("```\n").append(cut ? text.substring(0, EXCERPT_LIMIT) : text).append("\n```\n");
                } else {
                    sb.append(" (").append(decoded.get().mediaType()).append(", ")
                      .append(decoded.get().bytes().length).append(" bytes, committed as ")
                      .append(a.name()).append(")\n");
                }
            }
            sb.append('\n');
        }

        previousFailure.ifPresent(reason -> sb
                .append("PREVIOUS ATTEMPT FAILED:\n").append(reason).append('\n')
                .append("Fix this in your reply. Return the complete file listing again.\n\n"));

        sb.append("Return the JSON file listing now.");
        return sb.toString();
    }
}
