package com.appforge.orchestrator.generator;

import com.appforge.orchestrator.llm.LlmClient;
import com.appforge.orchestrator.llm.LlmClient.LlmApiException;
import com.appforge.orchestrator.model.Attachment;
import com.appforge.orchestrator.model.GeneratedFileSet;
import com.appforge.orchestrator.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Turns a task into a set of files with one language-model call.
 *
 * Stateless: the output depends only on the task, the optional failure
 * reason from a previous attempt, and the model's reply. No retry here;
 * the orchestrator decides whether to call again.
 */
@Component
public class CodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CodeGenerator.class);

    private final LlmClient llm;

    public CodeGenerator(LlmClient llm) {
        this.llm = llm;
    }

    /**
     * @param previousFailure why the last attempt for this task failed, if any;
     *                        included in the prompt to steer regeneration
     * @throws GenerationException on upstream timeout, upstream error or an
     *                             unusable reply
     */
    public GeneratedFileSet generate(Task task, Optional<String> previousFailure) {
        String reply;
        try {
            reply = llm.complete(GenerationPrompts.SYSTEM_PROMPT,
                    GenerationPrompts.userPrompt(task, previousFailure));
        } catch (LlmApiException e) {
            if (e.timedOut()) {
                throw new GenerationException(GenerationException.Kind.UPSTREAM_TIMEOUT,
                        e.getMessage(), e, false);
            }
            boolean throttled = e.statusCode() == 429 || e.statusCode() == 529;
            throw new GenerationException(GenerationException.Kind.UPSTREAM_ERROR,
                    e.getMessage(), e, throttled);
        }

        ParseResult result = FileListingParser.parse(reply);
        if (result instanceof ParseResult.Failure failure) {
            throw new GenerationException(GenerationException.Kind.MALFORMED_RESPONSE, failure.reason());
        }
        GeneratedFileSet files = ((ParseResult.Parsed) result).files();

        for (Attachment a : task.attachments()) {
            Optional<AttachmentDecoder.Decoded> decoded = AttachmentDecoder.decode(a);
            if (decoded.isEmpty()) continue;
            try {
                files = files.withFileIfAbsent(a.name(), decoded.get().bytes());
            } catch (IllegalArgumentException e) {
                log.warn("Skipping attachment with unsafe name '{}': {}", a.name(), e.getMessage());
            }
        }

        log.info("Generated {} files: {}", files.size(), files.paths());
        return files;
    }
}
