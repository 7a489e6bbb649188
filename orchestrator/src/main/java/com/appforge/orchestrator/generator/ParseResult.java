package com.appforge.orchestrator.generator;

import com.appforge.orchestrator.model.GeneratedFileSet;

/**
 * Result of parsing a model reply: either a usable file set or the reason
 * the reply could not be trusted.
 */
public sealed interface ParseResult permits ParseResult.Parsed, ParseResult.Failure {

    record Parsed(GeneratedFileSet files) implements ParseResult {}

    record Failure(String reason) implements ParseResult {}

    static ParseResult parsed(GeneratedFileSet files) { return new Parsed(files); }

    static ParseResult failure(String reason)         { return new Failure(reason); }
}
