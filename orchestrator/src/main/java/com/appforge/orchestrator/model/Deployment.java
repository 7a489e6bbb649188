package com.appforge.orchestrator.model;

/**
 * Where the generated code now lives and where it is (or will be) served.
 *
 * Only built once the repository exists and the commit is verified on the
 * branch; a Pages activation problem shows up as pagesStatus, not as a
 * missing deployment.
 */
public record Deployment(
        String      repositoryName,
        String      repositoryUrl,
        String      pagesUrl,
        String      commitSha,
        PagesStatus pagesStatus
) {}
