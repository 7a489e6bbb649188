package com.appforge.orchestrator.github.dto;

/**
 * One entry of POST /repos/{owner}/{repo}/git/trees.
 * Must match the field names the Git Data API expects.
 */
public record TreeEntry(String path, String mode, String type, String sha) {

    public static TreeEntry blob(String path, String sha) {
        return new TreeEntry(path, "100644", "blob", sha);
    }
}
