package com.appforge.orchestrator.model;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Files produced by the generator, keyed by repository-relative path.
 *
 * Every path is checked on the way in: it must be relative, must not climb
 * out of the repository root and must not touch the .git directory. The set
 * is never empty.
 */
public final class GeneratedFileSet {

    private final Map<String, byte[]> files;

    private GeneratedFileSet(Map<String, byte[]> files) {
        this.files = files;
    }

    /**
     * @throws IllegalArgumentException if the map is empty or any path is unsafe
     */
    public static GeneratedFileSet of(Map<String, byte[]> files) {
        if (files == null || files.isEmpty()) {
            throw new IllegalArgumentException("A generated file set needs at least one file");
        }
        Map<String, byte[]> copy = new LinkedHashMap<>();
        for (Map.Entry<String, byte[]> e : files.entrySet()) {
            String path = normalise(e.getKey());
            if (e.getValue() == null) {
                throw new IllegalArgumentException("No content for " + path);
            }
            if (copy.put(path, e.getValue().clone()) != null) {
                throw new IllegalArgumentException("Duplicate path: " + path);
            }
        }
        return new GeneratedFileSet(Collections.unmodifiableMap(copy));
    }

    public static GeneratedFileSet ofText(Map<String, String> files) {
        Map<String, byte[]> bytes = new LinkedHashMap<>();
        if (files != null) {
            files.forEach((p, c) -> bytes.put(p, c == null ? null : c.getBytes(StandardCharsets.UTF_8)));
        }
        return of(bytes);
    }

    /**
     * Validate a repository path and strip a leading "./".
     *
     * @throws IllegalArgumentException for empty, absolute, backslashed,
     *         parent-traversing or .git paths
     */
    public static String normalise(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Empty file path");
        }
        String p = path.strip();
        while (p.startsWith("./")) {
            p = p.substring(2);
        }
        if (p.isEmpty() || p.startsWith("/") || p.contains("\\") || p.contains("\0") || p.endsWith("/")) {
            throw new IllegalArgumentException("Unsafe file path: " + path);
        }
        for (String segment : p.split("/", -1)) {
            if (segment.isEmpty() || segment.equals(".") || segment.equals("..") || segment.equals(".git")) {
                throw new IllegalArgumentException("Unsafe file path: " + path);
            }
        }
        return p;
    }

    /** Returns a copy that also contains path, unless path is already present. */
    public GeneratedFileSet withFileIfAbsent(String path, byte[] content) {
        String normalised = normalise(path);
        if (files.containsKey(normalised)) {
            return this;
        }
        Map<String, byte[]> copy = new LinkedHashMap<>(files);
        copy.put(normalised, content.clone());
        return new GeneratedFileSet(Collections.unmodifiableMap(copy));
    }

    public Set<String> paths()          { return files.keySet(); }
    public int         size()           { return files.size(); }
    public boolean     contains(String path) { return files.containsKey(path); }

    public byte[] content(String path) {
        byte[] c = files.get(path);
        return c == null ? null : c.clone();
    }

    public String text(String path) {
        byte[] c = files.get(path);
        return c == null ? null : new String(c, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "GeneratedFileSet" + files.keySet();
    }
}
