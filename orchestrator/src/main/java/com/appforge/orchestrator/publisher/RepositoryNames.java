package com.appforge.orchestrator.publisher;

import com.appforge.orchestrator.model.Task;

import java.util.Locale;

/**
 * Deterministic repository naming.
 *
 * The same (email, nonce, round) always yields the same name, so a retried or
 * duplicated submission lands in the repository the first one created.
 */
public final class RepositoryNames {

    /** GitHub's limit on repository names. */
    static final int MAX_LENGTH = 100;

    private static final int KEY_CHARS = 10;

    private RepositoryNames() {}

    /** {@code <prefix>-<task-slug>-r<round>-<10 hex chars of the task key>}. */
    public static String forTask(String prefix, Task task) {
        String suffix = "-r" + task.round() + "-" + task.key().substring(0, KEY_CHARS);
        String head   = slug(prefix);
        String slug   = slug(task.task());
        int room = MAX_LENGTH - head.length() - suffix.length() - 1;
        if (slug.length() > room) {
            slug = trimDashes(slug.substring(0, Math.max(room, 0)));
        }
        return slug.isEmpty() ? head + suffix : head + "-" + slug + suffix;
    }

    /** Marker stored in the repository description to prove which task owns it. */
    public static String ownershipMarker(Task task) {
        return "[task-key:" + task.key() + "]";
    }

    public static String description(Task task) {
        return "LLM generated app for task " + task.task() + " round " + task.round()
                + " " + ownershipMarker(task);
    }

    static String slug(String text) {
        if (text == null) return "";
        String s = text.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-");
        return trimDashes(s);
    }

    private static String trimDashes(String s) {
        return s.replaceAll("^-+", "").replaceAll("-+$", "");
    }
}
