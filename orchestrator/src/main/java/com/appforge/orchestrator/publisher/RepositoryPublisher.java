package com.appforge.orchestrator.publisher;

import com.appforge.orchestrator.config.AppForgeProperties;
import com.appforge.orchestrator.github.GitHubApiException;
import com.appforge.orchestrator.github.GitHubClient;
import com.appforge.orchestrator.github.dto.GitCommit;
import com.appforge.orchestrator.github.dto.RepositoryInfo;
import com.appforge.orchestrator.github.dto.TreeEntry;
import com.appforge.orchestrator.model.Deployment;
import com.appforge.orchestrator.model.GeneratedFileSet;
import com.appforge.orchestrator.model.PagesStatus;
import com.appforge.orchestrator.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Publishes a generated file set to GitHub and switches on Pages.
 *
 * Three steps, each of which may fail on its own:
 * <ol>
 *   <li>ensure the task's repository exists (found by name, created if absent);</li>
 *   <li>commit the whole file set in one ref update via the Git Data API;</li>
 *   <li>enable Pages, without waiting for the site to go live.</li>
 * </ol>
 *
 * Calling publish again for the same task and files converges on the same
 * repository and the same tree: blobs and trees are content-addressed, and a
 * head whose tree already matches is reused instead of committed over.
 */
@Component
public class RepositoryPublisher {

    private static final Logger log = LoggerFactory.getLogger(RepositoryPublisher.class);

    private final GitHubClient              github;
    private final AppForgeProperties.GitHub config;

    public RepositoryPublisher(GitHubClient github, AppForgeProperties properties) {
        this.github = github;
        this.config = properties.github();
    }

    /**
     * @throws PublishException NAMING_CONFLICT, RATE_LIMITED, UPSTREAM_ERROR or PARTIAL_COMMIT
     */
    public Deployment publish(Task task, GeneratedFileSet files) {
        String name = RepositoryNames.forTask(config.repoPrefix(), task);
        try {
            RepositoryInfo repo = ensureRepository(name, task);
            String commitSha = commit(name, task, files);
            PagesStatus pages = enablePages(name);
            log.info("Published {} files to {} at {} (pages {})",
                    files.size(), repo.html_url(), shortSha(commitSha), pages);
            return new Deployment(name, repo.html_url(), pagesUrl(repo, name), commitSha, pages);
        } catch (GitHubApiException e) {
            throw PublishException.from(e);
        }
    }

    // ------------------------------------------------------------------
    // Step (a): repository
    // ------------------------------------------------------------------

    private RepositoryInfo ensureRepository(String name, Task task) {
        Optional<RepositoryInfo> existing = github.findRepository(name);
        if (existing.isPresent()) {
            log.info("Repository {} already exists, reusing it", name);
            return verifyOwnership(existing.get(), task);
        }
        try {
            return github.createRepository(name, RepositoryNames.description(task));
        } catch (GitHubApiException e) {
            if (!e.isNameAlreadyExists()) {
                throw e;
            }
            // Lost a creation race with a concurrent submission of the same task.
            log.info("Repository {} was created concurrently, converging on it", name);
            return github.findRepository(name)
                    .map(repo -> verifyOwnership(repo, task))
                    .orElseThrow(() -> new PublishException(PublishException.Kind.UPSTREAM_ERROR,
                            "Repository " + name + " reported as existing but could not be read"));
        }
    }

    /** Project sites are served from the owning account's github.io host. */
    private String pagesUrl(RepositoryInfo repo, String name) {
        String owner = repo.owner() != null && repo.owner().login() != null
                ? repo.owner().login() : github.owner();
        return "https://" + owner.toLowerCase(Locale.ROOT) + ".github.io/" + name + "/";
    }

    private static RepositoryInfo verifyOwnership(RepositoryInfo repo, Task task) {
        String description = repo.description();
        if (description == null || !description.contains(RepositoryNames.ownershipMarker(task))) {
            throw new PublishException(PublishException.Kind.NAMING_CONFLICT,
                    "Repository " + repo.name() + " exists but does not belong to this task");
        }
        return repo;
    }

    // ------------------------------------------------------------------
    // Step (b): single commit
    // ------------------------------------------------------------------

    /**
     * Write the file set as one commit on the configured branch.
     *
     * Blobs and the tree may be left behind by a crash without touching the
     * branch; only the final ref update makes the new tree visible. The tree
     * is built without a base, so it contains exactly the generated files.
     *
     * @return SHA of the commit the branch points at afterwards
     */
    private String commit(String repo, Task task, GeneratedFileSet files) {
        String branch = config.branch();
        Optional<String> head = github.findBranchHead(repo, branch);

        List<TreeEntry> entries = new ArrayList<>();
        for (String path : files.paths()) {
            entries.add(TreeEntry.blob(path, github.createBlob(repo, files.content(path))));
        }
        String treeSha = github.createTree(repo, entries);

        if (head.isPresent()) {
            GitCommit headCommit = github.getCommit(repo, head.get());
            if (treeSha.equals(headCommit.treeSha())) {
                log.info("Branch {} of {} already holds this file set at {}", branch, repo, shortSha(head.get()));
                return head.get();
            }
        }

        String message  = "Deploy " + task.task() + " round " + task.round();
        List<String> parents = head.map(List::of).orElse(List.of());
        String commitSha = github.createCommit(repo, message, treeSha, parents);
        if (head.isPresent()) {
            github.updateBranch(repo, branch, commitSha);
        } else {
            github.createBranch(repo, branch, commitSha);
        }
        return verifyBranch(repo, branch, commitSha, treeSha);
    }

    /** Re-read the branch; a head with the expected tree counts as converged. */
    private String verifyBranch(String repo, String branch, String commitSha, String treeSha) {
        String head = github.findBranchHead(repo, branch)
                .orElseThrow(() -> new PublishException(PublishException.Kind.PARTIAL_COMMIT,
                        "Branch " + branch + " of " + repo + " vanished after the commit"));
        if (head.equals(commitSha)) {
            return head;
        }
        if (treeSha.equals(github.getCommit(repo, head).treeSha())) {
            log.info("Branch {} of {} moved to {} concurrently with the same tree", branch, repo, shortSha(head));
            return head;
        }
        throw new PublishException(PublishException.Kind.PARTIAL_COMMIT,
                "Branch " + branch + " of " + repo + " points at " + head + " instead of " + commitSha);
    }

    // ------------------------------------------------------------------
    // Step (c): Pages
    // ------------------------------------------------------------------

    /**
     * Enable Pages on the branch root. A failure here does not invalidate the
     * deployment; it is reported as UNKNOWN.
     */
    private PagesStatus enablePages(String repo) {
        try {
            if (github.enablePages(repo, config.branch(), "/")) {
                return PagesStatus.PENDING;
            }
            return github.findPages(repo)
                    .map(p -> "built".equals(p.status()) ? PagesStatus.LIVE : PagesStatus.PENDING)
                    .orElse(PagesStatus.UNKNOWN);
        } catch (GitHubApiException e) {
            log.warn("Could not enable Pages for {}: {}", repo, e.getMessage());
            return PagesStatus.UNKNOWN;
        }
    }

    private static String shortSha(String sha) {
        return sha == null || sha.length() < 7 ? sha : sha.substring(0, 7);
    }
}
