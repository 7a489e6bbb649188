package com.appforge.orchestrator.github;

import com.appforge.orchestrator.config.AppForgeProperties;
import com.appforge.orchestrator.github.dto.*;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * HTTP client for the slice of the GitHub REST API the publisher needs:
 * repositories, the Git Data API (blobs, trees, commits, refs) and Pages.
 *
 * Uses java.net.http.HttpClient so every header and byte on the wire is
 * explicit. Each call has its own timeout. No retries here.
 */
@Component
public class GitHubClient {

    private static final Logger log = LoggerFactory.getLogger(GitHubClient.class);

    private static final String ACCEPT      = "application/vnd.github+json";
    private static final String API_VERSION = "2022-11-28";

    private final HttpClient                http;
    private final ObjectMapper              json;
    private final AppForgeProperties.GitHub config;

    private volatile String accountLogin;

    public GitHubClient(HttpClient httpClient, ObjectMapper objectMapper, AppForgeProperties properties) {
        this.http   = httpClient;
        this.json   = objectMapper;
        this.config = properties.github();
    }

    // ------------------------------------------------------------------
    // Account
    // ------------------------------------------------------------------

    /** Login of the account the token authenticates as. Looked up once, then cached. */
    public String accountLogin() {
        String login = accountLogin;
        if (login == null) {
            String op = "getAuthenticatedUser";
            login = read(ensureOk(send(get("/user"), op), op), UserInfo.class).login();
            accountLogin = login;
        }
        return login;
    }

    /** Account that owns generated repositories: the configured owner, else the token's own login. */
    public String owner() {
        String configured = config.owner();
        return configured == null || configured.isBlank() ? accountLogin() : configured;
    }

    // ------------------------------------------------------------------
    // Repositories
    // ------------------------------------------------------------------

    /** @return the repository, or empty when GitHub answers 404 */
    public Optional<RepositoryInfo> findRepository(String name) {
        HttpResponse<String> resp = send(get(repoPath(name)), "findRepository " + name);
        if (resp.statusCode() == 404) {
            return Optional.empty();
        }
        return Optional.of(read(ensureOk(resp, "findRepository " + name), RepositoryInfo.class));
    }

    /**
     * Create a public repository under {@link #owner()}: the token's own
     * account, or an organisation when the configured owner is not the
     * token's login. auto_init makes GitHub write an initial commit so the Git Data API
     * has a branch to work on.
     */
    public RepositoryInfo createRepository(String name, String description) {
        log.info("Creating repository '{}'", name);
        String body = toJson(Map.of(
                "name",        name,
                "description", description,
                "private",     false,
                "auto_init",   true));
        String owner = owner();
        String path  = owner.equalsIgnoreCase(accountLogin()) ? "/user/repos" : "/orgs/" + encode(owner) + "/repos";
        HttpResponse<String> resp = send(post(path, body), "createRepository " + name);
        return read(ensureOk(resp, "createRepository " + name), RepositoryInfo.class);
    }

    // ------------------------------------------------------------------
    // Git Data API
    // ------------------------------------------------------------------

    /** @return the commit SHA the branch points at, or empty when the branch does not exist */
    public Optional<String> findBranchHead(String repo, String branch) {
        String op = "findBranchHead " + repo + "@" + branch;
        HttpResponse<String> resp = send(get(repoPath(repo) + "/git/ref/heads/" + encode(branch)), op);
        // 409: "Git Repository is empty"
        if (resp.statusCode() == 404 || resp.statusCode() == 409) {
            return Optional.empty();
        }
        GitRef ref = read(ensureOk(resp, op), GitRef.class);
        return Optional.ofNullable(ref.object()).map(GitRef.Target::sha);
    }

    public GitCommit getCommit(String repo, String sha) {
        String op = "getCommit " + repo + "@" + sha;
        return read(ensureOk(send(get(repoPath(repo) + "/git/commits/" + sha), op), op), GitCommit.class);
    }

    /** Upload raw bytes as a blob. Blobs are content-addressed, so repeats are harmless. */
    public String createBlob(String repo, byte[] content) {
        String body = toJson(Map.of(
                "content",  Base64.getEncoder().encodeToString(content),
                "encoding", "base64"));
        String op = "createBlob " + repo;
        return read(ensureOk(send(post(repoPath(repo) + "/git/blobs", body), op), op),
                ShaResponse.class).sha();
    }

    /** Create a tree holding exactly the given entries (no base tree). */
    public String createTree(String repo, List<TreeEntry> entries) {
        String body = toJson(Map.of("tree", entries));
        String op = "createTree " + repo;
        return read(ensureOk(send(post(repoPath(repo) + "/git/trees", body), op), op), ShaResponse.class).sha();
    }

    public String createCommit(String repo, String message, String treeSha, List<String> parents) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("message", message);
        payload.put("tree",    treeSha);
        payload.put("parents", parents);
        String op = "createCommit " + repo;
        return read(ensureOk(send(post(repoPath(repo) + "/git/commits", toJson(payload)), op), op),
                ShaResponse.class).sha();
    }

    public void createBranch(String repo, String branch, String sha) {
        String body = toJson(Map.of("ref", "refs/heads/" + branch, "sha", sha));
        String op = "createBranch " + repo + "@" + branch;
        ensureOk(send(post(repoPath(repo) + "/git/refs", body), op), op);
    }

    /** Move the branch to sha. Not forced: GitHub rejects it unless it is a fast-forward. */
    public void updateBranch(String repo, String branch, String sha) {
        String body = toJson(Map.of("sha", sha, "force", false));
        String op = "updateBranch " + repo + "@" + branch;
        HttpRequest req = request(repoPath(repo) + "/git/refs/heads/" + encode(branch))
                .method("PATCH", HttpRequest.BodyPublishers.ofString(body))
                .build();
        ensureOk(send(req, op), op);
    }

    // ------------------------------------------------------------------
    // Pages
    // ------------------------------------------------------------------

    /**
     * Turn on GitHub Pages for branch + path.
     *
     * @return true when Pages was enabled by this call, false when it was
     *         already enabled (HTTP 409)
     */
    public boolean enablePages(String repo, String branch, String path) {
        String body = toJson(Map.of("source", Map.of("branch", branch, "path", path)));
        String op = "enablePages " + repo;
        HttpResponse<String> resp = send(post(repoPath(repo) + "/pages", body), op);
        if (resp.statusCode() == 409) {
            return false;
        }
        ensureOk(resp, op);
        return true;
    }

    /** @return the Pages site info, or empty when Pages is not configured (404) */
    public Optional<PagesInfo> findPages(String repo) {
        String op = "findPages " + repo;
        HttpResponse<String> resp = send(get(repoPath(repo) + "/pages"), op);
        if (resp.statusCode() == 404) {
            return Optional.empty();
        }
        return Optional.of(read(ensureOk(resp, op), PagesInfo.class));
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private String repoPath(String repo) {
        return "/repos/" + encode(owner()) + "/" + encode(repo);
    }

    private HttpRequest.Builder request(String path) {
        return HttpRequest.newBuilder()
                .uri(URI.create(config.apiUrl() + path))
                .timeout(config.requestTimeout())
                .header("Accept",               ACCEPT)
                .header("X-GitHub-Api-Version", API_VERSION)
                .header("Authorization",        "Bearer " + (config.token() == null ? "" : config.token()))
                .header("Content-Type",         "application/json");
    }

    private HttpRequest get(String path) {
        return request(path).GET().build();
    }

    private HttpRequest post(String path, String body) {
        return request(path).POST(HttpRequest.BodyPublishers.ofString(body)).build();
    }

    private HttpResponse<String> send(HttpRequest req, String op) {
        try {
            return http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GitHubApiException(op, e);
        } catch (IOException e) {
            throw new GitHubApiException(op, e);
        }
    }

    /** Returns the body of a 2xx response; anything else becomes a GitHubApiException. */
    private String ensureOk(HttpResponse<String> resp, String op) {
        int status = resp.statusCode();
        if (status >= 200 && status < 300) {
            return resp.body();
        }
        boolean rateLimited = status == 429
                || (status == 403 && (resp.headers().firstValue("x-ratelimit-remaining").orElse("").equals("0")
                                      || String.valueOf(resp.body()).contains("rate limit")));
        throw new GitHubApiException(op, status, resp.body(), rateLimited, retryAfter(resp));
    }

    /** Retry-After (seconds) wins; otherwise x-ratelimit-reset (epoch seconds); otherwise null. */
    static Duration retryAfter(HttpResponse<?> resp) {
        Optional<String> retryAfter = resp.headers().firstValue("retry-after").map(String::strip);
        if (retryAfter.isPresent() && retryAfter.get().matches("\\d{1,9}")) {
            return Duration.ofSeconds(Long.parseLong(retryAfter.get()));
        }
        Optional<String> reset = resp.headers().firstValue("x-ratelimit-reset").map(String::strip);
        if (reset.isPresent() && reset.get().matches("\\d{1,12}")) {
            Duration d = Duration.between(Instant.now(), Instant.ofEpochSecond(Long.parseLong(reset.get())));
            return d.isNegative() ? Duration.ZERO : d;
        }
        return null;
    }

    private <T> T read(String body, Class<T> type) {
        try {
            return json.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new GitHubApiException("Parsing " + type.getSimpleName(), e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new GitHubApiException("JSON serialization", e);
        }
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
