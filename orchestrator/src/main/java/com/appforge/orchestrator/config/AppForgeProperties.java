package com.appforge.orchestrator.config;

import com.appforge.orchestrator.retry.RetryPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.Name;

import java.time.Duration;
import java.util.List;

/**
 * Immutable service configuration, bound once at startup from the
 * {@code appforge.*} keys in application.yml (which in turn read the
 * environment) and handed to each component through its constructor.
 */
@ConfigurationProperties(prefix = "appforge")
public record AppForgeProperties(
        Service service,
        Llm     llm,
        GitHub  github,
        Auth    auth,
        Cors    cors,
        Workers workers,
        @Name("notify") Notify notification,
        Retry   retry) {

    public AppForgeProperties {
        service = service == null ? new Service(null, null)                       : service;
        llm     = llm     == null ? new Llm(null, null, null, 0, null)             : llm;
        github  = github  == null ? new GitHub(null, null, null, null, null, null) : github;
        auth    = auth    == null ? new Auth(null)                                 : auth;
        cors    = cors    == null ? new Cors(null)                                 : cors;
        workers = workers == null ? new Workers(0, 0, null)                        : workers;
        notification = notification == null ? new Notify(null)                     : notification;
        retry   = retry   == null ? new Retry(null, null, null)                    : retry;
    }

    public record Service(String name, String version) {
        public Service {
            name    = name    == null ? "appforge-orchestrator" : name;
            version = version == null ? "0.1.0"                 : version;
        }
    }

    /**
     * @param apiKey         Anthropic API key
     * @param baseUrl        API root, overridable for proxies
     * @param model          model id sent with every request
     * @param maxTokens      completion budget; generated apps are a few files
     * @param requestTimeout wall-clock limit per completion call
     */
    public record Llm(String apiKey, String baseUrl, String model, int maxTokens, Duration requestTimeout) {
        public Llm {
            baseUrl        = baseUrl == null        ? "https://api.anthropic.com" : baseUrl;
            model          = model == null          ? "claude-sonnet-4-6"         : model;
            maxTokens      = maxTokens <= 0         ? 16000                       : maxTokens;
            requestTimeout = requestTimeout == null ? Duration.ofSeconds(180)     : requestTimeout;
        }
    }

    /**
     * @param token          personal access token with repo and pages scope
     * @param owner          account that owns generated repositories; blank means the token's own account
     * @param apiUrl         REST API root
     * @param repoPrefix     prefix for every generated repository name
     * @param branch         branch that is committed to and served by Pages
     * @param requestTimeout wall-clock limit per REST call
     */
    public record GitHub(String token, String owner, String apiUrl, String repoPrefix,
                         String branch, Duration requestTimeout) {
        public GitHub {
            apiUrl         = apiUrl == null         ? "https://api.github.com" : apiUrl;
            repoPrefix     = repoPrefix == null     ? "llm-app"                : repoPrefix;
            branch         = branch == null         ? "main"                   : branch;
            requestTimeout = requestTimeout == null ? Duration.ofSeconds(30)   : requestTimeout;
        }
    }

    /** Shared secrets a submission may present. Empty means every submission is rejected. */
    public record Auth(List<String> acceptedSecrets) {
        public Auth {
            acceptedSecrets = acceptedSecrets == null ? List.of()
                    : acceptedSecrets.stream().map(String::strip).filter(s -> !s.isEmpty()).toList();
        }
    }

    public record Cors(List<String> allowedOrigins) {
        public Cors {
            allowedOrigins = allowedOrigins == null || allowedOrigins.isEmpty()
                    ? List.of("*") : List.copyOf(allowedOrigins);
        }
    }

    /**
     * @param count         concurrent pipelines; caps load on both upstream APIs
     * @param queueCapacity accepted-but-waiting submissions before 503
     * @param stallTimeout  heartbeat age after which a non-terminal task is re-dispatched
     */
    public record Workers(int count, int queueCapacity, Duration stallTimeout) {
        public Workers {
            count         = count <= 0         ? 4                     : count;
            queueCapacity = queueCapacity <= 0 ? 100                   : queueCapacity;
            stallTimeout  = stallTimeout == null ? Duration.ofMinutes(20) : stallTimeout;
        }
    }

    public record Notify(Duration requestTimeout) {
        public Notify {
            requestTimeout = requestTimeout == null ? Duration.ofSeconds(30) : requestTimeout;
        }
    }

    public record Retry(RetryPolicy generation, RetryPolicy publish,
                        @Name("notify") RetryPolicy notification) {
        public Retry {
            generation = generation == null ? RetryPolicy.exponential(3, Duration.ofSeconds(2)) : generation;
            publish    = publish == null    ? RetryPolicy.exponential(3, Duration.ofSeconds(2)) : publish;
            notification = notification == null ? RetryPolicy.exponential(6, Duration.ofSeconds(1)) : notification;
        }
    }
}
