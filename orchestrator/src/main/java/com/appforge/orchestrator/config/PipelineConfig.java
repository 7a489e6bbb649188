package com.appforge.orchestrator.config;

import com.appforge.orchestrator.retry.Retrier;
import com.appforge.orchestrator.retry.Sleeper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Shared infrastructure beans for the pipeline clients.
 */
@Configuration
public class PipelineConfig {

    /**
     * One HttpClient for every outbound call. It is thread-safe and pools
     * connections; per-request timeouts are set by each client.
     */
    @Bean
    HttpClient httpClient() {
        return HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Bean
    Retrier retrier() {
        return new Retrier(Sleeper.THREAD);
    }
}
