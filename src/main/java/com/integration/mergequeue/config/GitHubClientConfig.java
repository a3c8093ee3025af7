package com.integration.mergequeue.config;

import com.integration.mergequeue.forge.ForgeClient;
import com.integration.mergequeue.forge.GitHubForgeClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Builds the GitHub REST client used for every platform call of the merge queue.
 * Connection details are read from application.yml.
 */
@Configuration
@Slf4j
public class GitHubClientConfig {

    @Value("${github.api.base-url:https://api.github.com}")
    private String githubApiBaseUrl;

    @Value("${github.token}")
    private String accessToken;

    @Bean
    public ForgeClient forgeClient(WebClient.Builder webClientBuilder, MergeQueueProperties properties) {
        MergeQueueProperties.Repository repository = properties.getRepository();
        log.info("[GitHub Config] Connecting to repository {} at {}", repository.getFullName(), githubApiBaseUrl);

        WebClient webClient = webClientBuilder
                .baseUrl(githubApiBaseUrl)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken)
                .defaultHeader(HttpHeaders.ACCEPT, "application/vnd.github+json")
                .defaultHeader("X-GitHub-Api-Version", "2022-11-28")
                .build();

        return new GitHubForgeClient(webClient, repository.getOwner(), repository.getName());
    }
}
