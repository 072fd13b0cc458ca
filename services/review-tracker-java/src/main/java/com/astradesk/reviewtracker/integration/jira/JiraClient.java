package com.astradesk.reviewtracker.integration.jira;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.astradesk.reviewtracker.integration.props.IntegrationProperties;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Read-only Jira Cloud REST client covering what a review needs: issue fields,
 * the full status changelog and the logged work.
 */
@Component
public class JiraClient {

    static final String ISSUE_FIELDS = "summary,status,assignee,description,comment,created";

    private static final Logger log = LoggerFactory.getLogger(JiraClient.class);

    private final WebClient webClient;
    private final IntegrationProperties.JiraProperties properties;

    public JiraClient(WebClient.Builder builder, IntegrationProperties properties) {
        this.properties = properties.getJira();
        if (!this.properties.isEnabled()) {
            this.webClient = null;
        } else {
            this.webClient = builder
                .baseUrl(this.properties.getBaseUrl())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.AUTHORIZATION, basicAuthHeader(this.properties.getUsername(), this.properties.getApiToken()))
                .build();
        }
    }

    /**
     * Fetches the issue; completes empty when Jira answers 404.
     */
    public Mono<JiraIssue> getIssue(String issueKey) {
        if (!properties.isEnabled()) {
            return Mono.error(new IssueTrackerUnavailableException(issueKey));
        }
        return webClient.get()
            .uri(uri -> uri.path("/rest/api/3/issue/{key}")
                .queryParam("fields", ISSUE_FIELDS)
                .build(issueKey))
            .exchangeToMono(response -> {
                if (response.statusCode().value() == HttpStatus.NOT_FOUND.value()) {
                    log.debug("Jira issue {} not found", issueKey);
                    return response.releaseBody().then(Mono.<JiraIssue>empty());
                }
                if (response.statusCode().isError()) {
                    return response.createException().flatMap(error -> Mono.<JiraIssue>error(error));
                }
                return response.bodyToMono(JiraIssue.class);
            })
            .timeout(timeout());
    }

    /**
     * Streams every changelog entry of the issue, following Jira's offset
     * pagination until the reported total is reached.
     */
    public Flux<JiraChangelogPage.History> getChangelog(String issueKey) {
        if (!properties.isEnabled()) {
            return Flux.error(new IssueTrackerUnavailableException(issueKey));
        }
        return fetchChangelogPage(issueKey, 0)
            .expand(page -> page.hasMore()
                ? fetchChangelogPage(issueKey, page.nextStartAt())
                : Mono.empty())
            .concatMapIterable(JiraChangelogPage::values);
    }

    /**
     * Fetches logged work. Worklogs are informational, so failures degrade to an
     * empty list instead of failing the review.
     */
    public Mono<List<JiraWorklog>> getWorklogs(String issueKey) {
        if (!properties.isEnabled()) {
            return Mono.error(new IssueTrackerUnavailableException(issueKey));
        }
        return webClient.get()
            .uri("/rest/api/3/issue/{key}/worklog", issueKey)
            .retrieve()
            .bodyToMono(WorklogResponse.class)
            .map(response -> response.worklogs() == null ? List.<JiraWorklog>of() : response.worklogs())
            .timeout(timeout())
            .doOnError(error -> log.warn("Failed to fetch worklogs for {}: {}", issueKey, error.getMessage()))
            .onErrorResume(error -> Mono.just(List.of()));
    }

    private Mono<JiraChangelogPage> fetchChangelogPage(String issueKey, int startAt) {
        return webClient.get()
            .uri(uri -> uri.path("/rest/api/3/issue/{key}/changelog")
                .queryParam("startAt", startAt)
                .queryParam("maxResults", properties.getPageSize())
                .build(issueKey))
            .retrieve()
            .bodyToMono(JiraChangelogPage.class)
            .timeout(timeout())
            .doOnNext(page -> log.debug("Fetched changelog page of {} at {}: {} of {} entries",
                issueKey, startAt, page.values().size(), page.total()));
    }

    private Duration timeout() {
        return properties.getTimeout();
    }

    private String basicAuthHeader(String username, String apiToken) {
        String token = Base64.getEncoder()
            .encodeToString((username + ":" + apiToken).getBytes(StandardCharsets.UTF_8));
        return "Basic " + token;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record WorklogResponse(List<JiraWorklog> worklogs) {
    }
}
