package com.astradesk.reviewtracker.service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.astradesk.reviewtracker.analysis.TransitionAnalyzer;
import com.astradesk.reviewtracker.config.AnalysisProperties;
import com.astradesk.reviewtracker.domain.TicketHistory;
import com.astradesk.reviewtracker.domain.TransitionAnalysis;
import com.astradesk.reviewtracker.integration.jira.ChangelogAdapter;
import com.astradesk.reviewtracker.integration.jira.JiraChangelogPage;
import com.astradesk.reviewtracker.integration.jira.JiraClient;
import com.astradesk.reviewtracker.integration.jira.JiraIssue;
import com.astradesk.reviewtracker.integration.jira.JiraWorklog;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Application service orchestrating Jira retrieval and lifecycle analysis.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Fetch issue fields, changelog and worklogs via {@link JiraClient}</li>
 *   <li>Convert raw changelog entries into typed transitions</li>
 *   <li>Run the {@link TransitionAnalyzer} and assemble a {@link TicketReview}</li>
 * </ul>
 * In batch mode a failing ticket is reported on its own and never aborts the
 * remaining tickets.</p>
 */
@Service
public class TicketReviewService {

    static final String UNASSIGNED = "Unassigned";

    private static final Logger log = LoggerFactory.getLogger(TicketReviewService.class);

    private final JiraClient jiraClient;
    private final ChangelogAdapter changelogAdapter;
    private final TransitionAnalyzer analyzer;
    private final int batchConcurrency;

    public TicketReviewService(
        JiraClient jiraClient,
        ChangelogAdapter changelogAdapter,
        TransitionAnalyzer analyzer,
        AnalysisProperties analysisProperties
    ) {
        this.jiraClient = jiraClient;
        this.changelogAdapter = changelogAdapter;
        this.analyzer = analyzer;
        this.batchConcurrency = analysisProperties.getBatch().getConcurrency();
    }

    /**
     * Reviews one ticket. Fails with {@link TicketNotFoundException} for unknown
     * keys and with {@link com.astradesk.reviewtracker.analysis.MalformedTimestampException}
     * when Jira hands back a timestamp that cannot be parsed.
     */
    public Mono<TicketReview> review(String issueKey) {
        Mono<JiraIssue> issue = jiraClient.getIssue(issueKey)
            .switchIfEmpty(Mono.error(new TicketNotFoundException(issueKey)));
        Mono<List<JiraChangelogPage.History>> changelog = jiraClient.getChangelog(issueKey).collectList();
        Mono<List<JiraWorklog>> worklogs = jiraClient.getWorklogs(issueKey);

        return Mono.zip(issue, changelog, worklogs)
            .map(tuple -> {
                JiraIssue jiraIssue = tuple.getT1();
                TicketHistory history = changelogAdapter.toHistory(jiraIssue, tuple.getT2());
                TransitionAnalysis analysis = analyzer.analyze(history);
                return toReview(issueKey, jiraIssue, JiraWorklog.totalHours(tuple.getT3()), analysis);
            })
            .doOnSuccess(review -> log.info("Reviewed {}: {} transitions, {} bounce-backs, {} blocked entries",
                issueKey,
                review.analysis().transitions().size(),
                review.analysis().backwardMoveCount(),
                review.analysis().blockedEntryCount()));
    }

    /**
     * Reviews several tickets concurrently. Keys are trimmed and de-duplicated;
     * outcomes come back in the order the keys were given.
     */
    public Flux<ReviewOutcome> reviewAll(List<String> issueKeys) {
        Set<String> keys = new LinkedHashSet<>();
        for (String key : issueKeys) {
            if (key != null && !key.isBlank()) {
                keys.add(key.trim());
            }
        }
        return Flux.fromIterable(keys)
            .flatMapSequential(key -> review(key)
                .map(ReviewOutcome::success)
                .doOnError(error -> log.warn("Review of {} failed: {}", key, error.getMessage()))
                .onErrorResume(error -> Mono.just(ReviewOutcome.failure(key, describe(error)))),
                batchConcurrency);
    }

    /**
     * Analyses a history supplied directly by the caller, bypassing Jira.
     */
    public TransitionAnalysis analyze(TicketHistory history) {
        return analyzer.analyze(history);
    }

    private TicketReview toReview(String issueKey, JiraIssue issue, double hoursLogged, TransitionAnalysis analysis) {
        JiraIssue.Fields fields = issue.fields();
        String summary = fields == null ? null : fields.summary();
        String status = Optional.ofNullable(fields)
            .map(JiraIssue.Fields::status)
            .map(JiraIssue.Status::name)
            .orElse(null);
        String assignee = Optional.ofNullable(fields)
            .map(JiraIssue.Fields::assignee)
            .map(JiraIssue.User::displayName)
            .orElse(UNASSIGNED);
        String key = issue.key() == null ? issueKey : issue.key();
        return new TicketReview(key, summary, status, assignee, hoursLogged, analysis);
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }
}
