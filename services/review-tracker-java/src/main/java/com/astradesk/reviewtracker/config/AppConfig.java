package com.astradesk.reviewtracker.config;

import java.time.Clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.astradesk.reviewtracker.analysis.ReferenceExtractor;
import com.astradesk.reviewtracker.analysis.TransitionAnalyzer;
import com.astradesk.reviewtracker.domain.WorkflowModel;
import com.astradesk.reviewtracker.integration.props.IntegrationProperties;

/**
 * Wires the analysis components. None of them depend on Spring, so they are
 * declared here instead of being annotated.
 */
@Configuration
public class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public WorkflowModel workflowModel(AnalysisProperties properties) {
        AnalysisProperties.WorkflowProperties workflow = properties.getWorkflow();
        return new WorkflowModel(workflow.getForwardStages(), workflow.getBlockedStages());
    }

    @Bean
    public ReferenceExtractor referenceExtractor() {
        return new ReferenceExtractor();
    }

    @Bean
    public TransitionAnalyzer transitionAnalyzer(WorkflowModel workflowModel, Clock clock, ReferenceExtractor referenceExtractor) {
        return new TransitionAnalyzer(workflowModel, clock, referenceExtractor);
    }

    /**
     * Logs the effective workflow at startup so operators can tell which stage
     * vocabulary bounce-backs are measured against.
     */
    @Bean
    public ApplicationRunner workflowBanner(WorkflowModel workflowModel, IntegrationProperties integrationProperties) {
        IntegrationProperties.JiraProperties jira = integrationProperties.getJira();
        return args -> log.info("Review tracker started. Workflow: {}; Jira integration {}",
            workflowModel,
            jira.isEnabled() ? "enabled at " + jira.getBaseUrl() : "disabled");
    }
}
