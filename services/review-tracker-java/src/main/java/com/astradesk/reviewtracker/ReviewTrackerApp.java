package com.astradesk.reviewtracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

import com.astradesk.reviewtracker.config.AnalysisProperties;
import com.astradesk.reviewtracker.integration.props.IntegrationProperties;

/**
 * Spring Boot entry point for the AstraDesk Review Tracker service.
 *
 * <p>The application pulls ticket change history from Jira and reports review
 * bounce-backs, blocked periods and time spent in each status.</p>
 */
@SpringBootApplication
@EnableConfigurationProperties({IntegrationProperties.class, AnalysisProperties.class})
public class ReviewTrackerApp {

    public static void main(String[] args) {
        SpringApplication.run(ReviewTrackerApp.class, args);
    }
}
