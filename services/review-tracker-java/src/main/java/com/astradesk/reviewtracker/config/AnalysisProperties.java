package com.astradesk.reviewtracker.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

import com.astradesk.reviewtracker.domain.WorkflowModel;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;

/**
 * Workflow vocabulary and batch tuning. The workflow is deployment specific, so
 * it lives here rather than in code.
 */
@Validated
@ConfigurationProperties(prefix = "analysis")
public class AnalysisProperties {

    @Valid
    @NestedConfigurationProperty
    private final WorkflowProperties workflow = new WorkflowProperties();

    @Valid
    @NestedConfigurationProperty
    private final BatchProperties batch = new BatchProperties();

    public WorkflowProperties getWorkflow() {
        return workflow;
    }

    public BatchProperties getBatch() {
        return batch;
    }

    public static class WorkflowProperties {

        /**
         * Stage names in forward order, earliest first.
         */
        @NotEmpty
        private List<String> forwardStages = new ArrayList<>(WorkflowModel.DEFAULT_FORWARD_STAGES);

        private List<String> blockedStages = new ArrayList<>(WorkflowModel.DEFAULT_BLOCKED_STAGES);

        public List<String> getForwardStages() {
            return forwardStages;
        }

        public void setForwardStages(List<String> forwardStages) {
            this.forwardStages = forwardStages;
        }

        public List<String> getBlockedStages() {
            return blockedStages;
        }

        public void setBlockedStages(List<String> blockedStages) {
            this.blockedStages = blockedStages;
        }
    }

    public static class BatchProperties {

        /**
         * Tickets reviewed in parallel. Bounded by what Jira tolerates, not by the analysis.
         */
        @Min(1)
        @Max(64)
        private int concurrency = 4;

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }
    }
}
