package com.flagship.reconciliation_engine.observability;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically refreshes gauges that need database queries.
 */
@Component
@RequiredArgsConstructor
public class MetricsScheduler {

    private final WorkflowEventMetrics workflowEventMetrics;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshWorkflowEventMetrics() {
        workflowEventMetrics.refreshMetrics();
    }
}
