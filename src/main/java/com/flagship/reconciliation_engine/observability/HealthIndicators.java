package com.flagship.reconciliation_engine.observability;

import com.flagship.reconciliation_engine.event.WorkflowEventRepository;
import com.flagship.reconciliation_engine.ledger.LedgerGateway;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Custom health indicators for the engine.
 */
public class HealthIndicators {

    /**
     * Unhealthy if too many workflow events are waiting to be published.
     */
    @Component("workflowEventsHealth")
    public static class WorkflowEventBacklogHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final WorkflowEventRepository eventRepository;

        public WorkflowEventBacklogHealthIndicator(WorkflowEventRepository eventRepository) {
            this.eventRepository = eventRepository;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = eventRepository.countUnpublished();

                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                        ? Health.up()
                        : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                        ? Health.status("WARNING")
                        : Health.down();

                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }

    /**
     * Down when the ledger cannot answer a lookup of the withholding-tax payable account.
     */
    @Component("ledgerHealth")
    public static class LedgerHealthIndicator implements HealthIndicator {

        private final LedgerGateway ledgerGateway;
        private final String probeAccount;

        public LedgerHealthIndicator(LedgerGateway ledgerGateway,
                                     @Value("${engine.ledger.wht-payable-account:2310}") String probeAccount) {
            this.ledgerGateway = ledgerGateway;
            this.probeAccount = probeAccount;
        }

        @Override
        public Health health() {
            try {
                boolean found = ledgerGateway.findAccount(probeAccount).isPresent();
                return Health.up()
                        .withDetail("probeAccount", probeAccount)
                        .withDetail("accountFound", found)
                        .build();
            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }
}
