package com.agronet.marketplace.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Marketplace metrics published through Micrometer (CloudWatch in production).
 *
 * Key Metrics:
 * - Lifecycle transitions per entity and target status
 * - Quantity ledger rejections
 * - Expiry sweep outcomes and duration
 * - Notification dispatch failures
 *
 * @author Agronet Marketplace Team
 */
@Service
public class MarketplaceMetricsService {

    private static final Logger logger = LoggerFactory.getLogger(MarketplaceMetricsService.class);

    private static final String METRIC_PREFIX = "marketplace.";
    private static final String TRANSITION_PREFIX = METRIC_PREFIX + "transition.";
    private static final String LEDGER_PREFIX = METRIC_PREFIX + "ledger.";
    private static final String SWEEP_PREFIX = METRIC_PREFIX + "expiry_sweep.";
    private static final String NOTIFICATION_PREFIX = METRIC_PREFIX + "notification.";

    private final MeterRegistry meterRegistry;

    public MarketplaceMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * Record a successful status transition.
     *
     * @param entity "announcement" or "application"
     * @param target Status moved to
     */
    public void recordTransition(String entity, String target) {
        Counter.builder(TRANSITION_PREFIX + "count")
                .tag("entity", entity)
                .tag("target", target)
                .description("Lifecycle status transitions")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded {} transition to {}", entity, target);
    }

    /**
     * Record a request rejected because it asked for more than is available.
     *
     * @param operation "apply", "edit" or "approve"
     */
    public void recordLedgerRejection(String operation) {
        Counter.builder(LEDGER_PREFIX + "rejected")
                .tag("operation", operation)
                .description("Requests rejected by the quantity ledger")
                .register(meterRegistry)
                .increment();
    }

    public void recordSweep(int closed, int failed, long durationMs) {
        Counter.builder(SWEEP_PREFIX + "closed")
                .description("Announcements closed by the expiry sweep")
                .register(meterRegistry)
                .increment(closed);
        Counter.builder(SWEEP_PREFIX + "failed")
                .description("Announcements the expiry sweep failed to close")
                .register(meterRegistry)
                .increment(failed);
        Timer.builder(SWEEP_PREFIX + "duration")
                .description("Expiry sweep duration")
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordNotificationFailure(String eventType) {
        Counter.builder(NOTIFICATION_PREFIX + "failed")
                .tag("event_type", eventType)
                .description("Notification dispatches that failed")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record an error that is not tied to a specific business rule.
     *
     * @param errorType Error category
     * @param operation Operation that failed
     */
    public void recordError(String errorType, String operation) {
        Counter.builder(METRIC_PREFIX + "errors")
                .tag("error_type", errorType)
                .tag("operation", operation)
                .description("Application errors")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded error: {} in operation: {}", errorType, operation);
    }
}
