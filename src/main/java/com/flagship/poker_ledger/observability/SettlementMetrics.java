package com.flagship.poker_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Micrometer meters for games, transactions and settlements.
 *
 * <ul>
 *   <li>games.completed (result=success|unbalanced)</li>
 *   <li>transactions.recorded (type=BUYIN|CASHOUT)</li>
 *   <li>settlements.marked (method), settlements.reset, settlements.orphaned</li>
 *   <li>settlement.plan.size, settlement.plan.latency</li>
 *   <li>idempotency.cache (result=hit|miss)</li>
 * </ul>
 */
@Component
public class SettlementMetrics {

    private final MeterRegistry registry;

    private final Counter settlementsReset;
    private final Counter settlementsOrphaned;
    private final DistributionSummary planSize;
    private final Timer planTimer;

    public SettlementMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.settlementsReset = Counter.builder("settlements.reset")
                .description("Number of settlement records reset to unpaid")
                .register(registry);

        this.settlementsOrphaned = Counter.builder("settlements.orphaned")
                .description("Number of settlement records purged because the plan changed under them")
                .register(registry);

        this.planSize = DistributionSummary.builder("settlement.plan.size")
                .description("Number of transfers in a computed settlement plan")
                .register(registry);

        this.planTimer = Timer.builder("settlement.plan.latency")
                .description("Time taken to compute a settlement plan from a transaction snapshot")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordGameCompleted(boolean balanced) {
        registry.counter("games.completed", "result", balanced ? "success" : "unbalanced").increment();
    }

    public void recordTransactionRecorded(String type) {
        registry.counter("transactions.recorded", "type", sanitizeTag(type)).increment();
    }

    public void recordSettlementMarked(String method) {
        registry.counter("settlements.marked", "method", sanitizeTag(method)).increment();
    }

    public void incrementSettlementsReset() {
        settlementsReset.increment();
    }

    public void incrementSettlementsOrphaned(int count) {
        settlementsOrphaned.increment(count);
    }

    public void recordPlanSize(int transfers) {
        planSize.record(transfers);
    }

    /**
     * Times a plan computation.
     */
    public <T> T timePlan(Supplier<T> operation) {
        return planTimer.record(operation);
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    /**
     * Keeps tag cardinality bounded.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
