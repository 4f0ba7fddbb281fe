package com.flagship.poker_ledger.observability;

import com.flagship.poker_ledger.game.GameRepository;
import com.flagship.poker_ledger.game.GameStatus;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Refreshes the gauges that need a database query: the outbox backlog and
 * the number of games per status (games.count{status}).
 */
@Component
@Slf4j
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final GameRepository gameRepository;
    private final Map<GameStatus, AtomicLong> gamesByStatus = new EnumMap<>(GameStatus.class);

    public MetricsScheduler(OutboxMetrics outboxMetrics, GameRepository gameRepository, MeterRegistry registry) {
        this.outboxMetrics = outboxMetrics;
        this.gameRepository = gameRepository;
        for (GameStatus status : GameStatus.values()) {
            AtomicLong count = new AtomicLong();
            gamesByStatus.put(status, count);
            Gauge.builder("games.count", count, AtomicLong::get)
                .description("Games per status")
                .tag("status", status.name())
                .register(registry);
        }
    }

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refresh() {
        outboxMetrics.refresh();
        try {
            gamesByStatus.forEach((status, count) -> count.set(gameRepository.countByStatus(status)));
        } catch (Exception e) {
            log.warn("Failed to refresh game gauges: {}", e.getMessage());
        }
    }
}
