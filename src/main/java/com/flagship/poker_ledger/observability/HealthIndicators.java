package com.flagship.poker_ledger.observability;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Readiness checks for the outbox backlog, Redis and Kafka.
 */
public class HealthIndicators {

    /**
     * WARNING once events pile up or any event is dead-lettered, DOWN when the
     * backlog suggests the publisher has stopped.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxMetrics outboxMetrics;

        public OutboxHealthIndicator(OutboxMetrics outboxMetrics) {
            this.outboxMetrics = outboxMetrics;
        }

        @Override
        public Health health() {
            OutboxBacklog backlog = outboxMetrics.getBacklog();

            Health.Builder builder;
            if (backlog.getPending() >= BACKLOG_CRITICAL_THRESHOLD) {
                builder = Health.down();
            } else if (backlog.getPending() >= BACKLOG_WARNING_THRESHOLD || backlog.getDeadLetters() > 0) {
                builder = Health.status("WARNING");
            } else {
                builder = Health.up();
            }
            return builder
                    .withDetail("pending", backlog.getPending())
                    .withDetail("oldestAgeSeconds", backlog.getOldestAgeSeconds())
                    .withDetail("deadLetters", backlog.getDeadLetters())
                    .build();
        }
    }

    /**
     * Redis only backs the idempotency fast path, so an outage is reported as
     * DEGRADED rather than DOWN.
     */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private static final String FALLBACK_NOTE = "Idempotency falls back to the transactions table";

        private final ObjectProvider<StringRedisTemplate> redisTemplate;

        public RedisHealthIndicator(ObjectProvider<StringRedisTemplate> redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            StringRedisTemplate template = redisTemplate.getIfAvailable();
            if (template == null || template.getConnectionFactory() == null) {
                return Health.status("DEGRADED")
                        .withDetail("error", "Redis is not configured")
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            }

            try (var connection = template.getConnectionFactory().getConnection()) {
                String result = connection.ping();
                if ("PONG".equals(result)) {
                    return Health.up().withDetail("response", result).build();
                }
                return Health.status("DEGRADED")
                        .withDetail("response", result != null ? result : "null")
                        .withDetail("note", FALLBACK_NOTE)
                        .build();

            } catch (Exception e) {
                return Health.status("DEGRADED")
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            }
        }
    }

    /**
     * Kafka only matters while this instance publishes the outbox. With the
     * publisher off, events simply accumulate and the check reports UP.
     */
    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final ObjectProvider<KafkaTemplate<String, String>> kafkaTemplate;
        private final boolean publisherEnabled;
        private final String gamesTopic;

        public KafkaHealthIndicator(ObjectProvider<KafkaTemplate<String, String>> kafkaTemplate,
                                    @Value("${outbox.publisher.enabled:true}") boolean publisherEnabled,
                                    @Value("${kafka.topic.games:poker-games}") String gamesTopic) {
            this.kafkaTemplate = kafkaTemplate;
            this.publisherEnabled = publisherEnabled;
            this.gamesTopic = gamesTopic;
        }

        @Override
        public Health health() {
            if (!publisherEnabled) {
                return Health.up().withDetail("publisher", "disabled").build();
            }
            KafkaTemplate<String, String> template = kafkaTemplate.getIfAvailable();
            if (template == null) {
                return Health.down().withDetail("error", "KafkaTemplate not configured").build();
            }
            try {
                var metrics = template.metrics();
                if (metrics == null || metrics.isEmpty()) {
                    return Health.down()
                            .withDetail("topic", gamesTopic)
                            .withDetail("error", "Producer has not connected yet")
                            .build();
                }
                return Health.up().withDetail("topic", gamesTopic).build();
            } catch (Exception e) {
                return Health.down()
                        .withDetail("topic", gamesTopic)
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }
}
