package com.flagship.poker_ledger.observability;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class HealthIndicatorsTest {

    @Mock
    private OutboxMetrics outboxMetrics;

    @Mock
    private ObjectProvider<StringRedisTemplate> redisProvider;

    @Mock
    private ObjectProvider<KafkaTemplate<String, String>> kafkaProvider;

    @Test
    @DisplayName("Outbox: UP when drained, WARNING on dead letters, DOWN on a huge backlog")
    void outboxHealth() {
        HealthIndicators.OutboxHealthIndicator indicator = new HealthIndicators.OutboxHealthIndicator(outboxMetrics);

        when(outboxMetrics.getBacklog()).thenReturn(new OutboxBacklog(3, 1, 0));
        assertEquals(Status.UP, indicator.health().getStatus());

        when(outboxMetrics.getBacklog()).thenReturn(new OutboxBacklog(3, 1, 2));
        Health warning = indicator.health();
        assertEquals("WARNING", warning.getStatus().getCode());
        assertEquals(2L, warning.getDetails().get("deadLetters"));

        when(outboxMetrics.getBacklog()).thenReturn(new OutboxBacklog(20000, 600, 0));
        assertEquals(Status.DOWN, indicator.health().getStatus());
    }

    @Test
    @DisplayName("Redis missing is DEGRADED, not DOWN")
    void redisHealth() {
        when(redisProvider.getIfAvailable()).thenReturn(null);

        Health health = new HealthIndicators.RedisHealthIndicator(redisProvider).health();

        assertEquals("DEGRADED", health.getStatus().getCode());
    }

    @Test
    @DisplayName("Kafka is not checked while the publisher is off")
    void kafkaHealth_PublisherDisabled() {
        Health health = new HealthIndicators.KafkaHealthIndicator(kafkaProvider, false, "poker-games").health();

        assertEquals(Status.UP, health.getStatus());
        verifyNoInteractions(kafkaProvider);
    }

    @Test
    @DisplayName("Kafka without a template is DOWN while publishing")
    void kafkaHealth_NoTemplate() {
        when(kafkaProvider.getIfAvailable()).thenReturn(null);

        Health health = new HealthIndicators.KafkaHealthIndicator(kafkaProvider, true, "poker-games").health();

        assertEquals(Status.DOWN, health.getStatus());
    }
}
