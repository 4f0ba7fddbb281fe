package com.flagship.poker_ledger.outbox;

import com.flagship.poker_ledger.observability.OutboxMetrics;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.header.Header;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Publisher loop without a broker.
 *
 * These tests verify that:
 * - Events are sent keyed by game id with type, id and correlation headers
 * - A successful send marks the event published
 * - A failed send marks the event failed, and the last allowed failure dead-letters it
 */
@ExtendWith(MockitoExtension.class)
class OutboxPublisherTest {

    private static final String TOPIC = "poker-games-test";

    @Mock
    private OutboxService outboxService;

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    @Mock
    private OutboxMetrics outboxMetrics;

    private OutboxPublisher publisher;

    @BeforeEach
    void setUp() {
        publisher = new OutboxPublisher(outboxService, kafkaTemplate, outboxMetrics);
        ReflectionTestUtils.setField(publisher, "gamesTopic", TOPIC);
        ReflectionTestUtils.setField(publisher, "batchSize", 10);
        ReflectionTestUtils.setField(publisher, "maxRetries", 3);
    }

    private static OutboxEvent event(UUID gameId, int retryCount, String correlationId) {
        return new OutboxEvent(UUID.randomUUID(), OutboxService.AGGREGATE_GAME, gameId, "GameCompleted",
            "{\"gameId\":\"" + gameId + "\"}", correlationId, Instant.now(), null, retryCount, null);
    }

    private static SendResult<String, String> sendResult(ProducerRecord<String, String> record) {
        RecordMetadata metadata = new RecordMetadata(new TopicPartition(TOPIC, 0), 0L, 0, 0L, 0, 0);
        return new SendResult<>(record, metadata);
    }

    private static String header(ProducerRecord<String, String> record, String name) {
        Header header = record.headers().lastHeader(name);
        return header == null ? null : new String(header.value(), StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Successful send marks the event published")
    @SuppressWarnings("unchecked")
    void testPublish_Success() {
        UUID gameId = UUID.randomUUID();
        OutboxEvent event = event(gameId, 0, "abc12345");
        when(outboxService.claimBatch(10, 3)).thenReturn(List.of(event));
        when(kafkaTemplate.send(any(ProducerRecord.class)))
            .thenAnswer(invocation -> CompletableFuture.completedFuture(sendResult(invocation.getArgument(0))));

        publisher.triggerPublish();

        ArgumentCaptor<ProducerRecord<String, String>> captor = ArgumentCaptor.forClass(ProducerRecord.class);
        verify(kafkaTemplate).send(captor.capture());
        ProducerRecord<String, String> sent = captor.getValue();
        assertEquals(TOPIC, sent.topic());
        assertEquals(gameId.toString(), sent.key());
        assertEquals(event.getPayload(), sent.value());
        assertEquals("GameCompleted", header(sent, OutboxPublisher.HEADER_EVENT_TYPE));
        assertEquals(event.getId().toString(), header(sent, OutboxPublisher.HEADER_EVENT_ID));
        assertEquals("abc12345", header(sent, OutboxPublisher.HEADER_CORRELATION_ID));

        verify(outboxService).markPublished(event.getId());
        verify(outboxService, never()).markFailed(any(), anyString());
        verify(outboxMetrics).recordEventPublished("GameCompleted");
    }

    @Test
    @DisplayName("Failed send marks the event failed")
    @SuppressWarnings("unchecked")
    void testPublish_Failure() {
        OutboxEvent event = event(UUID.randomUUID(), 0, null);
        when(outboxService.claimBatch(10, 3)).thenReturn(List.of(event));
        when(kafkaTemplate.send(any(ProducerRecord.class)))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        publisher.triggerPublish();

        verify(outboxService).markFailed(eq(event.getId()), anyString());
        verify(outboxService, never()).markPublished(any());
        verify(outboxMetrics).recordEventPublishFailed("GameCompleted");
        verify(outboxMetrics, never()).recordEventDeadLettered(anyString());
    }

    @Test
    @DisplayName("The last allowed failure dead-letters the event")
    @SuppressWarnings("unchecked")
    void testPublish_DeadLetter() {
        OutboxEvent event = event(UUID.randomUUID(), 2, null);
        when(outboxService.claimBatch(10, 3)).thenReturn(List.of(event));
        when(kafkaTemplate.send(any(ProducerRecord.class)))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        publisher.triggerPublish();

        verify(outboxService).markFailed(eq(event.getId()), anyString());
        verify(outboxMetrics).recordEventDeadLettered("GameCompleted");
    }

    @Test
    @DisplayName("Events raised outside a request carry no correlation header")
    void testRecord_WithoutCorrelationId() {
        ProducerRecord<String, String> record = publisher.toRecord(event(UUID.randomUUID(), 0, null));

        assertNull(record.headers().lastHeader(OutboxPublisher.HEADER_CORRELATION_ID));
        assertNotNull(record.headers().lastHeader(OutboxPublisher.HEADER_EVENT_TYPE));
    }

    @Test
    @DisplayName("Nothing is sent when the outbox is empty")
    void testPublish_Empty() {
        when(outboxService.claimBatch(10, 3)).thenReturn(List.of());

        publisher.triggerPublish();

        verifyNoInteractions(kafkaTemplate);
    }
}
