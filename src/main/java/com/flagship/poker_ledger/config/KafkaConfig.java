package com.flagship.poker_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.common.config.TopicConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Declares the game events topic. Only needed when the outbox publisher runs.
 *
 * The partition count bounds consumer parallelism; ordering only holds per
 * game, since the game id is the record key.
 */
@Configuration
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
public class KafkaConfig {

    @Value("${kafka.topic.games:poker-games}")
    private String gamesTopic;

    @Value("${kafka.topic.games-partitions:3}")
    private int partitions;

    @Value("${kafka.topic.games-retention-days:30}")
    private int retentionDays;

    @Bean
    public NewTopic gamesTopic() {
        return TopicBuilder.name(gamesTopic)
                .partitions(partitions)
                .replicas(1)
                .config(TopicConfig.RETENTION_MS_CONFIG, String.valueOf(retentionDays * 24L * 60 * 60 * 1000))
                .build();
    }
}
