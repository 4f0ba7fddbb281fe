package com.flagship.poker_ledger.observability;

import lombok.Value;

/**
 * Unpublished outbox events at the time of the last metrics refresh.
 */
@Value
public class OutboxBacklog {

    static final OutboxBacklog EMPTY = new OutboxBacklog(0, 0, 0);

    long pending;
    long oldestAgeSeconds;
    long deadLetters;
}
