package com.flagship.poker_ledger.settlement;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Settlement status held in memory for the lifetime of one session.
 *
 * Upserts go through {@link ConcurrentMap#compute}, so two concurrent marks of
 * the same pair leave exactly one record behind.
 */
public class InMemorySettlementStatusStore implements SettlementStatusStore {

    private final ConcurrentMap<SettlementKey, SettlementRecord> records = new ConcurrentHashMap<>();

    @Override
    public SettlementRecord markSettled(UUID gameId, UUID fromUserId, UUID toUserId,
                                        BigDecimal amount, PaymentMethod method) {
        SettlementKey key = SettlementKey.of(gameId, fromUserId, toUserId);
        SettlementRecord record = SettlementRecord.create(key, amount, method);
        return records.compute(key, (k, existing) -> record);
    }

    @Override
    public boolean reset(UUID gameId, UUID fromUserId, UUID toUserId) {
        return records.remove(SettlementKey.of(gameId, fromUserId, toUserId)) != null;
    }

    @Override
    public List<SettlementRecord> listSettled(UUID gameId) {
        return records.values().stream()
            .filter(record -> record.getGameId().equals(gameId))
            .sorted(SettlementRecord.BY_PAIR)
            .toList();
    }
}
