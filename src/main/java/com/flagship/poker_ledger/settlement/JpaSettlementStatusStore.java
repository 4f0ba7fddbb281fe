package com.flagship.poker_ledger.settlement;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Database-backed settlement status.
 *
 * Find-then-write is only race free because every caller holds the game row
 * lock; the unique pair constraint rejects anything that slips past it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaSettlementStatusStore implements SettlementStatusStore {

    private final SettlementRecordRepository repository;

    @Override
    @Transactional
    public SettlementRecord markSettled(UUID gameId, UUID fromUserId, UUID toUserId,
                                        BigDecimal amount, PaymentMethod method) {
        SettlementKey key = SettlementKey.of(gameId, fromUserId, toUserId);
        SettlementRecord record = SettlementRecord.create(key, amount, method);

        Optional<SettlementRecordEntity> existing = find(key);
        SettlementRecordEntity saved;
        if (existing.isPresent()) {
            existing.get().overwrite(record);
            saved = repository.save(existing.get());
            log.debug("Overwrote settlement record {} -> {}", fromUserId, toUserId);
        } else {
            saved = repository.save(SettlementRecordEntity.fromDomain(record));
            log.debug("Created settlement record {} -> {}", fromUserId, toUserId);
        }
        return saved.toDomain();
    }

    @Override
    @Transactional
    public boolean reset(UUID gameId, UUID fromUserId, UUID toUserId) {
        return find(SettlementKey.of(gameId, fromUserId, toUserId))
            .map(entity -> {
                repository.delete(entity);
                return true;
            })
            .orElse(false);
    }

    @Override
    @Transactional(readOnly = true)
    public List<SettlementRecord> listSettled(UUID gameId) {
        return repository.findByGameId(gameId).stream()
            .map(SettlementRecordEntity::toDomain)
            .sorted(SettlementRecord.BY_PAIR)
            .toList();
    }

    private Optional<SettlementRecordEntity> find(SettlementKey key) {
        return repository.findByGameIdAndFromUserIdAndToUserId(
            key.getGameId(), key.getFromUserId(), key.getToUserId());
    }
}
