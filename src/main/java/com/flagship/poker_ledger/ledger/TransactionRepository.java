package com.flagship.poker_ledger.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface TransactionRepository extends JpaRepository<TransactionEntity, UUID> {

    List<TransactionEntity> findByGameIdOrderByOccurredAtAsc(UUID gameId);

    Optional<TransactionEntity> findByIdAndGameId(UUID id, UUID gameId);

    /**
     * Used for idempotency checking when Redis has no answer.
     */
    Optional<TransactionEntity> findByIdempotencyKey(String idempotencyKey);

    long countByGameId(UUID gameId);
}
