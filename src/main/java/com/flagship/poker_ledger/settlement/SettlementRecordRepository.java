package com.flagship.poker_ledger.settlement;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SettlementRecordRepository extends JpaRepository<SettlementRecordEntity, UUID> {

    Optional<SettlementRecordEntity> findByGameIdAndFromUserIdAndToUserId(UUID gameId, UUID fromUserId, UUID toUserId);

    List<SettlementRecordEntity> findByGameId(UUID gameId);
}
