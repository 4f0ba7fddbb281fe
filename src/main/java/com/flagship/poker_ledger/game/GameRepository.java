package com.flagship.poker_ledger.game;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface GameRepository extends JpaRepository<GameEntity, UUID> {

    /**
     * Loads the game with SELECT ... FOR UPDATE.
     * Every write that can change the settlement plan or the game status takes
     * this lock first, so closing sees a consistent transaction snapshot.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT g FROM GameEntity g WHERE g.id = :id")
    Optional<GameEntity> findByIdForUpdate(@Param("id") UUID id);

    long countByStatus(GameStatus status);
}
