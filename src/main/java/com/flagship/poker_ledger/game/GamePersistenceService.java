package com.flagship.poker_ledger.game;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

/**
 * Bridges the {@link Game} domain object and {@link GameEntity}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GamePersistenceService {

    private final GameRepository gameRepository;

    @Transactional
    public Game save(Game game) {
        GameEntity saved = gameRepository.save(GameEntity.fromDomain(game));
        log.debug("Saved game {}", saved.getId());
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<Game> findById(UUID gameId) {
        return gameRepository.findById(gameId).map(GameEntity::toDomain);
    }

    /**
     * Locks the game row for the rest of the caller's transaction and returns
     * its current state.
     *
     * @throws GameNotFoundException if the game does not exist
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Game lock(UUID gameId) {
        return gameRepository.findByIdForUpdate(gameId)
            .map(GameEntity::toDomain)
            .orElseThrow(() -> new GameNotFoundException(gameId));
    }

    /**
     * Writes status and seated players back. Uses the controlled update
     * method instead of setters so domain rules cannot be bypassed.
     */
    @Transactional
    public Game update(Game game) {
        GameEntity existing = gameRepository.findById(game.getId())
            .orElseThrow(() -> new GameNotFoundException(game.getId()));
        existing.updateFromDomain(game);
        GameEntity updated = gameRepository.save(existing);
        log.debug("Updated game {} -> {}", updated.getId(), updated.getStatus());
        return updated.toDomain();
    }
}
