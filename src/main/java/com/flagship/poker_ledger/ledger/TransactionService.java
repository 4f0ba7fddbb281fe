package com.flagship.poker_ledger.ledger;

import com.flagship.poker_ledger.game.Game;
import com.flagship.poker_ledger.game.GameNotFoundException;
import com.flagship.poker_ledger.game.GamePersistenceService;
import com.flagship.poker_ledger.ledger.event.TransactionDeletedEvent;
import com.flagship.poker_ledger.ledger.event.TransactionRecordedEvent;
import com.flagship.poker_ledger.ledger.event.TransactionUpdatedEvent;
import com.flagship.poker_ledger.observability.CorrelationContext;
import com.flagship.poker_ledger.observability.SettlementMetrics;
import com.flagship.poker_ledger.outbox.OutboxService;
import com.flagship.poker_ledger.settlement.GameSettlementService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Records, corrects and deletes buy-ins and cash-outs.
 *
 * Every mutation:
 * <ol>
 *   <li>takes the game row lock,</li>
 *   <li>requires the game to be IN_PROGRESS,</li>
 *   <li>purges settlement records the new plan no longer contains,</li>
 *   <li>writes its event to the outbox,</li>
 * </ol>
 * all in one database transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionService {

    public static final BigDecimal MIN_AMOUNT = Money.EPSILON;
    public static final BigDecimal MAX_AMOUNT = new BigDecimal("10000.00");
    public static final int MAX_NOTES_LENGTH = 500;
    public static final Duration MAX_CLOCK_SKEW = Duration.ofMinutes(5);
    public static final String INITIAL_BUYIN_NOTES = "Initial buy-in";

    private final TransactionRepository transactionRepository;
    private final GamePersistenceService gamePersistenceService;
    private final GameSettlementService settlementService;
    private final IdempotencyService idempotencyService;
    private final OutboxService outboxService;
    private final SettlementMetrics metrics;

    /**
     * Records a buy-in or cash-out. Replaying the same idempotency key returns
     * the original transaction without writing anything.
     *
     * @param timestamp when it happened at the table; null means now
     * @throws IllegalArgumentException if the key was used for another game, or input is invalid
     * @throws IllegalStateException if the game is not IN_PROGRESS
     */
    @Transactional
    public RecordedTransaction record(UUID gameId, UUID userId, TransactionType type, BigDecimal amount,
                                      Instant timestamp, String notes, String idempotencyKey) {
        CorrelationContext.putGameId(gameId);
        try {
            Optional<RecordedTransaction> replay = idempotencyService.checkIdempotencyKey(idempotencyKey)
                .flatMap(transactionId -> findReplay(gameId, transactionId, idempotencyKey));
            if (replay.isPresent()) {
                metrics.recordIdempotencyHit();
                log.info("Idempotency key already used, returning existing transaction {}",
                    replay.get().getTransaction().getId());
                return replay.get();
            }
            metrics.recordIdempotencyMiss();

            Game game = gamePersistenceService.lock(gameId);

            // a concurrent request with the same key may have committed while we waited
            replay = idempotencyService.lookupDatabase(idempotencyKey)
                .flatMap(transactionId -> findReplay(gameId, transactionId, idempotencyKey));
            if (replay.isPresent()) {
                return replay.get();
            }

            requireAcceptsTransactions(game);
            requireParticipant(game, userId);
            if (type == null) {
                throw new IllegalArgumentException("Transaction type is required");
            }
            validateAmount(amount);
            validateNotes(notes);
            Instant occurredAt = resolveTimestamp(timestamp);

            Transaction transaction = Transaction.of(UUID.randomUUID(), gameId, userId, type,
                amount, occurredAt, normalizeNotes(notes));
            transactionRepository.save(TransactionEntity.fromDomain(transaction, idempotencyKey));

            settlementService.purgeStaleRecords(game);
            outboxService.saveGameEvent(TransactionRecordedEvent.from(transaction));
            idempotencyService.storeIdempotencyKey(idempotencyKey, transaction.getId());
            metrics.recordTransactionRecorded(type.name());

            log.info("Transaction recorded: id={}, userId={}, type={}, amount={}",
                transaction.getId(), userId, type, transaction.getAmount());
            return RecordedTransaction.created(transaction);
        } finally {
            CorrelationContext.clearGameId();
        }
    }

    /**
     * Corrects the amount and notes of a recorded transaction.
     *
     * @throws TransactionNotFoundException if the transaction is not part of the game
     */
    @Transactional
    public Transaction update(UUID gameId, UUID transactionId, BigDecimal amount, String notes) {
        CorrelationContext.putGameId(gameId);
        try {
            Game game = gamePersistenceService.lock(gameId);
            requireAcceptsTransactions(game);
            validateAmount(amount);
            validateNotes(notes);

            TransactionEntity entity = transactionRepository.findByIdAndGameId(transactionId, gameId)
                .orElseThrow(() -> new TransactionNotFoundException(gameId, transactionId));
            Transaction before = entity.toDomain();
            Transaction after = before.withAmount(amount, normalizeNotes(notes));
            entity.correct(after);
            transactionRepository.save(entity);

            settlementService.purgeStaleRecords(game);
            outboxService.saveGameEvent(TransactionUpdatedEvent.from(before, after));

            log.info("Transaction corrected: id={}, amount {} -> {}",
                transactionId, before.getAmount(), after.getAmount());
            return after;
        } finally {
            CorrelationContext.clearGameId();
        }
    }

    /**
     * @throws TransactionNotFoundException if the transaction is not part of the game
     */
    @Transactional
    public void delete(UUID gameId, UUID transactionId) {
        CorrelationContext.putGameId(gameId);
        try {
            Game game = gamePersistenceService.lock(gameId);
            requireAcceptsTransactions(game);

            TransactionEntity entity = transactionRepository.findByIdAndGameId(transactionId, gameId)
                .orElseThrow(() -> new TransactionNotFoundException(gameId, transactionId));
            Transaction deleted = entity.toDomain();
            transactionRepository.delete(entity);

            settlementService.purgeStaleRecords(game);
            outboxService.saveGameEvent(TransactionDeletedEvent.from(deleted));

            log.info("Transaction deleted: id={}, userId={}, type={}, amount={}",
                transactionId, deleted.getUserId(), deleted.getType(), deleted.getAmount());
        } finally {
            CorrelationContext.clearGameId();
        }
    }

    /**
     * Records the game's buy-in amount for every seated player. Called by the
     * game service when the game starts, under its lock.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public List<Transaction> recordInitialBuyins(Game game) {
        List<Transaction> buyins = new ArrayList<>(game.getParticipants().size());
        for (UUID userId : game.getParticipants()) {
            Transaction buyin = Transaction.buyIn(game.getId(), userId, game.getBuyinAmount(), INITIAL_BUYIN_NOTES);
            transactionRepository.save(TransactionEntity.fromDomain(buyin, null));
            outboxService.saveGameEvent(TransactionRecordedEvent.from(buyin));
            metrics.recordTransactionRecorded(TransactionType.BUYIN.name());
            buyins.add(buyin);
        }
        log.info("Recorded {} initial buy-ins of {} {}",
            buyins.size(), game.getBuyinAmount(), game.getCurrency());
        return buyins;
    }

    @Transactional(readOnly = true)
    public List<Transaction> listTransactions(UUID gameId) {
        if (gamePersistenceService.findById(gameId).isEmpty()) {
            throw new GameNotFoundException(gameId);
        }
        return transactionRepository.findByGameIdOrderByOccurredAtAsc(gameId).stream()
            .map(TransactionEntity::toDomain)
            .sorted(Transaction.CHRONOLOGICAL)
            .toList();
    }

    private Optional<RecordedTransaction> findReplay(UUID gameId, UUID transactionId, String idempotencyKey) {
        // a cached id whose row is gone belonged to a rolled back request
        return transactionRepository.findById(transactionId).map(entity -> {
            if (!entity.getGameId().equals(gameId)) {
                throw new IllegalArgumentException(String.format(
                    "Idempotency key %s was already used for another game", idempotencyKey));
            }
            return RecordedTransaction.replayed(entity.toDomain());
        });
    }

    private static void requireAcceptsTransactions(Game game) {
        if (!game.acceptsTransactions()) {
            throw new IllegalStateException(String.format(
                "Cannot change transactions of a game in %s status. Only IN_PROGRESS games accept changes.",
                game.getStatus()));
        }
    }

    private static void requireParticipant(Game game, UUID userId) {
        if (userId == null) {
            throw new IllegalArgumentException("User ID is required");
        }
        if (!game.isParticipant(userId)) {
            throw new IllegalArgumentException(String.format(
                "User %s is not a participant of game %s", userId, game.getId()));
        }
    }

    static void validateAmount(BigDecimal amount) {
        if (amount == null || amount.compareTo(MIN_AMOUNT) < 0 || amount.compareTo(MAX_AMOUNT) > 0) {
            throw new IllegalArgumentException(String.format(
                "Amount must be between %s and %s", MIN_AMOUNT, MAX_AMOUNT));
        }
        if (!Money.hasValidScale(amount)) {
            throw new IllegalArgumentException(String.format(
                "Amount must have at most %d decimal places: %s", Money.SCALE, amount.toPlainString()));
        }
    }

    static void validateNotes(String notes) {
        if (notes != null && notes.length() > MAX_NOTES_LENGTH) {
            throw new IllegalArgumentException(String.format(
                "Notes cannot exceed %d characters", MAX_NOTES_LENGTH));
        }
    }

    static Instant resolveTimestamp(Instant timestamp) {
        Instant now = Instant.now();
        if (timestamp == null) {
            return now;
        }
        if (timestamp.isAfter(now.plus(MAX_CLOCK_SKEW))) {
            throw new IllegalArgumentException(String.format(
                "Transaction timestamp %s is more than %d minutes in the future",
                timestamp, MAX_CLOCK_SKEW.toMinutes()));
        }
        return timestamp;
    }

    private static String normalizeNotes(String notes) {
        return notes == null || notes.isBlank() ? null : notes.trim();
    }
}
