package com.flagship.poker_ledger.ledger;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Immutable view over one game's transactions.
 *
 * Balances are derived, not stored: every instance is a pure function of the
 * participant list and the transaction snapshot it was built from. Results are
 * keyed in ascending userId order so they do not depend on input order.
 */
public final class GameLedger {

    private final UUID gameId;
    private final Map<UUID, PlayerBalance> balances;
    private final BigDecimal totalBuyin;
    private final BigDecimal totalCashout;

    private GameLedger(UUID gameId, Map<UUID, PlayerBalance> balances) {
        this.gameId = gameId;
        this.balances = Collections.unmodifiableMap(balances);
        this.totalBuyin = balances.values().stream()
            .map(PlayerBalance::getTotalBuyin)
            .reduce(Money.ZERO, BigDecimal::add);
        this.totalCashout = balances.values().stream()
            .map(PlayerBalance::getTotalCashout)
            .reduce(Money.ZERO, BigDecimal::add);
    }

    /**
     * Builds the ledger for a game.
     *
     * @param gameId the game every transaction must belong to
     * @param participants players seeded with a zero balance even if they have not transacted
     * @param transactions transaction snapshot, in any order
     * @throws IllegalArgumentException if a transaction belongs to another game
     */
    public static GameLedger of(UUID gameId, Collection<UUID> participants,
                                Collection<Transaction> transactions) {
        Objects.requireNonNull(gameId, "gameId");
        for (Transaction txn : transactions) {
            if (!gameId.equals(txn.getGameId())) {
                throw new IllegalArgumentException(String.format(
                    "Transaction %s belongs to game %s, not %s", txn.getId(), txn.getGameId(), gameId));
            }
        }
        return new GameLedger(gameId, aggregate(participants, transactions));
    }

    /**
     * Aggregates transactions into one balance per user, without a game check.
     */
    public static Map<UUID, PlayerBalance> computeBalances(Collection<UUID> participants,
                                                           Collection<Transaction> transactions) {
        return Collections.unmodifiableMap(aggregate(participants, transactions));
    }

    private static Map<UUID, PlayerBalance> aggregate(Collection<UUID> participants,
                                                      Collection<Transaction> transactions) {
        Map<UUID, List<Transaction>> buyins = new TreeMap<>();
        Map<UUID, List<Transaction>> cashouts = new TreeMap<>();

        if (participants != null) {
            for (UUID userId : participants) {
                buyins.putIfAbsent(userId, new ArrayList<>());
                cashouts.putIfAbsent(userId, new ArrayList<>());
            }
        }

        for (Transaction txn : transactions) {
            buyins.computeIfAbsent(txn.getUserId(), id -> new ArrayList<>());
            cashouts.computeIfAbsent(txn.getUserId(), id -> new ArrayList<>());
            if (txn.getType() == TransactionType.BUYIN) {
                buyins.get(txn.getUserId()).add(txn);
            } else {
                cashouts.get(txn.getUserId()).add(txn);
            }
        }

        Map<UUID, PlayerBalance> result = new LinkedHashMap<>();
        for (UUID userId : buyins.keySet()) {
            List<Transaction> userBuyins = buyins.get(userId);
            List<Transaction> userCashouts = cashouts.get(userId);
            userBuyins.sort(Transaction.CHRONOLOGICAL);
            userCashouts.sort(Transaction.CHRONOLOGICAL);
            result.put(userId, new PlayerBalance(
                userId,
                sum(userBuyins),
                sum(userCashouts),
                List.copyOf(userBuyins),
                List.copyOf(userCashouts)
            ));
        }
        return result;
    }

    private static BigDecimal sum(List<Transaction> transactions) {
        return transactions.stream()
            .map(Transaction::getAmount)
            .reduce(Money.ZERO, BigDecimal::add);
    }

    public UUID getGameId() {
        return gameId;
    }

    public Map<UUID, PlayerBalance> getBalances() {
        return balances;
    }

    public Optional<PlayerBalance> getBalance(UUID userId) {
        return Optional.ofNullable(balances.get(userId));
    }

    public BigDecimal getTotalBuyin() {
        return totalBuyin;
    }

    public BigDecimal getTotalCashout() {
        return totalCashout;
    }

    /**
     * userId -> net, in the same order as {@link #getBalances()}.
     */
    public Map<UUID, BigDecimal> getNetBalances() {
        Map<UUID, BigDecimal> nets = new LinkedHashMap<>();
        balances.forEach((userId, balance) -> nets.put(userId, balance.getNet()));
        return Collections.unmodifiableMap(nets);
    }

    public boolean isEmpty() {
        return balances.isEmpty();
    }
}
