package com.flagship.poker_ledger.game;

/**
 * Lifecycle of a cash game.
 *
 * Transitions are explicit and validated by {@link Game}; this is not just a column.
 */
public enum GameStatus {
    /**
     * Created, players may still be added. Initial state.
     */
    SCHEDULED,

    /**
     * Cards are in the air: buy-ins and cash-outs are being recorded.
     */
    IN_PROGRESS,

    /**
     * Closed with balanced books. Terminal; transactions are frozen.
     */
    COMPLETED,

    /**
     * Abandoned before completion. Terminal.
     */
    CANCELLED
}
