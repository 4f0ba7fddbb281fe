package com.flagship.poker_ledger.settlement;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.Value;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Paid/unpaid status of one planned transfer.
 *
 * Either UNSETTLED (no method, no timestamp) or SETTLED (both present);
 * the factories are the only way to build one, so the two never mix.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SettlementStatus {

    private static final SettlementStatus UNSETTLED = new SettlementStatus(State.UNSETTLED, null, null);

    State state;
    @Getter(AccessLevel.NONE)
    PaymentMethod method;
    @Getter(AccessLevel.NONE)
    Instant at;

    public enum State {
        UNSETTLED,
        SETTLED
    }

    public static SettlementStatus unsettled() {
        return UNSETTLED;
    }

    public static SettlementStatus settled(PaymentMethod method, Instant settledAt) {
        return new SettlementStatus(State.SETTLED,
            Objects.requireNonNull(method, "method"),
            Objects.requireNonNull(settledAt, "settledAt"));
    }

    public static SettlementStatus of(SettlementRecord record) {
        return settled(record.getPaymentMethod(), record.getSettledAt());
    }

    public boolean isSettled() {
        return state == State.SETTLED;
    }

    public Optional<PaymentMethod> getPaymentMethod() {
        return Optional.ofNullable(method);
    }

    public Optional<Instant> getSettledAt() {
        return Optional.ofNullable(at);
    }
}
