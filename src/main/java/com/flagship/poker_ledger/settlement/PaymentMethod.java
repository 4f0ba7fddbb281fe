package com.flagship.poker_ledger.settlement;

import java.util.Locale;

/**
 * How a settlement transfer was paid outside the app.
 */
public enum PaymentMethod {
    CASH,
    PAYPAL,
    VENMO,
    ZELLE;

    /**
     * Case-insensitive lookup.
     *
     * @throws IllegalArgumentException for unknown methods
     */
    public static PaymentMethod parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Payment method is required");
        }
        try {
            return PaymentMethod.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported payment method: " + value);
        }
    }
}
