package com.flagship.poker_ledger.game;

/**
 * Currency of a game's stakes, ISO-4217.
 *
 * Typed so an unknown code is rejected at the edge rather than stored.
 */
public enum CurrencyCode {
    USD,
    EUR,
    GBP,
    CAD,
    AUD,
    INR,
    JPY
}
