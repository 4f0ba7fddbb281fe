package com.flagship.poker_ledger.observability;

import org.slf4j.MDC;

import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * MDC-backed request context: the correlation id of the current request and
 * the game being worked on. Both end up on every log line, and the
 * correlation id is copied onto outbox events.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String GAME_ID_MDC_KEY = "gameId";

    private static final Pattern ACCEPTED_ID = Pattern.compile("[A-Za-z0-9._:-]{1,64}");

    private CorrelationContext() {
    }

    /**
     * Starts a request scope. A caller-supplied id is kept if it is safe to
     * log; otherwise a fresh one is generated.
     *
     * @return the id in effect
     */
    public static String begin(String incomingId) {
        String id = incomingId != null && ACCEPTED_ID.matcher(incomingId).matches()
            ? incomingId
            : generateCorrelationId();
        MDC.put(CORRELATION_ID_MDC_KEY, id);
        return id;
    }

    public static void end() {
        MDC.remove(CORRELATION_ID_MDC_KEY);
        MDC.remove(GAME_ID_MDC_KEY);
    }

    public static Optional<String> currentCorrelationId() {
        return Optional.ofNullable(MDC.get(CORRELATION_ID_MDC_KEY));
    }

    static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Pair with {@link #clearGameId()} in a finally block.
     */
    public static void putGameId(UUID gameId) {
        if (gameId != null) {
            MDC.put(GAME_ID_MDC_KEY, gameId.toString());
        }
    }

    public static void clearGameId() {
        MDC.remove(GAME_ID_MDC_KEY);
    }
}
