package com.flagship.poker_ledger.observability;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class CorrelationContextTest {

    @AfterEach
    void tearDown() {
        CorrelationContext.end();
    }

    @Test
    @DisplayName("A well-formed incoming id is kept")
    void keepsIncomingId() {
        assertEquals("req-1.a:b_c", CorrelationContext.begin("req-1.a:b_c"));
        assertEquals("req-1.a:b_c", CorrelationContext.currentCorrelationId().orElseThrow());
        assertEquals("req-1.a:b_c", MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY));
    }

    @Test
    @DisplayName("Missing, oversized or unsafe ids are replaced")
    void replacesBadIds() {
        assertEquals(8, CorrelationContext.begin(null).length());
        assertNotEquals("x".repeat(65), CorrelationContext.begin("x".repeat(65)));
        assertNotEquals("a\nb", CorrelationContext.begin("a\nb"));
    }

    @Test
    @DisplayName("end() clears both the correlation and the game id")
    void endClearsEverything() {
        CorrelationContext.begin("abc");
        CorrelationContext.putGameId(UUID.randomUUID());
        assertNotNull(MDC.get(CorrelationContext.GAME_ID_MDC_KEY));

        CorrelationContext.end();

        assertTrue(CorrelationContext.currentCorrelationId().isEmpty());
        assertNull(MDC.get(CorrelationContext.GAME_ID_MDC_KEY));
    }
}
