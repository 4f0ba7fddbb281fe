package com.flagship.poker_ledger.ledger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Redis fast path with database fallback.
 */
@ExtendWith(MockitoExtension.class)
class IdempotencyServiceTest {

    private static final String PREFIX = "poker-ledger:idempotency:";

    @Mock
    private TransactionRepository transactionRepository;

    @Mock
    private RedisTemplate<String, String> redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    @Test
    @DisplayName("A Redis hit skips the database")
    void testRedisHit() {
        UUID transactionId = UUID.randomUUID();
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get(PREFIX + "key-1")).thenReturn(transactionId.toString());

        IdempotencyService service = new IdempotencyService(transactionRepository, Optional.of(redisTemplate));

        assertEquals(Optional.of(transactionId), service.checkIdempotencyKey("key-1"));
        verifyNoInteractions(transactionRepository);
    }

    @Test
    @DisplayName("Redis failures fall back to the database")
    void testRedisDown_FallsBackToDatabase() {
        when(redisTemplate.opsForValue()).thenThrow(new RedisConnectionFailureException("down"));
        when(transactionRepository.findByIdempotencyKey("key-2")).thenReturn(Optional.empty());

        IdempotencyService service = new IdempotencyService(transactionRepository, Optional.of(redisTemplate));

        assertTrue(service.checkIdempotencyKey("key-2").isEmpty());
        assertDoesNotThrow(() -> service.storeIdempotencyKey("key-2", UUID.randomUUID()));
    }

    @Test
    @DisplayName("Without Redis the database is the only lookup")
    void testNoRedis() {
        IdempotencyService service = new IdempotencyService(transactionRepository, Optional.empty());
        when(transactionRepository.findByIdempotencyKey("key-3")).thenReturn(Optional.empty());

        assertTrue(service.checkIdempotencyKey("key-3").isEmpty());
        service.storeIdempotencyKey("key-3", UUID.randomUUID());
    }

    @Test
    @DisplayName("Keys are cached with a TTL after a store")
    void testStoreCaches() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        UUID transactionId = UUID.randomUUID();

        IdempotencyService service = new IdempotencyService(transactionRepository, Optional.of(redisTemplate));
        service.storeIdempotencyKey("key-4", transactionId);

        verify(valueOperations).set(eq(PREFIX + "key-4"), eq(transactionId.toString()), any(Duration.class));
    }

    @Test
    @DisplayName("Blank keys and missing ids are rejected")
    void testValidation() {
        IdempotencyService service = new IdempotencyService(transactionRepository, Optional.empty());

        assertThrows(IllegalArgumentException.class, () -> service.checkIdempotencyKey(" "));
        assertThrows(IllegalArgumentException.class, () -> service.checkIdempotencyKey(null));
        assertThrows(IllegalArgumentException.class, () -> service.storeIdempotencyKey("k", null));
        verify(transactionRepository, never()).findByIdempotencyKey(anyString());
    }
}
