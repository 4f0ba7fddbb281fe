package com.flagship.poker_ledger.ledger;

import com.flagship.poker_ledger.ledger.dto.RecordTransactionRequest;
import com.flagship.poker_ledger.ledger.dto.TransactionResponse;
import com.flagship.poker_ledger.ledger.dto.UpdateTransactionRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Buy-ins and cash-outs of a game.
 *
 * Recording requires an Idempotency-Key header: the first call creates the
 * transaction (201), retries with the same key return it unchanged (200).
 */
@RestController
@RequestMapping("/api/games/{gameId}/transactions")
@RequiredArgsConstructor
@Slf4j
public class TransactionController {

    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final TransactionService transactionService;

    @PostMapping
    public ResponseEntity<TransactionResponse> recordTransaction(
            @PathVariable("gameId") UUID gameId,
            @Valid @RequestBody RecordTransactionRequest request,
            @RequestHeader(IDEMPOTENCY_KEY_HEADER) String idempotencyKey) {

        log.info("Received transaction request: idempotencyKey={}, type={}, amount={}",
            idempotencyKey, request.getType(), request.getAmount());

        RecordedTransaction result = transactionService.record(
            gameId,
            request.getUserId(),
            TransactionType.valueOf(request.getType().toUpperCase(Locale.ROOT)),
            request.getAmount(),
            request.getTimestamp(),
            request.getNotes(),
            idempotencyKey);

        HttpStatus status = result.isCreated() ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(TransactionResponse.from(result.getTransaction()));
    }

    @GetMapping
    public ResponseEntity<List<TransactionResponse>> listTransactions(@PathVariable("gameId") UUID gameId) {
        return ResponseEntity.ok(transactionService.listTransactions(gameId).stream()
            .map(TransactionResponse::from)
            .toList());
    }

    @PutMapping("/{transactionId}")
    public ResponseEntity<TransactionResponse> updateTransaction(
            @PathVariable("gameId") UUID gameId,
            @PathVariable("transactionId") UUID transactionId,
            @Valid @RequestBody UpdateTransactionRequest request) {
        Transaction updated = transactionService.update(gameId, transactionId, request.getAmount(), request.getNotes());
        return ResponseEntity.ok(TransactionResponse.from(updated));
    }

    @DeleteMapping("/{transactionId}")
    public ResponseEntity<Void> deleteTransaction(@PathVariable("gameId") UUID gameId,
                                                  @PathVariable("transactionId") UUID transactionId) {
        transactionService.delete(gameId, transactionId);
        return ResponseEntity.noContent().build();
    }
}
