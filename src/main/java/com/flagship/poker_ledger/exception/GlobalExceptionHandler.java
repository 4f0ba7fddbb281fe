package com.flagship.poker_ledger.exception;

import com.flagship.poker_ledger.game.GameNotBalancedException;
import com.flagship.poker_ledger.game.GameNotFoundException;
import com.flagship.poker_ledger.ledger.TransactionNotFoundException;
import com.flagship.poker_ledger.settlement.InconsistentSettlementStateException;
import com.flagship.poker_ledger.settlement.SettlementRecord;
import com.flagship.poker_ledger.settlement.TransferNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps domain exceptions to HTTP responses.
 *
 * <ul>
 *   <li>422: books do not balance at closing</li>
 *   <li>404: unknown game, transaction or planned transfer</li>
 *   <li>409: orphaned settlement records, invalid state transitions</li>
 *   <li>400: malformed or invalid input</li>
 * </ul>
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(GameNotBalancedException.class)
    public ResponseEntity<ApiError> handleNotBalanced(GameNotBalancedException e) {
        log.warn("Game not balanced: {}", e.getMessage());

        Map<String, String> details = new LinkedHashMap<>();
        details.put("game_id", e.getGameId().toString());
        details.put("total_buyin", e.getBalanceCheck().getTotalBuyin().toPlainString());
        details.put("total_cashout", e.getBalanceCheck().getTotalCashout().toPlainString());
        details.put("discrepancy", e.getDiscrepancy().toPlainString());

        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Game Not Balanced", e.getMessage(), details);
    }

    @ExceptionHandler({
        GameNotFoundException.class,
        TransactionNotFoundException.class,
        TransferNotFoundException.class
    })
    public ResponseEntity<ApiError> handleNotFound(RuntimeException e) {
        log.warn("Not found: {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, "Not Found", e.getMessage(), null);
    }

    @ExceptionHandler(InconsistentSettlementStateException.class)
    public ResponseEntity<ApiError> handleInconsistent(InconsistentSettlementStateException e) {
        log.warn("Inconsistent settlement state: {}", e.getMessage());

        Map<String, String> details = new LinkedHashMap<>();
        for (SettlementRecord record : e.getOrphaned()) {
            details.put(record.getFromUserId() + "->" + record.getToUserId(), record.getAmount().toPlainString());
        }
        return respond(HttpStatus.CONFLICT, "Inconsistent Settlement State", e.getMessage(), details);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ApiError> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());
        return respond(HttpStatus.BAD_REQUEST, "Missing Required Header",
            "Required header '" + e.getHeaderName() + "' is missing", null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", "Request validation failed", errors);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiError> handleUnreadable(Exception e) {
        log.warn("Malformed request: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Malformed Request", "Request could not be read", null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", e.getMessage(), null);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiError> handleIllegalState(IllegalStateException e) {
        log.warn("Invalid state: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "Invalid State", e.getMessage(), null);
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ApiError> handleDataIntegrity(DataIntegrityViolationException e) {
        log.warn("Concurrent write rejected by constraint: {}", e.getMostSpecificCause().getMessage());
        return respond(HttpStatus.CONFLICT, "Conflict", "The request conflicts with a concurrent change; retry it", null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "An unexpected error occurred", null);
    }

    private static ResponseEntity<ApiError> respond(HttpStatus status, String error, String message,
                                                    Map<String, String> details) {
        ApiError body = ApiError.builder()
            .error(error)
            .message(message)
            .details(details)
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(status).body(body);
    }
}
