package com.flagship.poker_ledger.settlement;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.poker_ledger.settlement.dto.MarkSettledRequest;
import com.flagship.poker_ledger.settlement.dto.SettlementOverviewResponse;
import com.flagship.poker_ledger.settlement.dto.SettlementRecordResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/games/{gameId}/settlements")
@RequiredArgsConstructor
public class SettlementController {

    private final GameSettlementService settlementService;

    @GetMapping
    public ResponseEntity<SettlementOverviewResponse> getOverview(@PathVariable("gameId") UUID gameId) {
        return ResponseEntity.ok(SettlementOverviewResponse.from(settlementService.getOverview(gameId)));
    }

    /**
     * Idempotent: marking the same pair again overwrites method and time.
     */
    @PutMapping("/{fromUserId}/{toUserId}")
    public ResponseEntity<SettlementRecordResponse> markSettled(@PathVariable("gameId") UUID gameId,
                                                                @PathVariable("fromUserId") UUID fromUserId,
                                                                @PathVariable("toUserId") UUID toUserId,
                                                                @Valid @RequestBody MarkSettledRequest request) {
        SettlementRecord record = settlementService.markSettled(
            gameId, fromUserId, toUserId, PaymentMethod.parse(request.getPaymentMethod()));
        return ResponseEntity.ok(SettlementRecordResponse.from(record));
    }

    @DeleteMapping("/{fromUserId}/{toUserId}")
    public ResponseEntity<Void> reset(@PathVariable("gameId") UUID gameId,
                                      @PathVariable("fromUserId") UUID fromUserId,
                                      @PathVariable("toUserId") UUID toUserId) {
        settlementService.reset(gameId, fromUserId, toUserId);
        return ResponseEntity.noContent().build();
    }

    /**
     * 200 when every stored record matches the current plan, 409 otherwise.
     */
    @GetMapping("/consistency")
    public ResponseEntity<ConsistencyResponse> verifyConsistency(@PathVariable("gameId") UUID gameId) {
        settlementService.verifyConsistency(gameId);
        return ResponseEntity.ok(new ConsistencyResponse(gameId, true));
    }

    @Value
    public static class ConsistencyResponse {
        @JsonProperty("game_id")
        UUID gameId;

        @JsonProperty("consistent")
        boolean consistent;
    }
}
