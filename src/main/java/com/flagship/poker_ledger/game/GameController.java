package com.flagship.poker_ledger.game;

import com.flagship.poker_ledger.game.dto.AddParticipantRequest;
import com.flagship.poker_ledger.game.dto.CreateGameRequest;
import com.flagship.poker_ledger.game.dto.GameResponse;
import com.flagship.poker_ledger.ledger.dto.BalancesResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Locale;
import java.util.UUID;

@RestController
@RequestMapping("/api/games")
@RequiredArgsConstructor
@Slf4j
public class GameController {

    private final GameService gameService;

    @PostMapping
    public ResponseEntity<GameResponse> createGame(@Valid @RequestBody CreateGameRequest request) {
        CurrencyCode currency;
        try {
            currency = CurrencyCode.valueOf(request.getCurrency().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid currency code: " + request.getCurrency());
        }
        log.info("Received game creation request: name={}, currency={}, buyin={}",
            request.getName(), currency, request.getBuyinAmount());
        Game game = gameService.createGame(request.getName(), currency,
            request.getBuyinAmount(), request.getParticipants());
        return ResponseEntity.status(HttpStatus.CREATED).body(GameResponse.from(game));
    }

    @GetMapping("/{id}")
    public ResponseEntity<GameResponse> getGame(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(GameResponse.from(gameService.getGame(id)));
    }

    @PostMapping("/{id}/participants")
    public ResponseEntity<GameResponse> addParticipant(@PathVariable("id") UUID id,
                                                       @Valid @RequestBody AddParticipantRequest request) {
        return ResponseEntity.ok(GameResponse.from(gameService.addParticipant(id, request.getUserId())));
    }

    @PostMapping("/{id}/start")
    public ResponseEntity<GameResponse> startGame(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(GameResponse.from(gameService.startGame(id)));
    }

    /**
     * Responds 422 with the discrepancy when the books do not balance.
     */
    @PostMapping("/{id}/complete")
    public ResponseEntity<GameResponse> completeGame(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(GameResponse.from(gameService.completeGame(id)));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<GameResponse> cancelGame(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(GameResponse.from(gameService.cancelGame(id)));
    }

    @GetMapping("/{id}/balances")
    public ResponseEntity<BalancesResponse> getBalances(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(BalancesResponse.from(gameService.getLedger(id)));
    }
}
