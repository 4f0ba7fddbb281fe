package com.flagship.poker_ledger.ledger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.poker_ledger.observability.CorrelationContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * HTTP surface for games and their transactions.
 *
 * These tests verify:
 * - The Idempotency-Key header is required
 * - Replaying a key returns the original transaction with 200
 * - Invalid input is rejected with 400
 * - An unbalanced completion answers 422 with the discrepancy
 * - The correlation id is echoed back
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class TransactionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private UUID alice;
    private UUID bob;
    private UUID gameId;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() throws Exception {
        alice = UUID.randomUUID();
        bob = UUID.randomUUID();

        Map<String, Object> game = new LinkedHashMap<>();
        game.put("name", "Thursday game");
        game.put("currency", "usd");
        game.put("buyin_amount", new BigDecimal("100.00"));
        game.put("participants", List.of(alice, bob));

        MvcResult created = mockMvc.perform(post("/api/games")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(game)))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.status").value("SCHEDULED"))
            .andExpect(jsonPath("$.currency").value("USD"))
            .andReturn();
        gameId = UUID.fromString(readJson(created).get("id").asText());

        mockMvc.perform(post("/api/games/{id}/start", gameId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("IN_PROGRESS"));
    }

    private JsonNode readJson(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    private String transactionBody(UUID userId, String type, String amount) throws Exception {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("user_id", userId);
        body.put("type", type);
        body.put("amount", new BigDecimal(amount));
        return objectMapper.writeValueAsString(body);
    }

    @Test
    @DisplayName("Recording without an Idempotency-Key is rejected")
    void testRecord_MissingIdempotencyKey() throws Exception {
        printTestHeader("Record - Missing Idempotency-Key");

        mockMvc.perform(post("/api/games/{gameId}/transactions", gameId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(transactionBody(alice, "CASHOUT", "50.00")))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Missing Required Header"));

        printSuccess("Missing header rejected with 400");
    }

    @Test
    @DisplayName("Same key twice returns the same transaction, created once")
    void testRecord_Idempotent() throws Exception {
        printTestHeader("Record - Idempotent Replay");

        String key = "tx-" + UUID.randomUUID();
        String body = transactionBody(alice, "cashout", "120.00");
        printInput("Idempotency-Key", key);

        MvcResult first = mockMvc.perform(post("/api/games/{gameId}/transactions", gameId)
                .header("Idempotency-Key", key)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.type").value("CASHOUT"))
            .andReturn();

        MvcResult second = mockMvc.perform(post("/api/games/{gameId}/transactions", gameId)
                .header("Idempotency-Key", key)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isOk())
            .andReturn();

        String firstId = readJson(first).get("id").asText();
        String secondId = readJson(second).get("id").asText();
        printOutput("First ID", firstId);
        printOutput("Second ID", secondId);
        assertEquals(firstId, secondId);

        MvcResult list = mockMvc.perform(get("/api/games/{gameId}/transactions", gameId))
            .andExpect(status().isOk())
            .andReturn();
        // two initial buy-ins plus one cash-out
        assertEquals(3, readJson(list).size());

        printSuccess("Replay returned the original transaction");
    }

    @Test
    @DisplayName("Invalid amounts, types and players are rejected")
    void testRecord_Validation() throws Exception {
        printTestHeader("Record - Validation");

        mockMvc.perform(post("/api/games/{gameId}/transactions", gameId)
                .header("Idempotency-Key", "v-" + UUID.randomUUID())
                .contentType(MediaType.APPLICATION_JSON)
                .content(transactionBody(alice, "CASHOUT", "0.00")))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Validation Failed"));

        mockMvc.perform(post("/api/games/{gameId}/transactions", gameId)
                .header("Idempotency-Key", "v-" + UUID.randomUUID())
                .contentType(MediaType.APPLICATION_JSON)
                .content(transactionBody(alice, "REBUY", "10.00")))
            .andExpect(status().isBadRequest());

        mockMvc.perform(post("/api/games/{gameId}/transactions", gameId)
                .header("Idempotency-Key", "v-" + UUID.randomUUID())
                .contentType(MediaType.APPLICATION_JSON)
                .content(transactionBody(alice, "BUYIN", "10000.01")))
            .andExpect(status().isBadRequest());

        mockMvc.perform(post("/api/games/{gameId}/transactions", gameId)
                .header("Idempotency-Key", "v-" + UUID.randomUUID())
                .contentType(MediaType.APPLICATION_JSON)
                .content(transactionBody(UUID.randomUUID(), "BUYIN", "10.00")))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Invalid Request"));

        printSuccess("Invalid requests rejected with 400");
    }

    @Test
    @DisplayName("Amounts with more than two decimals are rejected on every endpoint")
    void testSubCentAmounts_Rejected() throws Exception {
        printTestHeader("Sub-cent Amounts Rejected");

        mockMvc.perform(post("/api/games/{gameId}/transactions", gameId)
                .header("Idempotency-Key", "p-" + UUID.randomUUID())
                .contentType(MediaType.APPLICATION_JSON)
                .content(transactionBody(alice, "CASHOUT", "150.005")))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Validation Failed"));

        MvcResult created = mockMvc.perform(post("/api/games/{gameId}/transactions", gameId)
                .header("Idempotency-Key", "p-" + UUID.randomUUID())
                .contentType(MediaType.APPLICATION_JSON)
                .content(transactionBody(bob, "CASHOUT", "50.00")))
            .andExpect(status().isCreated())
            .andReturn();
        String transactionId = readJson(created).get("id").asText();

        mockMvc.perform(put("/api/games/{gameId}/transactions/{id}", gameId, transactionId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\": 49.994}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Validation Failed"));

        mockMvc.perform(post("/api/games")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\": \"x\", \"currency\": \"USD\", \"buyin_amount\": 20.005}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Validation Failed"));

        MvcResult transactions = mockMvc.perform(get("/api/games/{gameId}/transactions", gameId))
            .andExpect(status().isOk())
            .andReturn();
        // two initial buy-ins plus bob's cash-out, unchanged
        assertEquals(3, readJson(transactions).size());
        for (JsonNode transaction : readJson(transactions)) {
            if (transactionId.equals(transaction.get("id").asText())) {
                printOutput("Stored amount", transaction.get("amount"));
                assertEquals(0, new BigDecimal("50.00").compareTo(transaction.get("amount").decimalValue()));
            }
        }

        printSuccess("Sub-cent amounts rejected with 400");
    }

    @Test
    @DisplayName("Correcting and deleting transactions")
    void testUpdateAndDelete() throws Exception {
        printTestHeader("Update and Delete");

        MvcResult created = mockMvc.perform(post("/api/games/{gameId}/transactions", gameId)
                .header("Idempotency-Key", "u-" + UUID.randomUUID())
                .contentType(MediaType.APPLICATION_JSON)
                .content(transactionBody(bob, "BUYIN", "50.00")))
            .andExpect(status().isCreated())
            .andReturn();
        String transactionId = readJson(created).get("id").asText();

        MvcResult updated = mockMvc.perform(put("/api/games/{gameId}/transactions/{id}", gameId, transactionId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\": 75.00, \"notes\": \"rebuy\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.notes").value("rebuy"))
            .andReturn();
        assertEquals(0, new BigDecimal("75.00").compareTo(readJson(updated).get("amount").decimalValue()));

        mockMvc.perform(delete("/api/games/{gameId}/transactions/{id}", gameId, transactionId))
            .andExpect(status().isNoContent());
        mockMvc.perform(delete("/api/games/{gameId}/transactions/{id}", gameId, transactionId))
            .andExpect(status().isNotFound());

        printSuccess("Transaction corrected then deleted");
    }

    @Test
    @DisplayName("Unbalanced completion answers 422 with the discrepancy")
    void testComplete_Unbalanced() throws Exception {
        printTestHeader("Complete - Unbalanced");

        mockMvc.perform(post("/api/games/{gameId}/transactions", gameId)
                .header("Idempotency-Key", "c-" + UUID.randomUUID())
                .contentType(MediaType.APPLICATION_JSON)
                .content(transactionBody(alice, "CASHOUT", "150.00")))
            .andExpect(status().isCreated());

        MvcResult balances = mockMvc.perform(get("/api/games/{id}/balances", gameId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.balanced").value(false))
            .andReturn();
        assertEquals(0, new BigDecimal("50.00").compareTo(readJson(balances).get("discrepancy").decimalValue()));

        MvcResult result = mockMvc.perform(post("/api/games/{id}/complete", gameId))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.error").value("Game Not Balanced"))
            .andReturn();
        JsonNode details = readJson(result).get("details");
        printOutput("Details", details);
        assertEquals(0, new BigDecimal("50.00").compareTo(new BigDecimal(details.get("discrepancy").asText())));

        mockMvc.perform(get("/api/games/{id}", gameId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("IN_PROGRESS"));

        printSuccess("Unbalanced completion refused with 422");
    }

    @Test
    @DisplayName("Unknown games answer 404; correlation id is echoed")
    void testUnknownGame_And_CorrelationId() throws Exception {
        printTestHeader("Unknown Game and Correlation ID");

        String correlationId = "corr-" + UUID.randomUUID();
        mockMvc.perform(get("/api/games/{gameId}/transactions", UUID.randomUUID())
                .header(CorrelationContext.CORRELATION_ID_HEADER, correlationId))
            .andExpect(status().isNotFound())
            .andExpect(header().string(CorrelationContext.CORRELATION_ID_HEADER, correlationId));

        mockMvc.perform(get("/api/games/{id}", "not-a-uuid"))
            .andExpect(status().isBadRequest());

        mockMvc.perform(post("/api/games")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\": \"x\", \"currency\": \"XYZ\", \"buyin_amount\": 10}"))
            .andExpect(status().isBadRequest());

        printSuccess("Errors mapped and correlation id echoed");
    }
}
