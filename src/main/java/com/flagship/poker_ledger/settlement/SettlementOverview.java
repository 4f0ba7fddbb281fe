package com.flagship.poker_ledger.settlement;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * The current plan with paid/unpaid status overlaid, plus any stored records
 * the plan no longer accounts for.
 */
@Value
public class SettlementOverview {

    public static final String NO_SETTLEMENTS_NEEDED = "No settlements needed";

    UUID gameId;
    List<Line> lines;
    List<SettlementRecord> orphaned;

    @Value
    public static class Line {
        SettlementTransfer transfer;
        SettlementStatus status;
    }

    public boolean isNoSettlementsNeeded() {
        return lines.isEmpty();
    }

    public boolean isAllSettled() {
        return lines.stream().allMatch(line -> line.getStatus().isSettled());
    }

    public boolean isConsistent() {
        return orphaned.isEmpty();
    }

    public BigDecimal getOutstandingAmount() {
        return lines.stream()
            .filter(line -> !line.getStatus().isSettled())
            .map(line -> line.getTransfer().getAmount())
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
