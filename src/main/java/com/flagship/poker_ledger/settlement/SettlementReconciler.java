package com.flagship.poker_ledger.settlement;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Overlays stored settlement records onto a freshly computed plan.
 *
 * A record only counts while the plan still contains the same ordered pair
 * for an amount within 0.01. Anything else is orphaned: it was written
 * against an older transaction set and must not be shown as paid.
 */
@Slf4j
public final class SettlementReconciler {

    private SettlementReconciler() {
    }

    public static SettlementOverview reconcile(UUID gameId, List<SettlementTransfer> plan,
                                               List<SettlementRecord> records) {
        List<SettlementOverview.Line> lines = new ArrayList<>(plan.size());
        for (SettlementTransfer transfer : plan) {
            SettlementStatus status = records.stream()
                .filter(record -> record.matches(transfer))
                .findFirst()
                .map(SettlementStatus::of)
                .orElse(SettlementStatus.unsettled());
            lines.add(new SettlementOverview.Line(transfer, status));
        }

        List<SettlementRecord> orphaned = findOrphaned(plan, records);
        for (SettlementRecord record : orphaned) {
            log.warn("Orphaned settlement record: gameId={}, from={}, to={}, amount={}, method={}",
                gameId, record.getFromUserId(), record.getToUserId(),
                record.getAmount(), record.getPaymentMethod());
        }
        return new SettlementOverview(gameId, List.copyOf(lines), orphaned);
    }

    public static List<SettlementRecord> findOrphaned(List<SettlementTransfer> plan,
                                                      List<SettlementRecord> records) {
        return records.stream()
            .filter(record -> plan.stream().noneMatch(record::matches))
            .toList();
    }

    /**
     * @throws InconsistentSettlementStateException if any record is orphaned
     */
    public static void verify(UUID gameId, List<SettlementTransfer> plan, List<SettlementRecord> records) {
        List<SettlementRecord> orphaned = findOrphaned(plan, records);
        if (!orphaned.isEmpty()) {
            throw new InconsistentSettlementStateException(gameId, orphaned);
        }
    }
}
