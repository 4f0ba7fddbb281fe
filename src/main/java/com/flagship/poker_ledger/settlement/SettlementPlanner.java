package com.flagship.poker_ledger.settlement;

import com.flagship.poker_ledger.ledger.Money;
import com.flagship.poker_ledger.ledger.PlayerBalance;
import lombok.Value;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Greedy debt simplification.
 *
 * Debtors are walked largest debt first and creditors largest credit first,
 * ties broken by ascending userId. At each step the smaller of the two
 * remainders is transferred, and any party left with less than 0.01 is
 * advanced past.
 *
 * The output is valid and holds at most (debtors + creditors - 1) transfers.
 * It is not guaranteed to be the global minimum.
 * The planner keeps no state; re-run it whenever the transactions change.
 */
public final class SettlementPlanner {

    private static final Comparator<Party> LARGEST_FIRST =
        Comparator.comparing(Party::getMagnitude).reversed().thenComparing(Party::getUserId);

    private SettlementPlanner() {
    }

    public static List<SettlementTransfer> planSettlement(Map<UUID, PlayerBalance> balances) {
        Map<UUID, BigDecimal> nets = new LinkedHashMap<>();
        balances.forEach((userId, balance) -> nets.put(userId, balance.getNet()));
        return planFromNets(nets);
    }

    /**
     * @param nets userId -> net (cash-out minus buy-in); negative owes, positive is owed
     */
    public static List<SettlementTransfer> planFromNets(Map<UUID, BigDecimal> nets) {
        List<Party> debtors = new ArrayList<>();
        List<Party> creditors = new ArrayList<>();

        for (Map.Entry<UUID, BigDecimal> entry : nets.entrySet()) {
            BigDecimal net = Money.normalize(entry.getValue());
            if (Money.isNegligible(net)) {
                continue;
            }
            if (net.signum() < 0) {
                debtors.add(new Party(entry.getKey(), net.negate()));
            } else {
                creditors.add(new Party(entry.getKey(), net));
            }
        }

        if (debtors.isEmpty() || creditors.isEmpty()) {
            return List.of();
        }

        debtors.sort(LARGEST_FIRST);
        creditors.sort(LARGEST_FIRST);

        List<SettlementTransfer> transfers = new ArrayList<>();
        int d = 0;
        int c = 0;
        BigDecimal debtLeft = debtors.get(0).getMagnitude();
        BigDecimal creditLeft = creditors.get(0).getMagnitude();

        while (d < debtors.size() && c < creditors.size()) {
            BigDecimal amount = debtLeft.min(creditLeft);
            if (amount.signum() > 0) {
                transfers.add(new SettlementTransfer(
                    debtors.get(d).getUserId(), creditors.get(c).getUserId(), amount));
            }

            debtLeft = debtLeft.subtract(amount);
            creditLeft = creditLeft.subtract(amount);

            if (debtLeft.compareTo(Money.EPSILON) < 0) {
                d++;
                if (d < debtors.size()) {
                    debtLeft = debtors.get(d).getMagnitude();
                }
            }
            if (creditLeft.compareTo(Money.EPSILON) < 0) {
                c++;
                if (c < creditors.size()) {
                    creditLeft = creditors.get(c).getMagnitude();
                }
            }
        }
        return List.copyOf(transfers);
    }

    /**
     * A debtor's debt or a creditor's credit; magnitude is always positive.
     */
    @Value
    private static class Party {
        UUID userId;
        BigDecimal magnitude;
    }
}
