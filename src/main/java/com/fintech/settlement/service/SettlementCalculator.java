package com.fintech.settlement.service;

import com.fintech.settlement.dto.RecipientCommission;
import com.fintech.settlement.dto.SettlementTotals;
import com.fintech.settlement.entity.Member;
import com.fintech.settlement.entity.Payment;
import com.fintech.settlement.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.Function;

/**
 * Aggregates one day's completed payments into settlement totals and per-recipient
 * commission breakdowns.
 * <p>
 * All sums are exact BigDecimal additions; missing portions count as zero. The MWU share
 * is the residual, so the totals reconcile by construction.
 * <p>
 * A payment's commission goes to the recipient recorded on the payment when present,
 * otherwise to the payer's currently assigned delegate or coordinator. Commission for
 * which neither resolves is reported as unattributed.
 */
@Component
@Slf4j
public class SettlementCalculator {

    static final String UNKNOWN_RECIPIENT = "Unknown";

    public SettlementTotals calculate(LocalDate settlementDate, PaymentLedger ledger, RecipientDirectory directory) {
        if (settlementDate == null) {
            throw new ValidationException("Settlement date is required");
        }

        List<Payment> payments = ledger.findCompletedPayments(settlementDate);

        BigDecimal totalCollected = BigDecimal.ZERO;
        BigDecimal shaAmount = BigDecimal.ZERO;
        BigDecimal delegateTotal = BigDecimal.ZERO;
        BigDecimal coordinatorTotal = BigDecimal.ZERO;
        Set<UUID> payers = new HashSet<>();

        for (Payment payment : payments) {
            totalCollected = totalCollected.add(orZero(payment.getAmount()));
            shaAmount = shaAmount.add(orZero(payment.getShaPortion()));
            delegateTotal = delegateTotal.add(orZero(payment.getDelegateCommission()));
            coordinatorTotal = coordinatorTotal.add(orZero(payment.getCoordinatorCommission()));
            payers.add(payment.getUserId());
        }

        BigDecimal mwuAmount = totalCollected.subtract(shaAmount).subtract(delegateTotal).subtract(coordinatorTotal);

        Map<UUID, Member> payerRecords = directory.findMembers(payersWithoutOverride(payments));

        Tally delegates = tally(payments, payerRecords,
                Payment::getCommissionDelegateId, Member::getDelegateId, Payment::getDelegateCommission);
        Tally coordinators = tally(payments, payerRecords,
                Payment::getCommissionCoordinatorId, Member::getCoordinatorId, Payment::getCoordinatorCommission);

        if (delegates.unattributed.signum() != 0 || coordinators.unattributed.signum() != 0) {
            log.warn("Settlement {} has unattributed commission: delegate={}, coordinator={}",
                    settlementDate, delegates.unattributed, coordinators.unattributed);
        }

        Set<UUID> recipientIds = new HashSet<>(delegates.amounts.keySet());
        recipientIds.addAll(coordinators.amounts.keySet());
        Map<UUID, Member> recipients = directory.findMembers(recipientIds);

        SettlementTotals totals = SettlementTotals.builder()
                .settlementDate(settlementDate)
                .totalCollected(totalCollected)
                .shaAmount(shaAmount)
                .mwuAmount(mwuAmount)
                .totalDelegateCommissions(delegateTotal)
                .totalCoordinatorCommissions(coordinatorTotal)
                .totalPayments(payments.size())
                .uniqueMembers(payers.size())
                .unattributedDelegateCommission(delegates.unattributed)
                .unattributedCoordinatorCommission(coordinators.unattributed)
                .delegateBreakdown(delegates.toBreakdown(recipients))
                .coordinatorBreakdown(coordinators.toBreakdown(recipients))
                .build();

        log.debug("Calculated settlement for {}: collected={}, sha={}, mwu={}, delegates={}, coordinators={}",
                settlementDate, totalCollected, shaAmount, mwuAmount,
                totals.getDelegateBreakdown().size(), totals.getCoordinatorBreakdown().size());

        return totals;
    }

    private Set<UUID> payersWithoutOverride(List<Payment> payments) {
        Set<UUID> payerIds = new HashSet<>();
        for (Payment payment : payments) {
            if (payment.getCommissionDelegateId() == null || payment.getCommissionCoordinatorId() == null) {
                payerIds.add(payment.getUserId());
            }
        }
        return payerIds;
    }

    private Tally tally(List<Payment> payments,
                        Map<UUID, Member> payerRecords,
                        Function<Payment, UUID> overrideId,
                        Function<Member, UUID> assignedId,
                        Function<Payment, BigDecimal> commission) {
        Tally tally = new Tally();
        for (Payment payment : payments) {
            UUID recipientId = overrideId.apply(payment);
            if (recipientId == null) {
                Member payer = payerRecords.get(payment.getUserId());
                recipientId = payer == null ? null : assignedId.apply(payer);
            }

            BigDecimal amount = orZero(commission.apply(payment));
            if (recipientId == null) {
                tally.unattributed = tally.unattributed.add(amount);
                continue;
            }
            tally.amounts.merge(recipientId, amount, BigDecimal::add);
            tally.counts.merge(recipientId, 1, Integer::sum);
        }
        return tally;
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }

    private static final class Tally {
        // sorted by recipient id so the breakdown order is deterministic
        private final Map<UUID, BigDecimal> amounts = new TreeMap<>();
        private final Map<UUID, Integer> counts = new TreeMap<>();
        private BigDecimal unattributed = BigDecimal.ZERO;

        List<RecipientCommission> toBreakdown(Map<UUID, Member> recipients) {
            List<RecipientCommission> breakdown = new ArrayList<>();
            amounts.forEach((recipientId, amount) -> {
                if (amount.signum() <= 0) {
                    return;
                }
                Member recipient = recipients.get(recipientId);
                breakdown.add(RecipientCommission.builder()
                        .recipientId(recipientId)
                        .name(recipient == null ? UNKNOWN_RECIPIENT : recipient.getFullName())
                        .phoneNumber(recipient == null ? null : recipient.getPhoneNumber())
                        .email(recipient == null ? null : recipient.getEmail())
                        .totalCommission(amount)
                        .paymentCount(counts.get(recipientId))
                        .build());
            });
            breakdown.sort(Comparator.comparing(RecipientCommission::getRecipientId));
            return breakdown;
        }
    }
}
