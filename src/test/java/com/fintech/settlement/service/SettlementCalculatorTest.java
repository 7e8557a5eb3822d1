package com.fintech.settlement.service;

import com.fintech.settlement.dto.RecipientCommission;
import com.fintech.settlement.dto.SettlementTotals;
import com.fintech.settlement.entity.Member;
import com.fintech.settlement.entity.Payment;
import com.fintech.settlement.entity.PaymentStatus;
import com.fintech.settlement.exception.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for SettlementCalculator, run against in-memory ledger and directory.
 */
class SettlementCalculatorTest {

    private static final LocalDate DATE = LocalDate.of(2024, 3, 1);

    private final SettlementCalculator calculator = new SettlementCalculator();
    private InMemoryLedger ledger;
    private InMemoryDirectory directory;

    private Member delegate;
    private Member coordinator;

    @BeforeEach
    void setUp() {
        ledger = new InMemoryLedger();
        directory = new InMemoryDirectory();
        delegate = directory.add(member("Jane", "Delegate", "+254700000001", null, null));
        coordinator = directory.add(member("John", "Coordinator", "+254700000002", null, null));
    }

    @Test
    @DisplayName("Should aggregate the day's payments into totals and breakdowns")
    void shouldAggregateWorkedExample() {
        // Given: two payers assigned to the same delegate and coordinator
        Member payerA = directory.add(member("Payer", "A", "+254711000001", delegate.getId(), coordinator.getId()));
        Member payerB = directory.add(member("Payer", "B", "+254711000002", delegate.getId(), coordinator.getId()));
        ledger.add(payment(payerA, "600", "72", "24", "12"));
        ledger.add(payment(payerB, "400", "48", "16", "8"));

        // When
        SettlementTotals totals = calculator.calculate(DATE, ledger, directory);

        // Then
        assertThat(totals.getTotalCollected()).isEqualByComparingTo("1000");
        assertThat(totals.getShaAmount()).isEqualByComparingTo("120");
        assertThat(totals.getMwuAmount()).isEqualByComparingTo("820");
        assertThat(totals.getTotalDelegateCommissions()).isEqualByComparingTo("40");
        assertThat(totals.getTotalCoordinatorCommissions()).isEqualByComparingTo("20");
        assertThat(totals.getTotalPayments()).isEqualTo(2);
        assertThat(totals.getUniqueMembers()).isEqualTo(2);

        assertThat(totals.getDelegateBreakdown()).hasSize(1);
        RecipientCommission delegateShare = totals.getDelegateBreakdown().get(0);
        assertThat(delegateShare.getRecipientId()).isEqualTo(delegate.getId());
        assertThat(delegateShare.getTotalCommission()).isEqualByComparingTo("40");
        assertThat(delegateShare.getPaymentCount()).isEqualTo(2);
        assertThat(delegateShare.getName()).isEqualTo("Jane Delegate");
        assertThat(delegateShare.getPhoneNumber()).isEqualTo("+254700000001");

        assertThat(totals.getCoordinatorBreakdown()).hasSize(1);
        assertThat(totals.getCoordinatorBreakdown().get(0).getTotalCommission()).isEqualByComparingTo("20");
    }

    @Test
    @DisplayName("Totals should always reconcile with the amount collected")
    void totalsShouldReconcile() {
        Member payer = directory.add(member("Payer", "C", null, delegate.getId(), coordinator.getId()));
        ledger.add(payment(payer, "333.33", "39.99", "13.33", "6.67"));
        ledger.add(payment(payer, "150.10", "18.01", "6.00", "3.00"));
        ledger.add(payment(payer, "0.01", null, null, null));

        SettlementTotals totals = calculator.calculate(DATE, ledger, directory);

        BigDecimal parts = totals.getShaAmount()
                .add(totals.getMwuAmount())
                .add(totals.getTotalDelegateCommissions())
                .add(totals.getTotalCoordinatorCommissions());
        assertThat(parts).isEqualByComparingTo(totals.getTotalCollected());
        assertThat(totals.getUniqueMembers()).isEqualTo(1);
        assertThat(totals.getTotalPayments()).isEqualTo(3);

        BigDecimal delegateSum = totals.getDelegateBreakdown().stream()
                .map(RecipientCommission::getTotalCommission)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        assertThat(delegateSum).isEqualByComparingTo(totals.getTotalDelegateCommissions());
    }

    @Test
    @DisplayName("Should produce zero totals and empty breakdowns for a day without payments")
    void shouldHandleDayWithoutPayments() {
        SettlementTotals totals = calculator.calculate(DATE, ledger, directory);

        assertThat(totals.getTotalCollected()).isEqualByComparingTo("0");
        assertThat(totals.getMwuAmount()).isEqualByComparingTo("0");
        assertThat(totals.getTotalPayments()).isZero();
        assertThat(totals.getUniqueMembers()).isZero();
        assertThat(totals.getDelegateBreakdown()).isEmpty();
        assertThat(totals.getCoordinatorBreakdown()).isEmpty();
    }

    @Test
    @DisplayName("Should credit the recipient recorded on the payment over the current assignment")
    void shouldPreferRecordedRecipient() {
        Member formerDelegate = directory.add(member("Former", "Delegate", "+254700000009", null, null));
        Member payer = directory.add(member("Payer", "D", null, delegate.getId(), coordinator.getId()));
        Payment payment = payment(payer, "100", "12", "4", "2");
        payment.setCommissionDelegateId(formerDelegate.getId());
        ledger.add(payment);
        ledger.add(payment(payer, "100", "12", "4", "2"));

        SettlementTotals totals = calculator.calculate(DATE, ledger, directory);

        assertThat(totals.getDelegateBreakdown())
                .extracting(RecipientCommission::getRecipientId)
                .containsExactlyInAnyOrder(formerDelegate.getId(), delegate.getId());
        assertThat(totals.getCoordinatorBreakdown()).hasSize(1);
        assertThat(totals.getCoordinatorBreakdown().get(0).getPaymentCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should report commission without a resolvable recipient as unattributed")
    void shouldReportUnattributedCommission() {
        Member orphan = directory.add(member("Payer", "E", null, null, coordinator.getId()));
        ledger.add(payment(orphan, "100", "12", "4", "2"));

        SettlementTotals totals = calculator.calculate(DATE, ledger, directory);

        assertThat(totals.getDelegateBreakdown()).isEmpty();
        assertThat(totals.getUnattributedDelegateCommission()).isEqualByComparingTo("4");
        assertThat(totals.getTotalDelegateCommissions()).isEqualByComparingTo("4");
        assertThat(totals.getUnattributedCoordinatorCommission()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("Should name a recipient missing from the directory as unknown")
    void shouldNameMissingRecipientUnknown() {
        UUID vanished = UUID.randomUUID();
        Member payer = directory.add(member("Payer", "F", null, vanished, coordinator.getId()));
        ledger.add(payment(payer, "100", "12", "4", "2"));

        SettlementTotals totals = calculator.calculate(DATE, ledger, directory);

        assertThat(totals.getDelegateBreakdown()).hasSize(1);
        assertThat(totals.getDelegateBreakdown().get(0).getName()).isEqualTo(SettlementCalculator.UNKNOWN_RECIPIENT);
        assertThat(totals.getDelegateBreakdown().get(0).getPhoneNumber()).isNull();
    }

    @Test
    @DisplayName("Should reject a missing settlement date")
    void shouldRejectMissingDate() {
        assertThatThrownBy(() -> calculator.calculate(null, ledger, directory))
                .isInstanceOf(ValidationException.class);
    }

    private static Member member(String first, String last, String phone, UUID delegateId, UUID coordinatorId) {
        return Member.builder()
                .id(UUID.randomUUID())
                .firstName(first)
                .lastName(last)
                .phoneNumber(phone)
                .delegateId(delegateId)
                .coordinatorId(coordinatorId)
                .build();
    }

    private static Payment payment(Member payer, String amount, String sha, String delegateCommission,
                                   String coordinatorCommission) {
        return Payment.builder()
                .id(UUID.randomUUID())
                .userId(payer.getId())
                .amount(new BigDecimal(amount))
                .shaPortion(sha == null ? null : new BigDecimal(sha))
                .delegateCommission(delegateCommission == null ? null : new BigDecimal(delegateCommission))
                .coordinatorCommission(coordinatorCommission == null ? null : new BigDecimal(coordinatorCommission))
                .status(PaymentStatus.COMPLETED)
                .settlementDate(DATE)
                .build();
    }

    private static class InMemoryLedger implements PaymentLedger {
        private final List<Payment> payments = new ArrayList<>();

        void add(Payment payment) {
            payments.add(payment);
        }

        @Override
        public List<Payment> findCompletedPayments(LocalDate settlementDate) {
            List<Payment> result = new ArrayList<>();
            for (Payment payment : payments) {
                if (payment.getStatus() == PaymentStatus.COMPLETED && settlementDate.equals(payment.getSettlementDate())) {
                    result.add(payment);
                }
            }
            return result;
        }

        @Override
        public long countCompletedPayments(LocalDate settlementDate) {
            return findCompletedPayments(settlementDate).size();
        }
    }

    private static class InMemoryDirectory implements RecipientDirectory {
        private final Map<UUID, Member> members = new HashMap<>();

        Member add(Member member) {
            members.put(member.getId(), member);
            return member;
        }

        @Override
        public Optional<Member> findMember(UUID memberId) {
            return Optional.ofNullable(members.get(memberId));
        }

        @Override
        public Map<UUID, Member> findMembers(Collection<UUID> memberIds) {
            Map<UUID, Member> found = new HashMap<>();
            for (UUID id : memberIds) {
                if (members.containsKey(id)) {
                    found.put(id, members.get(id));
                }
            }
            return found;
        }
    }
}
