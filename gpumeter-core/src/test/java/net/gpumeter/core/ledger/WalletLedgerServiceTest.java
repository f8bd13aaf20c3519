package net.gpumeter.core.ledger;

import net.gpumeter.core.error.InsufficientFundsException;
import net.gpumeter.core.error.LedgerCorruptionException;
import net.gpumeter.core.error.WalletFrozenException;
import net.gpumeter.core.error.WalletNotFoundException;
import net.gpumeter.core.model.DebitOutcome;
import net.gpumeter.core.model.LedgerTransaction;
import net.gpumeter.core.model.Money;
import net.gpumeter.core.model.ReservationToken;
import net.gpumeter.core.model.WalletBalance;
import net.gpumeter.core.support.InMemoryStore;
import net.gpumeter.core.support.LockingTxRunner;
import net.gpumeter.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static net.gpumeter.core.model.LedgerTransaction.Type.DEBIT;
import static net.gpumeter.core.model.LedgerTransaction.Type.RELEASE;
import static org.junit.jupiter.api.Assertions.*;

/**
 * WalletLedgerService 단위 테스트 (인메모리 저장소)
 * - 틱 단위 멱등, 예약 kill margin, 환불 상한, reconcile 동결
 */
class WalletLedgerServiceTest {

    private MutableClock clock;
    private InMemoryStore store;
    private WalletLedgerService ledger;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-01-01T00:00:00Z");
        store = new InMemoryStore(clock);
        ledger = new WalletLedgerService(store.wallets(), store.ledger(), store.reservations(), new LockingTxRunner(store), clock);
    }

    private static BigDecimal m(String s) { return Money.of(s); }

    @Test
    void openWallet_is_idempotent_and_starts_at_zero() throws Exception {
        var first = ledger.openWallet("alice");
        var second = ledger.openWallet("alice");

        assertEquals(Money.ZERO, first.balance());
        assertEquals(Money.ZERO, first.reserved());
        assertEquals(first.createdAt(), second.createdAt());
        assertTrue(store.allTransactions().isEmpty());
    }

    @Test
    void balance_of_unknown_user_fails() {
        assertThrows(WalletNotFoundException.class, () -> ledger.balance("nobody"));
    }

    @Test
    void credit_is_idempotent_per_payment_reference() throws Exception {
        assertEquals(m("10.00"), ledger.credit("alice", m("10.00"), "pay-1"));
        assertEquals(m("10.00"), ledger.credit("alice", m("10.00"), "pay-1"));
        assertEquals(m("15.50"), ledger.credit("alice", m("5.50"), "pay-2"));

        assertEquals(2, store.allTransactions().size());
        assertThrows(IllegalArgumentException.class, () -> ledger.credit("bob", m("1.00"), "pay-1"));
    }

    @Test
    void amounts_must_be_positive_with_two_decimals() throws Exception {
        ledger.openWallet("alice");
        assertThrows(IllegalArgumentException.class, () -> ledger.credit("alice", new BigDecimal("-1"), "x"));
        assertThrows(IllegalArgumentException.class, () -> ledger.credit("alice", BigDecimal.ZERO, "x"));
        assertThrows(IllegalArgumentException.class, () -> ledger.credit("alice", new BigDecimal("1.005"), "x"));
        assertThrows(IllegalArgumentException.class, () -> ledger.debit("alice", new BigDecimal("0.001"), "job", 1));
    }

    @Test
    void reserve_moves_available_into_reserved() throws Exception {
        ledger.credit("alice", m("5.00"), "pay-1");
        ReservationToken token = ledger.reserve("alice", m("2.00"), "job-1");

        WalletBalance b = ledger.balance("alice");
        assertEquals(m("5.00"), b.balance());
        assertEquals(m("2.00"), b.reserved());
        assertEquals(m("3.00"), b.available());
        assertEquals(m("2.00"), token.amount());
    }

    @Test
    void reserve_beyond_available_throws_and_changes_nothing() throws Exception {
        ledger.credit("alice", m("1.00"), "pay-1");

        var ex = assertThrows(InsufficientFundsException.class, () -> ledger.reserve("alice", m("2.00"), "job-1"));
        assertEquals(m("1.00"), ex.getShortfall());
        assertEquals(m("0.00"), ledger.balance("alice").reserved());
        assertEquals(1, store.allTransactions().size());
    }

    @Test
    void replayed_tick_is_charged_once() throws Exception {
        ledger.credit("alice", m("5.00"), "pay-1");

        DebitOutcome first = ledger.debit("alice", m("1.00"), "job-1", 1);
        DebitOutcome again = ledger.debit("alice", m("1.00"), "job-1", 1);

        assertEquals(DebitOutcome.Status.APPLIED, first.status());
        assertEquals(DebitOutcome.Status.DUPLICATE, again.status());
        assertEquals(first.transactionId(), again.transactionId());
        assertEquals(1, store.transactionsOf("job-1", DEBIT).size());
        assertEquals(m("4.00"), ledger.balance("alice").balance());
    }

    @Test
    void insufficient_funds_is_an_outcome_not_an_error() throws Exception {
        ledger.credit("alice", m("0.50"), "pay-1");

        DebitOutcome out = ledger.debit("alice", m("1.00"), "job-1", 1);

        assertEquals(DebitOutcome.Status.INSUFFICIENT_FUNDS, out.status());
        assertFalse(out.charged());
        assertEquals(m("0.50"), ledger.balance("alice").balance());
        assertTrue(store.transactionsOf("job-1", DEBIT).isEmpty());
    }

    /** 예약 2.00, 1틱(1.00) 후 종료 → debit 1건, release 1건(1.00) */
    @Test
    void unused_reservation_is_returned_on_release() throws Exception {
        ledger.credit("alice", m("5.00"), "pay-1");
        ReservationToken token = ledger.reserve("alice", m("2.00"), "job-1");

        ledger.debit("alice", m("1.00"), "job-1", 1);
        BigDecimal released = ledger.release(token);

        assertEquals(m("1.00"), released);
        assertEquals(1, store.transactionsOf("job-1", DEBIT).size());
        assertEquals(1, store.transactionsOf("job-1", RELEASE).size());
        assertEquals(m("1.00"), store.transactionsOf("job-1", RELEASE).get(0).amount());

        WalletBalance b = ledger.balance("alice");
        assertEquals(m("4.00"), b.balance());
        assertEquals(m("0.00"), b.reserved());
    }

    @Test
    void release_is_idempotent() throws Exception {
        ledger.credit("alice", m("5.00"), "pay-1");
        ReservationToken token = ledger.reserve("alice", m("2.00"), "job-1");

        assertEquals(m("2.00"), ledger.release(token));
        assertEquals(Money.ZERO, ledger.release(token));
        assertEquals(m("5.00"), ledger.balance("alice").available());
    }

    /** 마지막 1회분 예약은 남겨 두고, 그 이상은 가용 잔액에서 */
    @Test
    void last_debit_sized_slice_of_reservation_is_held() throws Exception {
        ledger.credit("alice", m("3.00"), "pay-1");
        ledger.reserve("alice", m("1.00"), "job-1");

        ledger.debit("alice", m("1.00"), "job-1", 1);
        ledger.debit("alice", m("1.00"), "job-1", 2);
        DebitOutcome third = ledger.debit("alice", m("1.00"), "job-1", 3);

        assertEquals(DebitOutcome.Status.INSUFFICIENT_FUNDS, third.status());
        WalletBalance b = ledger.balance("alice");
        assertEquals(m("1.00"), b.balance());
        assertEquals(m("1.00"), b.reserved());
    }

    @Test
    void refund_is_capped_by_net_debits_of_the_job() throws Exception {
        ledger.credit("alice", m("5.00"), "pay-1");
        ledger.debit("alice", m("1.00"), "job-1", 1);
        ledger.debit("alice", m("1.00"), "job-1", 2);

        assertEquals(m("4.50"), ledger.refund("alice", m("1.50"), "job-1", "gpu fault"));
        assertThrows(IllegalArgumentException.class, () -> ledger.refund("alice", m("0.60"), "job-1", "again"));
        assertEquals(m("5.00"), ledger.refund("alice", m("0.50"), "job-1", "rest"));
    }

    @Test
    void transactions_are_paged_newest_first() throws Exception {
        for (int i = 1; i <= 5; i++) ledger.credit("alice", m(i + ".00"), "pay-" + i);

        List<LedgerTransaction> page0 = ledger.transactions("alice", 0, 2);
        List<LedgerTransaction> page2 = ledger.transactions("alice", 2, 2);

        assertEquals(List.of("pay-5", "pay-4"), page0.stream().map(LedgerTransaction::externalRef).toList());
        assertEquals(List.of("pay-1"), page2.stream().map(LedgerTransaction::externalRef).toList());
        assertThrows(IllegalArgumentException.class, () -> ledger.transactions("alice", 0, 0));
    }

    @Test
    void reconcile_passes_on_a_consistent_ledger() throws Exception {
        ledger.credit("alice", m("5.00"), "pay-1");
        ReservationToken t = ledger.reserve("alice", m("2.00"), "job-1");
        ledger.debit("alice", m("1.00"), "job-1", 1);
        ledger.release(t);

        assertEquals(m("4.00"), ledger.reconcile("alice").balance());
    }

    @Test
    void reconcile_mismatch_freezes_the_wallet() throws Exception {
        ledger.credit("alice", m("5.00"), "pay-1");
        store.tamperBalance("alice", m("7.00"));

        assertThrows(LedgerCorruptionException.class, () -> ledger.reconcile("alice"));
        assertTrue(store.wallets().findByUser("alice").orElseThrow().frozen());
        assertThrows(WalletFrozenException.class, () -> ledger.credit("alice", m("1.00"), "pay-2"));
        assertThrows(WalletFrozenException.class, () -> ledger.debit("alice", m("1.00"), "job-1", 1));
    }

    /** 임의 연산 순서에서도 balance >= 0, 0 <= reserved <= balance, 원장 재생 일치 */
    @Test
    void balance_never_goes_negative_under_random_operations() throws Exception {
        Random rnd = new Random(42);
        List<ReservationToken> tokens = new ArrayList<>();
        long[] ticks = new long[5];
        ledger.openWallet("alice");

        for (int i = 0; i < 500; i++) {
            int job = rnd.nextInt(5);
            BigDecimal amount = BigDecimal.valueOf(1 + rnd.nextInt(300), 2);
            switch (rnd.nextInt(4)) {
                case 0 -> ledger.credit("alice", amount, "pay-" + i);
                case 1 -> {
                    try {
                        tokens.add(ledger.reserve("alice", amount, "job-" + i));
                    } catch (InsufficientFundsException expected) {
                        // 부족하면 거절
                    }
                }
                case 2 -> ledger.debit("alice", amount, "job-" + job, ++ticks[job]);
                default -> {
                    if (!tokens.isEmpty()) ledger.release(tokens.remove(rnd.nextInt(tokens.size())));
                }
            }
            WalletBalance b = ledger.balance("alice");
            assertTrue(b.balance().signum() >= 0, "balance went negative at step " + i);
            assertTrue(b.reserved().signum() >= 0 && b.reserved().compareTo(b.balance()) <= 0,
                    "reserved out of range at step " + i);
        }
        assertDoesNotThrow(() -> ledger.reconcile("alice"));
    }
}
