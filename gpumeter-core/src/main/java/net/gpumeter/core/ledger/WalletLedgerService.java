package net.gpumeter.core.ledger;

import net.gpumeter.core.error.InsufficientFundsException;
import net.gpumeter.core.error.LedgerCorruptionException;
import net.gpumeter.core.error.WalletFrozenException;
import net.gpumeter.core.error.WalletNotFoundException;
import net.gpumeter.core.model.DebitOutcome;
import net.gpumeter.core.model.LedgerTransaction;
import net.gpumeter.core.model.Money;
import net.gpumeter.core.model.Reservation;
import net.gpumeter.core.model.ReservationToken;
import net.gpumeter.core.model.Wallet;
import net.gpumeter.core.model.WalletBalance;
import net.gpumeter.core.spi.Clock;
import net.gpumeter.core.spi.LedgerRepository;
import net.gpumeter.core.spi.ReservationRepository;
import net.gpumeter.core.spi.TxRunner;
import net.gpumeter.core.spi.WalletRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static net.gpumeter.core.model.LedgerTransaction.Type.CREDIT;
import static net.gpumeter.core.model.LedgerTransaction.Type.DEBIT;
import static net.gpumeter.core.model.LedgerTransaction.Type.REFUND;
import static net.gpumeter.core.model.LedgerTransaction.Type.RELEASE;
import static net.gpumeter.core.model.LedgerTransaction.Type.RESERVATION;

/**
 * 지갑 원장. 모든 변경은 지갑 행 잠금(FOR UPDATE) 아래에서 수행되고 원장 레코드를 하나씩 남긴다.
 * 바깥 트랜잭션이 있으면 거기에 참여한다 (하트비트 과금은 잡 레코드 갱신과 같은 트랜잭션).
 */
public final class WalletLedgerService {
    private static final Logger log = LoggerFactory.getLogger(WalletLedgerService.class);

    public static final int MAX_PAGE_SIZE = 500;

    private final WalletRepository wallets;
    private final LedgerRepository ledger;
    private final ReservationRepository reservations;
    private final TxRunner tx;
    private final Clock clock;

    public WalletLedgerService(WalletRepository wallets,
                               LedgerRepository ledger,
                               ReservationRepository reservations,
                               TxRunner tx,
                               Clock clock) {
        this.wallets = wallets;
        this.ledger = ledger;
        this.reservations = reservations;
        this.tx = tx;
        this.clock = clock;
    }

    /** 멱등. 처음 보는 사용자는 잔액 0으로 생성 */
    public Wallet openWallet(String userId) throws Exception {
        requireUser(userId);
        return tx.required(() -> {
            if (wallets.insertIfAbsent(userId, clock.now())) {
                log.info("opened wallet for user {}", userId);
            }
            return wallets.findByUser(userId).orElseThrow(() -> new WalletNotFoundException(userId));
        });
    }

    /** available >= amount 확인 후 reserved 증가 + reservation 기록. 부족하면 InsufficientFundsException */
    public ReservationToken reserve(String userId, BigDecimal amount, String jobId) throws Exception {
        requireUser(userId);
        requireJob(jobId);
        BigDecimal amt = Money.requirePositive(amount);
        return tx.required(() -> {
            Wallet w = lockMutable(userId);
            if (reservations.findActiveByJob(jobId).isPresent()) {
                throw new IllegalStateException("job " + jobId + " already holds an active reservation");
            }
            if (w.available().compareTo(amt) < 0) {
                throw new InsufficientFundsException(userId, amt, w.available());
            }
            Instant now = clock.now();
            BigDecimal reserved = w.reserved().add(amt);
            wallets.update(userId, w.balance(), reserved, now);
            ledger.append(LedgerTransaction.ofNew(userId, jobId, RESERVATION, amt, w.balance(), reserved,
                    null, null, "reservation for job " + jobId, now));
            Reservation r = reservations.insert(new Reservation(null, userId, jobId, amt, amt,
                    Reservation.Status.ACTIVE, now, null));
            log.debug("reserved {} for job {} (user {})", amt, jobId, userId);
            return r.token();
        });
    }

    /**
     * 틱 과금. (jobId, tickSeq) 단위 멱등.
     * 예약분은 1회 과금액을 넘는 부분만 끌어 쓰고, 마지막 1회분은 release 때까지 남겨 둔다.
     * 나머지는 가용 잔액에서 차감. 부족하면 INSUFFICIENT_FUNDS 결과를 돌려준다.
     */
    public DebitOutcome debit(String userId, BigDecimal amount, String jobId, long tickSeq) throws Exception {
        requireUser(userId);
        requireJob(jobId);
        BigDecimal amt = Money.requirePositive(amount);
        if (tickSeq < 1) throw new IllegalArgumentException("tickSeq must be >= 1: " + tickSeq);

        return tx.required(() -> {
            Wallet w = lockMutable(userId);

            Optional<LedgerTransaction> prior = ledger.findDebit(jobId, tickSeq);
            if (prior.isPresent()) {
                if (!prior.get().userId().equals(userId)) {
                    throw new LedgerCorruptionException(userId,
                            "tick " + tickSeq + " of job " + jobId + " was billed to user " + prior.get().userId());
                }
                log.debug("duplicate debit job={} tick={}", jobId, tickSeq);
                return DebitOutcome.duplicate(prior.get());
            }

            Optional<Reservation> res = reservations.findActiveByJob(jobId);
            BigDecimal remaining = res.map(Reservation::remaining).orElse(Money.ZERO);
            BigDecimal drawable = remaining.subtract(amt).max(Money.ZERO);
            BigDecimal fromReservation = drawable.min(amt);
            BigDecimal fromAvailable = amt.subtract(fromReservation);

            if (w.available().compareTo(fromAvailable) < 0) {
                log.info("insufficient funds: user={} job={} tick={} amount={} available={}",
                        userId, jobId, tickSeq, amt, w.available());
                return DebitOutcome.insufficient(jobId, tickSeq, amt, w);
            }

            Instant now = clock.now();
            BigDecimal balance = w.balance().subtract(amt);
            BigDecimal reserved = w.reserved().subtract(fromReservation);
            wallets.update(userId, balance, reserved, now);
            if (fromReservation.signum() > 0) {
                reservations.updateRemaining(res.get().id(), remaining.subtract(fromReservation));
            }
            LedgerTransaction saved = ledger.append(LedgerTransaction.ofNew(userId, jobId, DEBIT, amt, balance, reserved,
                    tickSeq, null, "tick " + tickSeq + " of job " + jobId, now));
            return DebitOutcome.applied(saved);
        });
    }

    /** 남은 예약분을 가용 잔액으로 되돌림. 이미 해제된 토큰은 no-op (0 반환) */
    public BigDecimal release(ReservationToken token) throws Exception {
        return tx.required(() -> {
            Wallet w = lockMutable(token.userId());
            Reservation r = reservations.findById(token.reservationId())
                    .orElseThrow(() -> new IllegalArgumentException("unknown reservation " + token.reservationId()));
            if (r.status() != Reservation.Status.ACTIVE) return Money.ZERO;

            Instant now = clock.now();
            BigDecimal rem = r.remaining();
            BigDecimal reserved = w.reserved().subtract(rem);
            if (reserved.signum() < 0) {
                throw new LedgerCorruptionException(r.userId(),
                        "release of " + rem + " exceeds reserved " + w.reserved() + " for user " + r.userId());
            }
            reservations.markReleased(r.id(), now);
            if (rem.signum() > 0) {
                wallets.update(r.userId(), w.balance(), reserved, now);
                ledger.append(LedgerTransaction.ofNew(r.userId(), r.jobId(), RELEASE, rem, w.balance(), reserved,
                        null, null, "release for job " + r.jobId(), now));
            }
            log.debug("released {} of reservation {} (job {})", rem, r.id(), r.jobId());
            return rem;
        });
    }

    /** 잡의 활성 예약이 있으면 해제 */
    public BigDecimal releaseForJob(String jobId) throws Exception {
        return tx.required(() -> {
            Optional<Reservation> r = reservations.findActiveByJob(jobId);
            return r.isEmpty() ? Money.ZERO : release(r.get().token());
        });
    }

    /** 충전. externalRef 단위 멱등: 반복 요청은 최초 결과(잔액) 반환 */
    public BigDecimal credit(String userId, BigDecimal amount, String externalRef) throws Exception {
        requireUser(userId);
        BigDecimal amt = Money.requirePositive(amount);
        if (externalRef == null || externalRef.isBlank()) throw new IllegalArgumentException("externalRef is required");

        return tx.required(() -> {
            wallets.insertIfAbsent(userId, clock.now());
            Wallet w = lockMutable(userId);
            Optional<LedgerTransaction> prior = ledger.findCreditByRef(externalRef);
            if (prior.isPresent()) {
                if (!prior.get().userId().equals(userId)) {
                    throw new IllegalArgumentException("payment reference " + externalRef + " belongs to another user");
                }
                log.debug("duplicate credit ref={} user={}", externalRef, userId);
                return prior.get().balanceAfter();
            }
            Instant now = clock.now();
            BigDecimal balance = w.balance().add(amt);
            wallets.update(userId, balance, w.reserved(), now);
            ledger.append(LedgerTransaction.ofNew(userId, null, CREDIT, amt, balance, w.reserved(),
                    null, externalRef, "credit " + externalRef, now));
            log.info("credited {} to user {} (ref {}), balance={}", amt, userId, externalRef, balance);
            return balance;
        });
    }

    /** 시스템 오류 환불. 잡의 순 과금액(debit - refund)을 넘을 수 없다 */
    public BigDecimal refund(String userId, BigDecimal amount, String jobId, String reason) throws Exception {
        requireUser(userId);
        requireJob(jobId);
        BigDecimal amt = Money.requirePositive(amount);

        return tx.required(() -> {
            Wallet w = lockMutable(userId);
            BigDecimal net = ledger.sumByJob(jobId, DEBIT).subtract(ledger.sumByJob(jobId, REFUND));
            if (amt.compareTo(net) > 0) {
                throw new IllegalArgumentException("refund " + amt + " exceeds net debits " + net + " of job " + jobId);
            }
            Instant now = clock.now();
            BigDecimal balance = w.balance().add(amt);
            wallets.update(userId, balance, w.reserved(), now);
            ledger.append(LedgerTransaction.ofNew(userId, jobId, REFUND, amt, balance, w.reserved(),
                    null, null, reason == null ? "refund for job " + jobId : reason, now));
            log.info("refunded {} to user {} for job {}: {}", amt, userId, jobId, reason);
            return balance;
        });
    }

    public WalletBalance balance(String userId) throws Exception {
        requireUser(userId);
        return tx.required(() -> wallets.findByUser(userId)
                .map(Wallet::toBalance)
                .orElseThrow(() -> new WalletNotFoundException(userId)));
    }

    /** 최신순 거래 내역. page는 0부터 */
    public List<LedgerTransaction> transactions(String userId, int page, int pageSize) throws Exception {
        requireUser(userId);
        if (page < 0) throw new IllegalArgumentException("page must be >= 0");
        if (pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("pageSize must be between 1 and " + MAX_PAGE_SIZE);
        }
        return tx.required(() -> ledger.findByUser(userId, pageSize, page * pageSize));
    }

    /**
     * 원장 재생 결과와 지갑 투영 비교.
     * 불일치 시 ERROR 로그, 지갑 동결(별도 트랜잭션으로 커밋) 후 LedgerCorruptionException.
     */
    public WalletBalance reconcile(String userId) throws Exception {
        requireUser(userId);
        String mismatch = tx.requiresNew(() -> {
            Wallet w = wallets.lockByUser(userId).orElseThrow(() -> new WalletNotFoundException(userId));
            return findMismatch(w, ledger.findAllByUser(userId));
        });
        if (mismatch == null) return balance(userId);

        log.error("ledger corruption for user {}: {}; freezing wallet", userId, mismatch);
        tx.requiresNew(() -> { wallets.freeze(userId, clock.now()); return null; });
        throw new LedgerCorruptionException(userId, "ledger mismatch for user " + userId + ": " + mismatch);
    }

    private static String findMismatch(Wallet w, List<LedgerTransaction> txs) {
        BigDecimal replayed = Money.ZERO;
        LedgerTransaction last = null;
        for (LedgerTransaction t : txs) {
            if (t.type() == LedgerTransaction.Type.UNKNOWN) {
                return "transaction " + t.id() + " has an unknown type";
            }
            replayed = replayed.add(t.balanceEffect());
            if (replayed.compareTo(t.balanceAfter()) != 0) {
                return "transaction " + t.id() + " records balance " + t.balanceAfter() + " but replay gives " + replayed;
            }
            if (t.balanceAfter().signum() < 0 || t.reservedAfter().signum() < 0
                    || t.reservedAfter().compareTo(t.balanceAfter()) > 0) {
                return "transaction " + t.id() + " leaves an invalid wallet state";
            }
            last = t;
        }
        if (replayed.compareTo(w.balance()) != 0) {
            return "wallet balance " + w.balance() + " but replay gives " + replayed;
        }
        BigDecimal lastReserved = last == null ? Money.ZERO : last.reservedAfter();
        if (lastReserved.compareTo(w.reserved()) != 0) {
            return "wallet reserved " + w.reserved() + " but last transaction records " + lastReserved;
        }
        return null;
    }

    private Wallet lockMutable(String userId) throws Exception {
        Wallet w = wallets.lockByUser(userId).orElseThrow(() -> new WalletNotFoundException(userId));
        if (w.frozen()) throw new WalletFrozenException(userId);
        return w;
    }

    private static void requireUser(String userId) {
        if (userId == null || userId.isBlank()) throw new IllegalArgumentException("userId is required");
    }

    private static void requireJob(String jobId) {
        if (jobId == null || jobId.isBlank()) throw new IllegalArgumentException("jobId is required");
    }
}
