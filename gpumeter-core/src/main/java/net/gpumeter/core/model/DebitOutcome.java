package net.gpumeter.core.model;

import java.math.BigDecimal;

/** 틱 차감 결과. 잔액 부족은 예외가 아니라 결과값 */
public record DebitOutcome(
        Status status,
        String jobId,
        long tickSeq,
        BigDecimal amount,
        BigDecimal balanceAfter,
        BigDecimal availableAfter,
        Long transactionId
) {
    public enum Status { APPLIED, DUPLICATE, INSUFFICIENT_FUNDS }

    public static DebitOutcome applied(LedgerTransaction tx) {
        return new DebitOutcome(Status.APPLIED, tx.jobId(), tx.tickSeq(), tx.amount(), tx.balanceAfter(),
                tx.balanceAfter().subtract(tx.reservedAfter()), tx.id());
    }

    public static DebitOutcome duplicate(LedgerTransaction prior) {
        return new DebitOutcome(Status.DUPLICATE, prior.jobId(), prior.tickSeq(), prior.amount(), prior.balanceAfter(),
                prior.balanceAfter().subtract(prior.reservedAfter()), prior.id());
    }

    public static DebitOutcome insufficient(String jobId, long tickSeq, BigDecimal amount, Wallet wallet) {
        return new DebitOutcome(Status.INSUFFICIENT_FUNDS, jobId, tickSeq, amount, wallet.balance(),
                wallet.available(), null);
    }

    public boolean charged() {
        return status != Status.INSUFFICIENT_FUNDS;
    }
}
