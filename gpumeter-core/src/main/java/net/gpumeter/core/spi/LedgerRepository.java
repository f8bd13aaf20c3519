package net.gpumeter.core.spi;

import net.gpumeter.core.model.LedgerTransaction;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

public interface LedgerRepository {
    /** append-only. id가 채워진 레코드 반환 */
    LedgerTransaction append(LedgerTransaction tx) throws Exception;

    Optional<LedgerTransaction> findDebit(String jobId, long tickSeq) throws Exception;

    Optional<LedgerTransaction> findCreditByRef(String externalRef) throws Exception;

    /** 최신순 페이지 */
    List<LedgerTransaction> findByUser(String userId, int limit, int offset) throws Exception;

    /** id 오름차순 전체 (reconcile용) */
    List<LedgerTransaction> findAllByUser(String userId) throws Exception;

    BigDecimal sumByJob(String jobId, LedgerTransaction.Type type) throws Exception;
}
