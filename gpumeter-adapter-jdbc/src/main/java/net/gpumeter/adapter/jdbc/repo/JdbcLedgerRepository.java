package net.gpumeter.adapter.jdbc.repo;

import net.gpumeter.adapter.jdbc.JdbcUtil;
import net.gpumeter.adapter.jdbc.TxContext;
import net.gpumeter.adapter.jdbc.mapper.RowMappers;
import net.gpumeter.core.model.LedgerTransaction;
import net.gpumeter.core.model.Money;
import net.gpumeter.core.spi.LedgerRepository;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** append-only. UPDATE/DELETE 경로 없음 */
public final class JdbcLedgerRepository implements LedgerRepository {
    private final DataSource ds;
    public JdbcLedgerRepository(DataSource ds) { this.ds = ds; }

    private Connection mustConn() {
        return TxContext.require();
    }

    @Override
    public LedgerTransaction append(LedgerTransaction tx) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            INSERT INTO TB_LEDGER_TX
              (USER_ID, JOB_ID, TX_TYPE, AMOUNT, BALANCE_AFTER, RESERVED_AFTER,
               TICK_SEQ, EXTERNAL_REF, DESCRIPTION, CREATED_AT)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """, new String[]{"ID"})) {
            ps.setString(1, tx.userId());
            ps.setString(2, tx.jobId());
            ps.setString(3, tx.type().code());
            ps.setBigDecimal(4, tx.amount());
            ps.setBigDecimal(5, tx.balanceAfter());
            ps.setBigDecimal(6, tx.reservedAfter());
            if (tx.tickSeq() == null) ps.setNull(7, Types.NUMERIC); else ps.setLong(7, tx.tickSeq());
            ps.setString(8, tx.externalRef());
            ps.setString(9, tx.description());
            ps.setTimestamp(10, JdbcUtil.ts(tx.createdAt()));
            ps.executeUpdate();
            try (var keys = ps.getGeneratedKeys()) {
                if (!keys.next()) throw new IllegalStateException("no generated key for ledger transaction");
                return tx.withId(keys.getLong(1));
            }
        }
    }

    @Override
    public Optional<LedgerTransaction> findDebit(String jobId, long tickSeq) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            SELECT * FROM TB_LEDGER_TX
             WHERE TX_TYPE='debit' AND JOB_ID=? AND TICK_SEQ=?
        """)) {
            ps.setString(1, jobId);
            ps.setLong(2, tickSeq);
            return single(ps);
        }
    }

    @Override
    public Optional<LedgerTransaction> findCreditByRef(String externalRef) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            SELECT * FROM TB_LEDGER_TX
             WHERE TX_TYPE='credit' AND EXTERNAL_REF=?
        """)) {
            ps.setString(1, externalRef);
            return single(ps);
        }
    }

    @Override
    public List<LedgerTransaction> findByUser(String userId, int limit, int offset) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            SELECT * FROM TB_LEDGER_TX
             WHERE USER_ID=?
             ORDER BY ID DESC
             OFFSET ? ROWS FETCH NEXT ? ROWS ONLY
        """)) {
            ps.setString(1, userId);
            ps.setInt(2, offset);
            ps.setInt(3, limit);
            return list(ps);
        }
    }

    @Override
    public List<LedgerTransaction> findAllByUser(String userId) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_LEDGER_TX WHERE USER_ID=? ORDER BY ID ASC")) {
            ps.setString(1, userId);
            return list(ps);
        }
    }

    @Override
    public BigDecimal sumByJob(String jobId, LedgerTransaction.Type type) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            SELECT COALESCE(SUM(AMOUNT), 0) AS TOTAL
              FROM TB_LEDGER_TX
             WHERE JOB_ID=? AND TX_TYPE=?
        """)) {
            ps.setString(1, jobId);
            ps.setString(2, type.code());
            try (var rs = ps.executeQuery()) {
                rs.next();
                return Money.normalize(rs.getBigDecimal("TOTAL"));
            }
        }
    }

    private static Optional<LedgerTransaction> single(PreparedStatement ps) throws Exception {
        try (var rs = ps.executeQuery()) {
            return rs.next() ? Optional.of(RowMappers.toLedgerTransaction(rs)) : Optional.empty();
        }
    }

    private static List<LedgerTransaction> list(PreparedStatement ps) throws Exception {
        List<LedgerTransaction> out = new ArrayList<>();
        try (var rs = ps.executeQuery()) {
            while (rs.next()) out.add(RowMappers.toLedgerTransaction(rs));
        }
        return out;
    }
}
