package net.gpumeter.adapter.jdbc.repo;

import net.gpumeter.adapter.jdbc.JdbcUtil;
import net.gpumeter.adapter.jdbc.TxContext;
import net.gpumeter.adapter.jdbc.mapper.RowMappers;
import net.gpumeter.core.model.KillCommand;
import net.gpumeter.core.model.KillReason;
import net.gpumeter.core.spi.KillCommandRepository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class JdbcKillCommandRepository implements KillCommandRepository {
    private final DataSource ds;
    public JdbcKillCommandRepository(DataSource ds) { this.ds = ds; }

    private Connection mustConn() {
        return TxContext.require();
    }

    @Override
    public KillCommand insert(String jobId, KillReason reason, Instant issuedAt, Instant ackDeadline) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            INSERT INTO TB_KILL_COMMAND (JOB_ID, REASON, STATUS, ISSUED_AT, ACK_DEADLINE, ATTEMPTS)
            VALUES (?, ?, 'PENDING', ?, ?, 0)
        """, new String[]{"ID"})) {
            ps.setString(1, jobId);
            ps.setString(2, reason.code());
            ps.setTimestamp(3, JdbcUtil.ts(issuedAt));
            ps.setTimestamp(4, JdbcUtil.ts(ackDeadline));
            ps.executeUpdate();
            try (var keys = ps.getGeneratedKeys()) {
                if (!keys.next()) throw new IllegalStateException("no generated key for kill command");
                return new KillCommand(keys.getLong(1), jobId, reason, KillCommand.Status.PENDING,
                        issuedAt, ackDeadline, null, 0);
            }
        }
    }

    @Override
    public Optional<KillCommand> findById(long id) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_KILL_COMMAND WHERE ID=?")) {
            ps.setLong(1, id);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toKillCommand(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public Optional<KillCommand> findPendingByJob(String jobId) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_KILL_COMMAND WHERE JOB_ID=? AND STATUS='PENDING'")) {
            ps.setString(1, jobId);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toKillCommand(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public List<KillCommand> pollPending(int limit) throws Exception {
        Connection c = mustConn();

        // FOR UPDATE + FETCH FIRST 조합 불가(ORA-02014) → 커서에서 limit개만 읽는다
        List<Long> ids = new ArrayList<>();
        try (var ps = c.prepareStatement("""
            SELECT ID FROM TB_KILL_COMMAND
             WHERE STATUS = 'PENDING'
             ORDER BY ISSUED_AT ASC, ID ASC
             FOR UPDATE SKIP LOCKED
        """)) {
            ps.setFetchSize(Math.max(1, limit));
            try (var rs = ps.executeQuery()) {
                while (ids.size() < limit && rs.next()) ids.add(rs.getLong(1));
            }
        }

        List<KillCommand> out = new ArrayList<>(ids.size());
        for (Long id : ids) {
            try (var up = c.prepareStatement("UPDATE TB_KILL_COMMAND SET ATTEMPTS = ATTEMPTS + 1 WHERE ID = ?")) {
                up.setLong(1, id);
                up.executeUpdate();
            }
            findById(id).ifPresent(out::add);
        }
        return out;
    }

    @Override
    public boolean ack(long id, Instant at) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_KILL_COMMAND
               SET STATUS = 'ACKED',
                   ACKED_AT = ?
             WHERE ID = ? AND STATUS = 'PENDING'
        """)) {
            ps.setTimestamp(1, JdbcUtil.ts(at));
            ps.setLong(2, id);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public List<KillCommand> findExpired(Instant now, int limit) throws Exception {
        List<KillCommand> out = new ArrayList<>();
        try (var ps = mustConn().prepareStatement("""
            SELECT * FROM TB_KILL_COMMAND
             WHERE STATUS = 'PENDING'
               AND ACK_DEADLINE < ?
             ORDER BY ACK_DEADLINE ASC
             FETCH FIRST ? ROWS ONLY
        """)) {
            ps.setTimestamp(1, JdbcUtil.ts(now));
            ps.setInt(2, limit);
            try (var rs = ps.executeQuery()) {
                while (rs.next()) out.add(RowMappers.toKillCommand(rs));
            }
        }
        return out;
    }

    @Override
    public boolean markTimedOut(long id, Instant at) throws Exception {
        try (var ps = mustConn().prepareStatement(
                "UPDATE TB_KILL_COMMAND SET STATUS = 'TIMED_OUT' WHERE ID = ? AND STATUS = 'PENDING'")) {
            ps.setLong(1, id);
            return ps.executeUpdate() == 1;
        }
    }
}
