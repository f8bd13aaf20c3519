package net.gpumeter.adapter.jdbc.repo;

import net.gpumeter.adapter.jdbc.JdbcUtil;
import net.gpumeter.adapter.jdbc.TxContext;
import net.gpumeter.adapter.jdbc.mapper.RowMappers;
import net.gpumeter.core.model.JobRecord;
import net.gpumeter.core.model.JobStatus;
import net.gpumeter.core.model.JobTransition;
import net.gpumeter.core.model.KillReason;
import net.gpumeter.core.spi.JobRecordRepository;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class JdbcJobRecordRepository implements JobRecordRepository {
    private final DataSource ds;
    public JdbcJobRecordRepository(DataSource ds) { this.ds = ds; }

    private Connection mustConn() {
        return TxContext.require();
    }

    @Override
    public void insert(JobRecord j) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            INSERT INTO TB_JOB
              (ID, OWNER_ID, STATUS, DOCKER_IMAGE, SCRIPT_NAME, MEMORY_LIMIT, CPU_COUNT, TIMEOUT_SECONDS,
               RATE_PER_MINUTE, TICK_SECONDS, CREATED_AT, QUEUED_AT, RUNTIME_SECONDS, TICKS_BILLED, TOTAL_COST, VERSION)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, 0)
        """)) {
            ps.setString(1, j.id());
            ps.setString(2, j.ownerId());
            ps.setString(3, j.status().code());
            ps.setString(4, j.dockerImage());
            ps.setString(5, j.scriptName());
            ps.setString(6, j.resources().memoryLimit());
            ps.setDouble(7, j.resources().cpuCount());
            ps.setInt(8, j.resources().timeoutSeconds());
            ps.setBigDecimal(9, j.ratePerMinute());
            ps.setInt(10, j.tickSeconds());
            ps.setTimestamp(11, JdbcUtil.ts(j.createdAt()));
            ps.setTimestamp(12, JdbcUtil.ts(j.queuedAt()));
            ps.setLong(13, j.runtimeSeconds());
            ps.setLong(14, j.ticksBilled());
            ps.setBigDecimal(15, j.totalCost());
            ps.executeUpdate();
        }
    }

    @Override
    public Optional<JobRecord> findById(String jobId) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_JOB WHERE ID=?")) {
            ps.setString(1, jobId);
            return single(ps);
        }
    }

    @Override
    public Optional<JobRecord> lockById(String jobId) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_JOB WHERE ID=? FOR UPDATE")) {
            ps.setString(1, jobId);
            return single(ps);
        }
    }

    @Override
    public List<JobRecord> findByOwner(String ownerId, JobStatus status, int limit, int offset) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            SELECT * FROM TB_JOB
             WHERE OWNER_ID=?
               AND (? IS NULL OR STATUS=?)
             ORDER BY CREATED_AT DESC, ID DESC
             OFFSET ? ROWS FETCH NEXT ? ROWS ONLY
        """)) {
            String code = status == null ? null : status.code();
            ps.setString(1, ownerId);
            ps.setString(2, code);
            ps.setString(3, code);
            ps.setInt(4, offset);
            ps.setInt(5, limit);
            return list(ps);
        }
    }

    @Override
    public int countActiveByOwner(String ownerId) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            SELECT COUNT(*) FROM TB_JOB
             WHERE OWNER_ID=? AND STATUS IN ('pending', 'preparing', 'running')
        """)) {
            ps.setString(1, ownerId);
            try (var rs = ps.executeQuery()) {
                rs.next();
                return rs.getInt(1);
            }
        }
    }

    @Override
    public long nextEventSeq() throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT SQ_JOB_EVENT.NEXTVAL FROM dual");
             var rs = ps.executeQuery()) {
            rs.next();
            return rs.getLong(1);
        }
    }

    @Override
    public boolean transition(JobTransition t) throws Exception {
        boolean terminal = t.to().isTerminal();
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_JOB
               SET STATUS = ?,
                   ACCEPTED_AT = CASE WHEN ? = 'preparing' THEN ? ELSE ACCEPTED_AT END,
                   STARTED_AT  = CASE WHEN ? = 'running' THEN ? ELSE STARTED_AT END,
                   SANDBOX_ID  = CASE WHEN ? = 'running' THEN ? ELSE SANDBOX_ID END,
                   ENDED_AT    = CASE WHEN ? = 'Y' THEN ? ELSE ENDED_AT END,
                   EXIT_REASON = CASE WHEN ? = 'Y' THEN ? ELSE EXIT_REASON END,
                   EXIT_CODE   = CASE WHEN ? = 'Y' THEN ? ELSE EXIT_CODE END,
                   VERSION = VERSION + 1
             WHERE ID = ? AND STATUS = ?
        """)) {
            String to = t.to().code();
            String yn = JdbcUtil.yn(terminal);
            int i = 1;
            ps.setString(i++, to);
            ps.setString(i++, to);
            ps.setTimestamp(i++, JdbcUtil.ts(t.at()));
            ps.setString(i++, to);
            ps.setTimestamp(i++, JdbcUtil.ts(t.at()));
            ps.setString(i++, to);
            ps.setString(i++, t.sandboxId());
            ps.setString(i++, yn);
            ps.setTimestamp(i++, JdbcUtil.ts(t.at()));
            ps.setString(i++, yn);
            ps.setString(i++, t.exitReason());
            ps.setString(i++, yn);
            if (t.exitCode() == null) ps.setNull(i++, Types.INTEGER); else ps.setInt(i++, t.exitCode());
            ps.setString(i++, t.jobId());
            ps.setString(i, t.from().code());
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public void recordTick(String jobId, long tickSeq, BigDecimal totalCost, long runtimeSeconds, Instant at) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_JOB
               SET TICKS_BILLED = ?,
                   TOTAL_COST = ?,
                   RUNTIME_SECONDS = ?,
                   LAST_HEARTBEAT_AT = ?,
                   VERSION = VERSION + 1
             WHERE ID = ?
        """)) {
            ps.setLong(1, tickSeq);
            ps.setBigDecimal(2, totalCost);
            ps.setLong(3, runtimeSeconds);
            ps.setTimestamp(4, JdbcUtil.ts(at));
            ps.setString(5, jobId);
            ps.executeUpdate();
        }
    }

    @Override
    public void recordCancelRequest(String jobId, long seq) throws Exception {
        try (var ps = mustConn().prepareStatement(
                "UPDATE TB_JOB SET CANCEL_SEQ=?, VERSION=VERSION+1 WHERE ID=? AND CANCEL_SEQ IS NULL")) {
            ps.setLong(1, seq);
            ps.setString(2, jobId);
            ps.executeUpdate();
        }
    }

    @Override
    public void recordExhaustion(String jobId, long seq) throws Exception {
        try (var ps = mustConn().prepareStatement(
                "UPDATE TB_JOB SET EXHAUSTED_SEQ=?, VERSION=VERSION+1 WHERE ID=? AND EXHAUSTED_SEQ IS NULL")) {
            ps.setLong(1, seq);
            ps.setString(2, jobId);
            ps.executeUpdate();
        }
    }

    @Override
    public void recordKillReason(String jobId, KillReason reason) throws Exception {
        try (var ps = mustConn().prepareStatement(
                "UPDATE TB_JOB SET KILL_REASON=?, VERSION=VERSION+1 WHERE ID=? AND KILL_REASON IS NULL")) {
            ps.setString(1, reason.code());
            ps.setString(2, jobId);
            ps.executeUpdate();
        }
    }

    @Override
    public List<JobRecord> findRunningSilentSince(Instant threshold, int limit) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            SELECT * FROM TB_JOB
             WHERE STATUS = 'running'
               AND COALESCE(LAST_HEARTBEAT_AT, STARTED_AT) < ?
             ORDER BY COALESCE(LAST_HEARTBEAT_AT, STARTED_AT) ASC
             FETCH FIRST ? ROWS ONLY
        """)) {
            ps.setTimestamp(1, JdbcUtil.ts(threshold));
            ps.setInt(2, limit);
            return list(ps);
        }
    }

    @Override
    public List<JobRecord> findPreparingSince(Instant threshold, int limit) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            SELECT * FROM TB_JOB
             WHERE STATUS = 'preparing'
               AND ACCEPTED_AT < ?
             ORDER BY ACCEPTED_AT ASC
             FETCH FIRST ? ROWS ONLY
        """)) {
            ps.setTimestamp(1, JdbcUtil.ts(threshold));
            ps.setInt(2, limit);
            return list(ps);
        }
    }

    private static Optional<JobRecord> single(PreparedStatement ps) throws Exception {
        try (var rs = ps.executeQuery()) {
            return rs.next() ? Optional.of(RowMappers.toJobRecord(rs)) : Optional.empty();
        }
    }

    private static List<JobRecord> list(PreparedStatement ps) throws Exception {
        List<JobRecord> out = new ArrayList<>();
        try (var rs = ps.executeQuery()) {
            while (rs.next()) out.add(RowMappers.toJobRecord(rs));
        }
        return out;
    }
}
