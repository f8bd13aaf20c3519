package net.gpumeter.adapter.jdbc.repo;

import net.gpumeter.adapter.jdbc.TxContext;
import net.gpumeter.adapter.jdbc.mapper.RowMappers;
import net.gpumeter.core.model.DispatchMessage;
import net.gpumeter.core.spi.DispatchRepository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 디스패치 큐. 시각은 모두 DB CURRENT_TIMESTAMP 기준 (여러 컨트롤러 인스턴스 간 시계 차이 배제).
 */
public final class JdbcDispatchRepository implements DispatchRepository {
    private final DataSource ds;
    public JdbcDispatchRepository(DataSource ds) { this.ds = ds; }

    private Connection mustConn() {
        return TxContext.require();
    }

    @Override
    public DispatchMessage enqueue(String jobId) throws Exception {
        Connection c = mustConn();
        long id;
        try (var ps = c.prepareStatement("""
            INSERT INTO TB_DISPATCH_MSG (JOB_ID, STATUS, ATTEMPT, AVAILABLE_AT, CREATED_AT, UPDATED_AT)
            VALUES (?, 'READY', 1, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)
        """, new String[]{"ID"})) {
            ps.setString(1, jobId);
            ps.executeUpdate();
            try (var keys = ps.getGeneratedKeys()) {
                if (!keys.next()) throw new IllegalStateException("no generated key for dispatch message");
                id = keys.getLong(1);
            }
        }
        return findById(c, id).orElseThrow();
    }

    @Override
    public Optional<DispatchMessage> claimNext(String workerToken, Duration lease) throws Exception {
        Connection c = mustConn();

        // 1) 하나 픽업. fetch 시점에 잠기므로 첫 행만 읽는다
        Long id = null;
        try (var ps = c.prepareStatement("""
            SELECT  m.ID
            FROM    TB_DISPATCH_MSG m
            WHERE   m.STATUS = 'READY'
              AND   m.AVAILABLE_AT <= CURRENT_TIMESTAMP
            ORDER BY m.AVAILABLE_AT ASC, m.ID ASC
            FOR UPDATE SKIP LOCKED
        """)) {
            ps.setFetchSize(1);
            try (var rs = ps.executeQuery()) {
                if (rs.next()) id = rs.getLong(1);
            }
        }
        if (id == null) return Optional.empty();

        // 2) CLAIMED 전환
        try (var up = c.prepareStatement("""
            UPDATE TB_DISPATCH_MSG
               SET STATUS = 'CLAIMED',
                   WORKER_TOKEN = ?,
                   LEASE_UNTIL = CURRENT_TIMESTAMP + NUMTODSINTERVAL(?, 'SECOND'),
                   UPDATED_AT = CURRENT_TIMESTAMP
             WHERE ID = ?
        """)) {
            up.setString(1, workerToken);
            up.setLong(2, Math.max(1, lease.toSeconds()));
            up.setLong(3, id);
            up.executeUpdate();
        }

        // 3) 로우 반환
        return findById(c, id);
    }

    @Override
    public boolean complete(long messageId) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_DISPATCH_MSG
               SET STATUS = 'DONE',
                   LEASE_UNTIL = NULL,
                   WORKER_TOKEN = NULL,
                   UPDATED_AT = CURRENT_TIMESTAMP
             WHERE ID = ? AND STATUS = 'CLAIMED'
        """)) {
            ps.setLong(1, messageId);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public void requeue(long messageId, Duration backoff, String lastError) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_DISPATCH_MSG
               SET STATUS = 'READY',
                   AVAILABLE_AT = CURRENT_TIMESTAMP + NUMTODSINTERVAL(?, 'SECOND'),
                   ATTEMPT = ATTEMPT + 1,
                   LEASE_UNTIL = NULL,
                   WORKER_TOKEN = NULL,
                   LAST_ERROR = ?,
                   UPDATED_AT = CURRENT_TIMESTAMP
             WHERE ID = ? AND STATUS = 'CLAIMED'
        """)) {
            ps.setLong(1, backoff.toSeconds());
            ps.setString(2, truncate(lastError));
            ps.setLong(3, messageId);
            ps.executeUpdate();
        }
    }

    @Override
    public int withdraw(String jobId) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_DISPATCH_MSG
               SET STATUS = 'CANCELLED',
                   LEASE_UNTIL = NULL,
                   WORKER_TOKEN = NULL,
                   UPDATED_AT = CURRENT_TIMESTAMP
             WHERE JOB_ID = ? AND STATUS IN ('READY', 'CLAIMED')
        """)) {
            ps.setString(1, jobId);
            return ps.executeUpdate();
        }
    }

    @Override
    public int reclaimExpiredLeases() throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_DISPATCH_MSG
               SET STATUS = 'READY',
                   AVAILABLE_AT = CURRENT_TIMESTAMP,
                   ATTEMPT = ATTEMPT + 1,
                   LEASE_UNTIL = NULL,
                   WORKER_TOKEN = NULL,
                   LAST_ERROR = 'lease expired',
                   UPDATED_AT = CURRENT_TIMESTAMP
             WHERE STATUS = 'CLAIMED'
               AND LEASE_UNTIL < CURRENT_TIMESTAMP
        """)) {
            return ps.executeUpdate();
        }
    }

    @Override
    public List<DispatchMessage> findByJob(String jobId) throws Exception {
        List<DispatchMessage> out = new ArrayList<>();
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_DISPATCH_MSG WHERE JOB_ID=? ORDER BY ID")) {
            ps.setString(1, jobId);
            try (var rs = ps.executeQuery()) {
                while (rs.next()) out.add(RowMappers.toDispatchMessage(rs));
            }
        }
        return out;
    }

    private static Optional<DispatchMessage> findById(Connection c, long id) throws Exception {
        try (var ps = c.prepareStatement("SELECT * FROM TB_DISPATCH_MSG WHERE ID=?")) {
            ps.setLong(1, id);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toDispatchMessage(rs)) : Optional.empty();
            }
        }
    }

    private static String truncate(String s) {
        return s == null || s.length() <= 1024 ? s : s.substring(0, 1024);
    }
}
