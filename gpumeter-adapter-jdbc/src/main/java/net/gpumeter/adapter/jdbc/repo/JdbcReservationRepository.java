package net.gpumeter.adapter.jdbc.repo;

import net.gpumeter.adapter.jdbc.JdbcUtil;
import net.gpumeter.adapter.jdbc.TxContext;
import net.gpumeter.adapter.jdbc.mapper.RowMappers;
import net.gpumeter.core.model.Reservation;
import net.gpumeter.core.spi.ReservationRepository;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.sql.Connection;
import java.time.Instant;
import java.util.Optional;

public final class JdbcReservationRepository implements ReservationRepository {
    private final DataSource ds;
    public JdbcReservationRepository(DataSource ds) { this.ds = ds; }

    private Connection mustConn() {
        return TxContext.require();
    }

    @Override
    public Reservation insert(Reservation r) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            INSERT INTO TB_RESERVATION (USER_ID, JOB_ID, AMOUNT, REMAINING, STATUS, CREATED_AT, RELEASED_AT)
            VALUES (?, ?, ?, ?, ?, ?, ?)
        """, new String[]{"ID"})) {
            ps.setString(1, r.userId());
            ps.setString(2, r.jobId());
            ps.setBigDecimal(3, r.amount());
            ps.setBigDecimal(4, r.remaining());
            ps.setString(5, r.status().code());
            ps.setTimestamp(6, JdbcUtil.ts(r.createdAt()));
            ps.setTimestamp(7, JdbcUtil.ts(r.releasedAt()));
            ps.executeUpdate();
            try (var keys = ps.getGeneratedKeys()) {
                if (!keys.next()) throw new IllegalStateException("no generated key for reservation");
                return new Reservation(keys.getLong(1), r.userId(), r.jobId(), r.amount(), r.remaining(),
                        r.status(), r.createdAt(), r.releasedAt());
            }
        }
    }

    @Override
    public Optional<Reservation> findById(long id) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_RESERVATION WHERE ID=?")) {
            ps.setLong(1, id);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toReservation(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public Optional<Reservation> findActiveByJob(String jobId) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_RESERVATION WHERE JOB_ID=? AND STATUS='ACTIVE'")) {
            ps.setString(1, jobId);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toReservation(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public void updateRemaining(long id, BigDecimal remaining) throws Exception {
        try (var ps = mustConn().prepareStatement("UPDATE TB_RESERVATION SET REMAINING=? WHERE ID=? AND STATUS='ACTIVE'")) {
            ps.setBigDecimal(1, remaining);
            ps.setLong(2, id);
            ps.executeUpdate();
        }
    }

    @Override
    public void markReleased(long id, Instant at) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_RESERVATION
               SET STATUS='RELEASED',
                   REMAINING=0,
                   RELEASED_AT=?
             WHERE ID=? AND STATUS='ACTIVE'
        """)) {
            ps.setTimestamp(1, JdbcUtil.ts(at));
            ps.setLong(2, id);
            ps.executeUpdate();
        }
    }
}
