package net.gpumeter.adapter.jdbc.mapper;

import net.gpumeter.adapter.jdbc.JdbcUtil;
import net.gpumeter.core.model.*;

import java.sql.*;

public final class RowMappers {
    private RowMappers() {}

    // --- Wallet ---
    public static Wallet toWallet(ResultSet rs) throws SQLException {
        return new Wallet(
                rs.getString("USER_ID"),
                JdbcUtil.money(rs, "BALANCE"),
                JdbcUtil.money(rs, "RESERVED"),
                "Y".equals(rs.getString("FROZEN")),
                rs.getLong("VERSION"),
                rs.getTimestamp("CREATED_AT").toInstant(),
                rs.getTimestamp("UPDATED_AT").toInstant()
        );
    }

    // --- LedgerTransaction ---
    public static LedgerTransaction toLedgerTransaction(ResultSet rs) throws SQLException {
        return new LedgerTransaction(
                rs.getLong("ID"),
                rs.getString("USER_ID"),
                rs.getString("JOB_ID"),
                LedgerTransaction.Type.from(rs.getString("TX_TYPE")),
                JdbcUtil.money(rs, "AMOUNT"),
                JdbcUtil.money(rs, "BALANCE_AFTER"),
                JdbcUtil.money(rs, "RESERVED_AFTER"),
                JdbcUtil.nullableLong(rs, "TICK_SEQ"),
                rs.getString("EXTERNAL_REF"),
                rs.getString("DESCRIPTION"),
                rs.getTimestamp("CREATED_AT").toInstant()
        );
    }

    // --- Reservation ---
    public static Reservation toReservation(ResultSet rs) throws SQLException {
        return new Reservation(
                rs.getLong("ID"),
                rs.getString("USER_ID"),
                rs.getString("JOB_ID"),
                JdbcUtil.money(rs, "AMOUNT"),
                JdbcUtil.money(rs, "REMAINING"),
                Reservation.Status.from(rs.getString("STATUS")),
                rs.getTimestamp("CREATED_AT").toInstant(),
                JdbcUtil.toInstant(rs.getTimestamp("RELEASED_AT"))
        );
    }

    // --- JobRecord ---
    public static JobRecord toJobRecord(ResultSet rs) throws SQLException {
        ResourceConfig resources = new ResourceConfig(
                rs.getString("MEMORY_LIMIT"),
                rs.getDouble("CPU_COUNT"),
                rs.getInt("TIMEOUT_SECONDS"));
        return new JobRecord(
                rs.getString("ID"),
                rs.getString("OWNER_ID"),
                JobStatus.from(rs.getString("STATUS")),
                rs.getString("DOCKER_IMAGE"),
                rs.getString("SCRIPT_NAME"),
                resources,
                JdbcUtil.money(rs, "RATE_PER_MINUTE"),
                rs.getInt("TICK_SECONDS"),
                rs.getTimestamp("CREATED_AT").toInstant(),
                JdbcUtil.toInstant(rs.getTimestamp("QUEUED_AT")),
                JdbcUtil.toInstant(rs.getTimestamp("ACCEPTED_AT")),
                JdbcUtil.toInstant(rs.getTimestamp("STARTED_AT")),
                JdbcUtil.toInstant(rs.getTimestamp("ENDED_AT")),
                JdbcUtil.toInstant(rs.getTimestamp("LAST_HEARTBEAT_AT")),
                rs.getLong("RUNTIME_SECONDS"),
                rs.getLong("TICKS_BILLED"),
                JdbcUtil.money(rs, "TOTAL_COST"),
                rs.getString("EXIT_REASON"),
                JdbcUtil.nullableInt(rs, "EXIT_CODE"),
                rs.getString("SANDBOX_ID"),
                JdbcUtil.nullableLong(rs, "CANCEL_SEQ"),
                JdbcUtil.nullableLong(rs, "EXHAUSTED_SEQ"),
                KillReason.from(rs.getString("KILL_REASON")),
                rs.getLong("VERSION")
        );
    }

    // --- DispatchMessage ---
    public static DispatchMessage toDispatchMessage(ResultSet rs) throws SQLException {
        return new DispatchMessage(
                rs.getLong("ID"),
                rs.getString("JOB_ID"),
                DispatchMessage.Status.from(rs.getString("STATUS")),
                rs.getInt("ATTEMPT"),
                rs.getTimestamp("AVAILABLE_AT").toInstant(),
                JdbcUtil.toInstant(rs.getTimestamp("LEASE_UNTIL")),
                rs.getString("WORKER_TOKEN"),
                rs.getString("LAST_ERROR"),
                rs.getTimestamp("CREATED_AT").toInstant(),
                rs.getTimestamp("UPDATED_AT").toInstant()
        );
    }

    // --- KillCommand ---
    public static KillCommand toKillCommand(ResultSet rs) throws SQLException {
        return new KillCommand(
                rs.getLong("ID"),
                rs.getString("JOB_ID"),
                KillReason.from(rs.getString("REASON")),
                KillCommand.Status.from(rs.getString("STATUS")),
                rs.getTimestamp("ISSUED_AT").toInstant(),
                rs.getTimestamp("ACK_DEADLINE").toInstant(),
                JdbcUtil.toInstant(rs.getTimestamp("ACKED_AT")),
                rs.getInt("ATTEMPTS")
        );
    }
}
