package net.gpumeter.adapter.jdbc.repo;

import net.gpumeter.adapter.jdbc.JdbcUtil;
import net.gpumeter.adapter.jdbc.TxContext;
import net.gpumeter.adapter.jdbc.mapper.RowMappers;
import net.gpumeter.core.model.Wallet;
import net.gpumeter.core.spi.WalletRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;

public final class JdbcWalletRepository implements WalletRepository {
    private static final Logger log = LoggerFactory.getLogger(JdbcWalletRepository.class);

    private final DataSource ds;
    public JdbcWalletRepository(DataSource ds) { this.ds = ds; }

    private Connection mustConn() {
        return TxContext.require();
    }

    @Override
    public Optional<Wallet> findByUser(String userId) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_WALLET WHERE USER_ID=?")) {
            ps.setString(1, userId);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toWallet(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public Optional<Wallet> lockByUser(String userId) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_WALLET WHERE USER_ID=? FOR UPDATE")) {
            ps.setString(1, userId);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toWallet(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public boolean insertIfAbsent(String userId, Instant now) throws Exception {
        // 두 MERGE가 동시에 행을 못 찾으면 둘 다 INSERT를 시도한다. 늦은 쪽은 ORA-00001 → 이미 있음
        try (var ps = mustConn().prepareStatement("""
            MERGE INTO TB_WALLET w
            USING (SELECT ? AS USER_ID, ? AS NOW_AT FROM dual) s
               ON (w.USER_ID = s.USER_ID)
            WHEN NOT MATCHED THEN
              INSERT (USER_ID, BALANCE, RESERVED, FROZEN, VERSION, CREATED_AT, UPDATED_AT)
              VALUES (s.USER_ID, 0, 0, 'N', 0, s.NOW_AT, s.NOW_AT)
        """)) {
            ps.setString(1, userId);
            ps.setTimestamp(2, JdbcUtil.ts(now));
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            if (!JdbcUtil.isDuplicateKey(e)) throw e;
            log.debug("wallet of {} created concurrently", userId);
            return false;
        }
    }

    @Override
    public void update(String userId, BigDecimal balance, BigDecimal reserved, Instant now) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_WALLET
               SET BALANCE = ?,
                   RESERVED = ?,
                   VERSION = VERSION + 1,
                   UPDATED_AT = ?
             WHERE USER_ID = ?
        """)) {
            ps.setBigDecimal(1, balance);
            ps.setBigDecimal(2, reserved);
            ps.setTimestamp(3, JdbcUtil.ts(now));
            ps.setString(4, userId);
            if (ps.executeUpdate() != 1) throw new IllegalStateException("wallet not found: " + userId);
        }
    }

    @Override
    public void freeze(String userId, Instant now) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_WALLET
               SET FROZEN = 'Y',
                   VERSION = VERSION + 1,
                   UPDATED_AT = ?
             WHERE USER_ID = ?
        """)) {
            ps.setTimestamp(1, JdbcUtil.ts(now));
            ps.setString(2, userId);
            ps.executeUpdate();
        }
    }
}
