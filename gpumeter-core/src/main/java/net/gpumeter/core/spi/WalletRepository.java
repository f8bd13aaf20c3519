package net.gpumeter.core.spi;

import net.gpumeter.core.model.Wallet;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

public interface WalletRepository {
    Optional<Wallet> findByUser(String userId) throws Exception;

    /** SELECT ... FOR UPDATE. 사용자 단위 직렬화 지점 */
    Optional<Wallet> lockByUser(String userId) throws Exception;

    /** 없으면 balance=0으로 생성. 생성했으면 true */
    boolean insertIfAbsent(String userId, Instant now) throws Exception;

    /** 잠금 보유 상태에서만 호출. version++ */
    void update(String userId, BigDecimal balance, BigDecimal reserved, Instant now) throws Exception;

    void freeze(String userId, Instant now) throws Exception;
}
