package net.gpumeter.integration.spring;

import net.gpumeter.adapter.jdbc.repo.*;
import net.gpumeter.core.spi.*;
import net.gpumeter.integration.spring.tx.SpringTxRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

@Configuration
public class GpuMeterSpringConfig {

    // TxRunner (Spring)
    @Bean
    public TxRunner txRunner(PlatformTransactionManager tm, DataSource ds) {
        return new SpringTxRunner(tm, ds);
    }

    // Repository 구현 등록 (adapter-jdbc 재사용)
    @Bean public WalletRepository walletRepository(DataSource ds) { return new JdbcWalletRepository(ds); }
    @Bean public LedgerRepository ledgerRepository(DataSource ds) { return new JdbcLedgerRepository(ds); }
    @Bean public ReservationRepository reservationRepository(DataSource ds) { return new JdbcReservationRepository(ds); }
    @Bean public JobRecordRepository jobRecordRepository(DataSource ds) { return new JdbcJobRecordRepository(ds); }
    @Bean public DispatchRepository dispatchRepository(DataSource ds) { return new JdbcDispatchRepository(ds); }
    @Bean public KillCommandRepository killCommandRepository(DataSource ds) { return new JdbcKillCommandRepository(ds); }

    @Bean public Clock systemClock() { return Clock.system(); }
}
