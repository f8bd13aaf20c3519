package net.gpumeter.adapter.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import net.gpumeter.core.spi.TxRunner;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.TestInstance;
import org.testcontainers.DockerClientFactory;
import org.testcontainers.containers.OracleContainer;
import org.testcontainers.utility.DockerImageName;

import javax.sql.DataSource;
import java.time.Duration;
import java.util.Optional;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public abstract class TestSupport {
    protected static DataSource ds;
    protected static OracleContainer oracle;

    /** FK 역순 (자식 먼저) */
    private static final String[] TABLES = {
            "TB_KILL_COMMAND", "TB_DISPATCH_MSG", "TB_JOB", "TB_RESERVATION", "TB_LEDGER_TX", "TB_WALLET"
    };

    @BeforeAll
    void setupDb() {
        String url = System.getenv("ORACLE_JDBC_URL");
        String user = System.getenv("ORACLE_USERNAME");
        String pass = System.getenv("ORACLE_PASSWORD");

        if (url == null || url.isBlank()) {
            Assumptions.assumeTrue(DockerClientFactory.instance().isDockerAvailable(),
                    "ORACLE_JDBC_URL not set and Docker is not available");
            // Testcontainers Oracle XE (gvenzl/oracle-xe)
            oracle = new OracleContainer(DockerImageName.parse("gvenzl/oracle-xe:21-slim"))
                    .withStartupTimeout(Duration.ofMinutes(5));
            oracle.start();

            url = oracle.getJdbcUrl();
            user = Optional.ofNullable(oracle.getUsername()).orElse("system");
            pass = Optional.ofNullable(oracle.getPassword()).orElse("oracle");
        }

        HikariConfig cfg = new HikariConfig();
        cfg.setJdbcUrl(url);
        cfg.setUsername(user);
        cfg.setPassword(pass);
        cfg.setMaximumPoolSize(8);
        cfg.setMinimumIdle(1);
        cfg.setConnectionTimeout(30_000);
        cfg.setIdleTimeout(60_000);
        cfg.setDriverClassName("oracle.jdbc.OracleDriver");
        ds = new HikariDataSource(cfg);

        Flyway.configure()
                .dataSource(ds)
                .locations("classpath:db/migration/oracle")
                .baselineOnMigrate(true)
                .load()
                .migrate();
    }

    protected static void cleanTables(TxRunner tx) throws Exception {
        tx.required(() -> {
            try (var st = TxContext.get().createStatement()) {
                for (String t : TABLES) st.execute("DELETE FROM " + t);
            }
            return null;
        });
    }

    @AfterAll
    void cleanup() {
        if (ds instanceof HikariDataSource h) h.close();
        if (oracle != null) oracle.stop();
    }
}
