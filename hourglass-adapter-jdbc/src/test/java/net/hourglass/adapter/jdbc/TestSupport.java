package net.hourglass.adapter.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import net.hourglass.core.spi.TxRunner;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.TestInstance;

import javax.sql.DataSource;
import java.nio.file.Files;
import java.nio.file.Path;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public abstract class TestSupport {
    protected static DataSource ds;
    private static Path dbFile;

    @BeforeAll
    void setupDb() throws Exception {
        // 테스트 클래스마다 새 SQLite 파일
        dbFile = Files.createTempFile("hourglass-test-", ".db");

        HikariConfig cfg = new HikariConfig();
        cfg.setJdbcUrl("jdbc:sqlite:" + dbFile.toAbsolutePath());
        cfg.setDriverClassName("org.sqlite.JDBC");
        cfg.setMaximumPoolSize(8);
        cfg.setMinimumIdle(1);
        cfg.setConnectionTimeout(30_000);
        cfg.addDataSourceProperty("foreign_keys", "true");
        cfg.addDataSourceProperty("busy_timeout", "30000");
        cfg.addDataSourceProperty("transaction_mode", "IMMEDIATE");
        ds = new HikariDataSource(cfg);

        Flyway.configure()
                .dataSource(ds)
                .locations("classpath:db/migration/sqlite")
                .load()
                .migrate();
    }

    @AfterAll
    void cleanup() throws Exception {
        if (ds instanceof HikariDataSource h) h.close();
        if (dbFile != null) Files.deleteIfExists(dbFile);
    }

    /** 매 테스트 격리용 */
    protected static void deleteAll(TxRunner tx) throws Exception {
        tx.required(() -> {
            try (var st = TxContext.require().createStatement()) {
                for (String t : new String[]{"TB_RUN", "TB_LOCK", "TB_JOB"}) {
                    st.execute("DELETE FROM " + t);
                }
            }
            return null;
        });
    }

    protected static int count(TxRunner tx, String sql, long param) throws Exception {
        return tx.required(() -> {
            try (var ps = TxContext.require().prepareStatement(sql)) {
                ps.setLong(1, param);
                try (var rs = ps.executeQuery()) {
                    rs.next();
                    return rs.getInt(1);
                }
            }
        });
    }
}
