package net.hourglass.integration.spring;

import net.hourglass.adapter.jdbc.repo.JdbcJobRepository;
import net.hourglass.adapter.jdbc.repo.JdbcLockRepository;
import net.hourglass.adapter.jdbc.repo.JdbcRunRepository;
import net.hourglass.core.spi.*;
import net.hourglass.integration.spring.tx.SpringTxRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;
import java.time.Instant;

@Configuration
public class HourglassSpringConfig {

    // TxRunner (Spring)
    @Bean
    public TxRunner txRunner(PlatformTransactionManager tm, DataSource ds) {
        return new SpringTxRunner(tm, ds);
    }

    // 기본 Clock. 테스트에서는 고정/가변 시계로 교체
    @Bean
    public Clock systemClock() { return Instant::now; }

    // Repository 구현 등록 (adapter-jdbc 재사용)
    @Bean public JobRepository jobRepository(Clock clock) { return new JdbcJobRepository(clock); }
    @Bean public RunRepository runRepository(Clock clock) { return new JdbcRunRepository(clock); }
    @Bean public LockRepository lockRepository(Clock clock) { return new JdbcLockRepository(clock); }
}
