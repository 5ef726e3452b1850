package net.hourglass.bootstrap.autoconfigure;

import net.hourglass.bootstrap.catalog.CatalogRegistrar;
import net.hourglass.bootstrap.props.HourglassProperties;
import net.hourglass.core.lease.LeaseLockService;
import net.hourglass.core.maintenance.JsonLinesEventLog;
import net.hourglass.core.maintenance.Watchdog;
import net.hourglass.core.maintenance.WatchdogOptions;
import net.hourglass.core.retry.BackoffRetryPolicy;
import net.hourglass.core.retry.ErrorClassifier;
import net.hourglass.core.retry.RetryPolicy;
import net.hourglass.core.service.DueTimeCalculator;
import net.hourglass.core.service.EngineOptions;
import net.hourglass.core.service.SchedulingEngine;
import net.hourglass.core.spi.*;
import net.hourglass.core.ticker.Ticker;
import net.hourglass.integration.spring.HourglassSpringConfig;
import net.hourglass.integration.spring.sched.HourglassSchedulers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;

@AutoConfiguration
@EnableConfigurationProperties(HourglassProperties.class)
@Import(HourglassSpringConfig.class) // integration-spring: repos/tx/clock wiring
public class HourglassAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(HourglassAutoConfiguration.class);

    // --- SPI 기본 구현(없으면) 제공 ---

    @Bean
    @ConditionalOnMissingBean
    public PipelineExecutor pipelineExecutor() {
        // 실제 실행기는 앱에서 빈으로 등록
        return request -> {
            throw new IllegalStateException("Executor not set");
        };
    }

    @Bean
    @ConditionalOnMissingBean
    public RunNotifier runNotifier() {
        return (event, payload) -> log.info("[notify] {} {}", event, payload);
    }

    @Bean
    @ConditionalOnMissingBean
    public Sleeper sleeper() {
        return Sleeper.system();
    }

    @Bean
    @ConditionalOnMissingBean
    public EventLog watchdogEventLog(HourglassProperties props) {
        return new JsonLinesEventLog(Path.of(props.getWatchdog().getEventLog()));
    }

    // --- 코어 서비스 조립 ---

    @Bean
    @ConditionalOnMissingBean
    public DueTimeCalculator dueTimeCalculator(HourglassProperties props) {
        return new DueTimeCalculator(ZoneId.of(props.getZone()));
    }

    @Bean
    @ConditionalOnMissingBean
    public LeaseLockService leaseLockService(LockRepository locks, TxRunner tx) {
        return new LeaseLockService(locks, tx);
    }

    @Bean
    @ConditionalOnMissingBean
    public BackoffRetryPolicy backoffRetryPolicy(HourglassProperties props, Sleeper sleeper) {
        var r = props.getRetry();
        return new BackoffRetryPolicy(r.getMaxRetries(), r.getBaseDelay(), r.getMaxDelay(),
                r.getExponentialBase(), r.isJitter(), ErrorClassifier.defaults(), sleeper);
    }

    @Bean
    @ConditionalOnMissingBean
    public SchedulingEngine schedulingEngine(JobRepository jobs,
                                             RunRepository runs,
                                             LeaseLockService leases,
                                             TxRunner tx,
                                             Clock clock,
                                             DueTimeCalculator dueTimes,
                                             PipelineExecutor executor,
                                             RunNotifier notifier,
                                             Sleeper sleeper,
                                             HourglassProperties props) {
        var s = props.getScheduler();
        var options = new EngineOptions(s.getMaxConcurrency(), s.getLockTtl(), s.getKeepRuns(), s.getMaxRetries(),
                RetryPolicy.schedule(s.getRetryDelays().toArray(new Duration[0])));
        return new SchedulingEngine(jobs, runs, leases, tx, clock, dueTimes, executor, notifier, sleeper, options);
    }

    @Bean
    @ConditionalOnMissingBean
    public Watchdog watchdog(JobRepository jobs,
                             RunRepository runs,
                             LeaseLockService leases,
                             TxRunner tx,
                             Clock clock,
                             EventLog eventLog,
                             HourglassProperties props) {
        var w = props.getWatchdog();
        var options = new WatchdogOptions(w.isEnabled(), w.getJobTimeout(), w.getStuckMultiplier(),
                w.getMaxConsecutiveFailures());
        return new Watchdog(jobs, runs, leases, tx, clock, eventLog, options);
    }

    @Bean
    @ConditionalOnMissingBean
    public Ticker ticker(SchedulingEngine engine, Clock clock, HourglassProperties props) {
        return new Ticker(engine::tick, props.getScheduler().getTickInterval(), clock);
    }

    // --- 스케줄러 등록 (프로퍼티로 제어) ---

    @Bean
    @ConditionalOnProperty(prefix = "hourglass.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
    public HourglassSchedulers hourglassSchedulers(Ticker ticker,
                                                   SchedulingEngine engine,
                                                   Watchdog watchdog,
                                                   HourglassProperties props) {
        var s = new HourglassSchedulers(ticker, engine, watchdog);
        s.setAutoStart(props.getScheduler().isAutoStart());
        s.setStopTimeout(props.getScheduler().getStopTimeout());
        return s;
    }

    @Bean
    public CatalogRegistrar catalogRegistrar(JobRepository jobs, TxRunner tx) {
        return new CatalogRegistrar(jobs, tx);
    }

    @Bean
    @ConditionalOnProperty(prefix = "hourglass.catalog", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ApplicationRunner catalogRunner(CatalogRegistrar registrar, HourglassProperties props) {
        return args -> {
            int n = registrar.register(props.getCatalog());
            log.info("Catalog loaded: {} job(s)", n);
        };
    }
}
