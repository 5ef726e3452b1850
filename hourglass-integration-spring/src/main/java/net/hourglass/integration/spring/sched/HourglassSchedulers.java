package net.hourglass.integration.spring.sched;

import net.hourglass.core.maintenance.Watchdog;
import net.hourglass.core.service.SchedulingEngine;
import net.hourglass.core.ticker.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Duration;

/**
 * 컨텍스트 수명주기에 Ticker를 묶고, 워치독은 @Scheduled 주기로 실행.
 * 워치독 주기: hourglass.watchdog.interval-ms
 */
public class HourglassSchedulers implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(HourglassSchedulers.class);

    private final Ticker ticker;
    private final SchedulingEngine engine;
    private final Watchdog watchdog;

    private boolean autoStart = true;
    private Duration stopTimeout = Duration.ofSeconds(5);

    public HourglassSchedulers(Ticker ticker, SchedulingEngine engine, Watchdog watchdog) {
        this.ticker = ticker;
        this.engine = engine;
        this.watchdog = watchdog;
    }

    @Scheduled(fixedDelayString = "${hourglass.watchdog.interval-ms:60000}",
               initialDelayString = "${hourglass.watchdog.interval-ms:60000}")
    public void watchdog() {
        watchdog.checkAndHeal();
    }

    @Override
    public void start() {
        ticker.start();
    }

    @Override
    public void stop() {
        try {
            if (!ticker.stop(stopTimeout)) {
                log.warn("Ticker still running after {}", stopTimeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            engine.close();
        }
    }

    @Override
    public boolean isRunning() {
        return ticker.isRunning();
    }

    @Override
    public boolean isAutoStartup() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public void setStopTimeout(Duration stopTimeout) {
        this.stopTimeout = stopTimeout;
    }
}
