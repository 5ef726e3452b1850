package net.hourglass.core.ticker;

import net.hourglass.core.spi.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * 고정 주기로 target.tick(now)를 호출하는 백그라운드 루프.
 * 주기 대기는 1초 단위로 쪼개 stop 신호를 확인한다.
 */
public final class Ticker {
    private static final Logger log = LoggerFactory.getLogger(Ticker.class);

    public static final Duration MIN_INTERVAL = Duration.ofSeconds(10);
    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(60);
    static final Duration SLICE = Duration.ofSeconds(1);

    @FunctionalInterface
    public interface Target {
        void tick(Instant now) throws Exception;
    }

    private final Target target;
    private final Duration interval;
    private final Clock clock;

    private Thread thread;
    private volatile CountDownLatch stopSignal;
    private volatile CountDownLatch exited;

    public Ticker(Target target, Duration interval, Clock clock) {
        this.target = target;
        this.interval = (interval == null || interval.compareTo(MIN_INTERVAL) < 0)
                ? (interval == null ? DEFAULT_INTERVAL : MIN_INTERVAL)
                : interval;
        this.clock = clock;
    }

    /** 이전 루프 스레드가 아직 살아 있으면(시간 초과된 stop 포함) 새 루프를 만들지 않는다 */
    public synchronized void start() {
        if (thread != null && thread.isAlive()) {
            if (!isRunning()) log.warn("Previous ticker loop is still finishing, start skipped");
            return;
        }
        stopSignal = new CountDownLatch(1);
        exited = new CountDownLatch(1);
        CountDownLatch stop = stopSignal;
        CountDownLatch done = exited;
        thread = new Thread(() -> loop(stop, done), "hourglass-ticker");
        thread.setDaemon(true);
        thread.start();
        log.info("Ticker started (interval={}s)", interval.toSeconds());
    }

    /** 정지 요청 후 timeout까지 대기. 루프가 시간 안에 끝났으면 true */
    public synchronized boolean stop(Duration timeout) throws InterruptedException {
        if (thread == null) return true;
        stopSignal.countDown();
        boolean ok = exited.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (ok) {
            thread = null;
            log.info("Ticker stopped");
        } else {
            log.warn("Ticker did not stop within {}", timeout);
        }
        return ok;
    }

    public synchronized boolean isRunning() {
        return thread != null && thread.isAlive() && stopSignal.getCount() > 0;
    }

    public Duration interval() {
        return interval;
    }

    private void loop(CountDownLatch stop, CountDownLatch done) {
        try {
            while (stop.getCount() > 0) {
                try {
                    target.tick(clock.now());
                } catch (Exception e) {
                    log.error("tick failed", e);
                }
                if (waitInterval(stop)) break;
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        } finally {
            done.countDown();
        }
    }

    /** 1초 조각으로 대기. stop 신호면 true */
    private boolean waitInterval(CountDownLatch stop) throws InterruptedException {
        long remaining = interval.toMillis();
        while (remaining > 0) {
            long slice = Math.min(remaining, SLICE.toMillis());
            if (stop.await(slice, TimeUnit.MILLISECONDS)) return true;
            remaining -= slice;
        }
        return false;
    }
}
