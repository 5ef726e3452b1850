package net.hourglass.adapter.jdbc;

import net.hourglass.adapter.jdbc.repo.JdbcJobRepository;
import net.hourglass.adapter.jdbc.repo.JdbcLockRepository;
import net.hourglass.adapter.jdbc.repo.JdbcRunRepository;
import net.hourglass.core.lease.LeaseLockService;
import net.hourglass.core.model.Job;
import net.hourglass.core.model.Run;
import net.hourglass.core.service.DueTimeCalculator;
import net.hourglass.core.service.EngineOptions;
import net.hourglass.core.service.SchedulingEngine;
import net.hourglass.core.spi.*;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

@TestMethodOrder(MethodOrderer.MethodName.class)
class ConcurrentDispatchAcceptanceTest extends TestSupport {

    static final Instant NOW = Instant.parse("2025-01-06T12:00:05Z");
    static final int JOBS = 6;

    TxRunner tx;
    MutableClock clock;
    JobRepository jobs;
    RunRepository runs;
    LeaseLockService leases;
    List<Long> jobIds;

    final AtomicInteger active = new AtomicInteger();
    final AtomicInteger peak = new AtomicInteger();

    @BeforeAll
    void initAll() {
        tx = new JdbcTxRunner(ds);
        clock = new MutableClock(NOW);
        jobs = new JdbcJobRepository(clock);
        runs = new JdbcRunRepository(clock);
        leases = new LeaseLockService(new JdbcLockRepository(clock), tx);
    }

    @BeforeEach
    void seed() throws Exception {
        deleteAll(tx);
        active.set(0);
        peak.set(0);
        jobIds = new ArrayList<>();
        for (int i = 0; i < JOBS; i++) {
            String name = "job-" + i;
            jobIds.add(tx.required(() -> jobs.create(Job.hourly(name, 0).withJitterSec(0))));
        }
    }

    SchedulingEngine engine(PipelineExecutor executor) {
        return new SchedulingEngine(jobs, runs, leases, tx, clock, new DueTimeCalculator(ZoneOffset.UTC),
                executor, RunNotifier.noop(), d -> { }, EngineOptions.defaults().withMaxConcurrency(2));
    }

    /** 동시 실행 수를 기록하면서 gate가 열릴 때까지 대기 */
    PipelineExecutor gated(CountDownLatch gate) {
        return req -> {
            int now = active.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            try {
                if (!gate.await(20, TimeUnit.SECONDS)) throw new IllegalStateException("gate timeout");
                return ExecutionResult.of("");
            } finally {
                active.decrementAndGet();
            }
        };
    }

    int successCount() throws Exception {
        return tx.required(() -> runs.findByStatus(Run.Status.SUCCESS)).size();
    }

    int runsOf(long jobId) throws Exception {
        return count(tx, "SELECT COUNT(*) FROM TB_RUN WHERE JOB_ID = ?", jobId);
    }

    boolean noLocksHeld() throws Exception {
        for (long id : jobIds) {
            if (leases.find(Job.lockName(id)).isPresent()) return false;
        }
        return true;
    }

    @Test
    void a1_tick_respectsGlobalConcurrencyLimit() throws Exception {
        CountDownLatch gate = new CountDownLatch(1);
        try (SchedulingEngine engine = engine(gated(gate))) {
            assertEquals(2, engine.tick(NOW));
            assertEquals(2, engine.runningCount());
            assertEquals(0, engine.tick(NOW), "still saturated");

            gate.countDown();
            await().atMost(Duration.ofSeconds(30)).pollInterval(Duration.ofMillis(100)).until(() -> {
                engine.tick(NOW);
                return successCount() == JOBS;
            });

            assertTrue(peak.get() <= 2, "peak=" + peak.get());
            for (long id : jobIds) assertEquals(1, runsOf(id), "job " + id);
            await().atMost(Duration.ofSeconds(10)).until(() -> engine.runningCount() == 0 && noLocksHeld());
        }
    }

    @Test
    void a2_concurrentTicks_dispatchEachSlotOnce() throws Exception {
        CountDownLatch gate = new CountDownLatch(0);
        int threads = 4;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try (SchedulingEngine engine = engine(gated(gate))) {
            CountDownLatch start = new CountDownLatch(1);
            List<Future<Integer>> fs = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                fs.add(pool.submit(() -> {
                    start.await();
                    int total = 0;
                    for (int i = 0; i < 20; i++) {
                        total += engine.tick(NOW);
                        Thread.sleep(20);
                    }
                    return total;
                }));
            }
            start.countDown();
            int dispatched = 0;
            for (Future<Integer> f : fs) dispatched += f.get(60, TimeUnit.SECONDS);

            await().atMost(Duration.ofSeconds(30)).pollInterval(Duration.ofMillis(100)).until(() -> {
                engine.tick(NOW);
                return successCount() == JOBS;
            });

            assertTrue(dispatched <= JOBS, "dispatched=" + dispatched);
            assertTrue(peak.get() <= 2, "peak=" + peak.get());
            for (long id : jobIds) assertEquals(1, runsOf(id), "job " + id);

            await().atMost(Duration.ofSeconds(10)).until(() -> engine.runningCount() == 0 && noLocksHeld());
        } finally {
            pool.shutdownNow();
        }
    }
}
