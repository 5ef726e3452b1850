package net.hourglass.adapter.jdbc;

import net.hourglass.adapter.jdbc.repo.JdbcJobRepository;
import net.hourglass.adapter.jdbc.repo.JdbcRunRepository;
import net.hourglass.core.model.Job;
import net.hourglass.core.model.Run;
import net.hourglass.core.spi.JobRepository;
import net.hourglass.core.spi.RunRepository;
import net.hourglass.core.spi.TxRunner;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RunRepositoryAcceptanceTest extends TestSupport {

    static final Instant T0 = Instant.parse("2025-01-06T12:00:00Z");

    TxRunner tx;
    MutableClock clock;
    JobRepository jobs;
    RunRepository runs;
    long jobId;

    @BeforeAll
    void initAll() {
        tx = new JdbcTxRunner(ds);
        clock = new MutableClock(T0);
        jobs = new JdbcJobRepository(clock);
        runs = new JdbcRunRepository(clock);
    }

    @BeforeEach
    void clean() throws Exception {
        deleteAll(tx);
        jobId = tx.required(() -> jobs.create(Job.hourly("runs", 0)));
    }

    @Test
    void create_isIdempotentPerScheduledTime() throws Exception {
        long first = tx.required(() -> runs.create(Run.queued(jobId, T0)));
        long second = tx.required(() -> runs.create(Run.queued(jobId, T0)));
        long other = tx.required(() -> runs.create(Run.queued(jobId, T0.plus(Duration.ofHours(1)))));

        assertTrue(first > 0);
        assertEquals(0L, second, "duplicate (job, scheduled_time) is a no-op");
        assertTrue(other > first);
        assertEquals(2, count(tx, "SELECT COUNT(*) FROM TB_RUN WHERE JOB_ID = ?", jobId));
    }

    @Test
    void create_forUnknownJob_violatesForeignKey() {
        assertThrows(SQLException.class, () -> tx.required(() -> runs.create(Run.queued(424_242L, T0))));
    }

    @Test
    void update_persistsLifecycle() throws Exception {
        long id = tx.required(() -> runs.create(Run.queued(jobId, T0)));
        Run queued = tx.required(() -> runs.findById(id).orElseThrow());
        assertEquals(Run.Status.QUEUED, queued.status());
        assertNull(queued.startTime());

        Run running = queued.running(T0.plusSeconds(5));
        tx.required(() -> { runs.update(running); return null; });
        Run failed = running.withRetryCount(2).failed(Run.Status.ERROR, T0.plusSeconds(60), "x".repeat(800));
        tx.required(() -> { runs.update(failed); return null; });

        Run after = tx.required(() -> runs.findById(id).orElseThrow());
        assertEquals(Run.Status.ERROR, after.status());
        assertEquals(T0.plusSeconds(5), after.startTime());
        assertEquals(T0.plusSeconds(60), after.endTime());
        assertEquals(2, after.retryCount());
        assertEquals(Run.MAX_ERROR_TEXT, after.errorText().length());
    }

    @Test
    void findRecentByJob_newestFirst() throws Exception {
        for (int h = 0; h < 4; h++) {
            Instant at = T0.plus(Duration.ofHours(h));
            tx.required(() -> runs.create(Run.queued(jobId, at)));
        }

        List<Run> recent = tx.required(() -> runs.findRecentByJob(jobId, 2));

        assertEquals(2, recent.size());
        assertEquals(T0.plus(Duration.ofHours(3)), recent.get(0).scheduledTime());
        assertEquals(T0.plus(Duration.ofHours(2)), recent.get(1).scheduledTime());
    }

    @Test
    void deleteAllButNewest_keepsNewestRows() throws Exception {
        for (int h = 0; h < 5; h++) {
            Instant at = T0.plus(Duration.ofHours(h));
            tx.required(() -> runs.create(Run.queued(jobId, at)));
        }

        int deleted = tx.required(() -> runs.deleteAllButNewest(jobId, 2));

        assertEquals(3, deleted);
        List<Run> left = tx.required(() -> runs.findRecentByJob(jobId, 10));
        assertEquals(2, left.size());
        assertEquals(T0.plus(Duration.ofHours(4)), left.get(0).scheduledTime());
        assertEquals(0, tx.required(() -> runs.deleteAllButNewest(jobId, 2)));
    }

    @Test
    void markTimedOut_onlyTouchesRunningRows() throws Exception {
        long id = tx.required(() -> runs.create(Run.queued(jobId, T0)));
        Instant end = T0.plus(Duration.ofHours(1));

        assertFalse(tx.required(() -> runs.markTimedOut(id, end, "stuck")), "QUEUED is not touched");

        Run running = tx.required(() -> runs.findById(id).orElseThrow()).running(T0);
        tx.required(() -> { runs.update(running); return null; });
        assertTrue(tx.required(() -> runs.markTimedOut(id, end, "stuck")));
        assertFalse(tx.required(() -> runs.markTimedOut(id, end, "stuck")), "already TIMEOUT");

        Run after = tx.required(() -> runs.findById(id).orElseThrow());
        assertEquals(Run.Status.TIMEOUT, after.status());
        assertEquals(end, after.endTime());
        assertEquals("stuck", after.errorText());
        assertEquals(List.of(), tx.required(() -> runs.findByStatus(Run.Status.RUNNING)));
    }

    @Test
    void deletingJob_cascadesRuns() throws Exception {
        tx.required(() -> runs.create(Run.queued(jobId, T0)));
        tx.required(() -> {
            try (var ps = TxContext.require().prepareStatement("DELETE FROM TB_JOB WHERE ID = ?")) {
                ps.setLong(1, jobId);
                ps.executeUpdate();
            }
            return null;
        });

        assertEquals(0, count(tx, "SELECT COUNT(*) FROM TB_RUN WHERE JOB_ID = ?", jobId));
    }

    @Test
    void updateIfActive_neverRewritesFinishedRow() throws Exception {
        long id = tx.required(() -> runs.create(Run.queued(jobId, T0)));
        Run running = Run.queued(jobId, T0).withId(id).running(T0.plusSeconds(1));

        assertTrue(tx.required(() -> runs.updateIfActive(running)), "QUEUED -> RUNNING");
        assertTrue(tx.required(() -> runs.markTimedOut(id, T0.plusSeconds(3600), "stuck")));

        Run late = running.succeeded(T0.plusSeconds(4000), "late");
        assertFalse(tx.required(() -> runs.updateIfActive(late)));

        Run after = tx.required(() -> runs.findById(id).orElseThrow());
        assertEquals(Run.Status.TIMEOUT, after.status());
        assertEquals("stuck", after.errorText());
        assertNull(after.runDir());
        assertEquals(T0.plusSeconds(3600), after.endTime());
    }
}
