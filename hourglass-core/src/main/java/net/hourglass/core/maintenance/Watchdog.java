package net.hourglass.core.maintenance;

import net.hourglass.core.lease.LeaseLockService;
import net.hourglass.core.model.Job;
import net.hourglass.core.model.Run;
import net.hourglass.core.spi.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class Watchdog {
    private static final Logger log = LoggerFactory.getLogger(Watchdog.class);

    public static final String STUCK_ERROR = "Stuck kill by watchdog";

    public static final String EVENT_STUCK_KILL = "stuck_kill";
    public static final String EVENT_ORPHAN_LOCK_CLEANUP = "orphan_lock_cleanup";
    public static final String EVENT_CONSECUTIVE_FAILURES = "consecutive_failures";

    private final JobRepository jobs;
    private final RunRepository runs;
    private final LeaseLockService leases;
    private final TxRunner tx;
    private final Clock clock;
    private final EventLog events;
    private final WatchdogOptions options;

    public Watchdog(JobRepository jobs,
                    RunRepository runs,
                    LeaseLockService leases,
                    TxRunner tx,
                    Clock clock,
                    EventLog events,
                    WatchdogOptions options) {
        this.jobs = jobs;
        this.runs = runs;
        this.leases = leases;
        this.tx = tx;
        this.clock = clock;
        this.events = events;
        this.options = options;
    }

    /**
     * 주기 점검 메인 루틴.
     * - 멈춘 RUNNING → TIMEOUT (+ 잡 락 삭제)
     * - 만료 락 정리
     * - 연속 실패 잡 감지 (자동 비활성화는 하지 않음)
     * 각 단계 실패는 로그만 남기고 다음 단계 진행
     */
    public WatchdogReport checkAndHeal() {
        Instant now = clock.now();
        WatchdogReport r = new WatchdogReport();
        r.timestamp = now;
        if (!options.enabled()) return r;

        // 1) stuck run
        try {
            r.stuckKilled = killStuckRuns(now);
        } catch (Exception e) {
            log.error("Stuck run check failed", e);
        }

        // 2) orphan lock
        try {
            r.orphanLocksRemoved = leases.reclaimExpired();
            if (r.orphanLocksRemoved > 0) {
                log.warn("Removed {} expired locks", r.orphanLocksRemoved);
                emit(EVENT_ORPHAN_LOCK_CLEANUP, now, fields("count", r.orphanLocksRemoved));
            }
        } catch (Exception e) {
            log.error("Orphan lock cleanup failed", e);
        }

        // 3) 연속 실패
        try {
            r.chronicFailures = detectConsecutiveFailures(now);
        } catch (Exception e) {
            log.error("Consecutive failure check failed", e);
        }

        if (r.stuckKilled > 0 || r.orphanLocksRemoved > 0 || !r.chronicFailures.isEmpty()) {
            log.info("{}", r);
        }
        return r;
    }

    private int killStuckRuns(Instant now) throws Exception {
        Duration threshold = options.stuckThreshold();
        List<Run> running = tx.required(() -> runs.findByStatus(Run.Status.RUNNING));
        int killed = 0;
        for (Run run : running) {
            if (run.startTime() == null) continue;
            Duration elapsed = Duration.between(run.startTime(), now);
            if (elapsed.compareTo(threshold) <= 0) continue;

            boolean marked = tx.required(() -> runs.markTimedOut(run.id(), now, STUCK_ERROR));
            if (!marked) continue;
            killed++;
            leases.forceRelease(Job.lockName(run.jobId()));
            log.warn("Killed stuck run {} (job {}, elapsed {}s)", run.id(), run.jobId(), elapsed.toSeconds());

            Map<String, Object> f = fields("run_id", run.id());
            f.put("job_id", run.jobId());
            f.put("elapsed_sec", elapsed.toSeconds());
            emit(EVENT_STUCK_KILL, now, f);
        }
        return killed;
    }

    private List<Long> detectConsecutiveFailures(Instant now) throws Exception {
        int n = options.maxConsecutiveFailures();
        List<Long> flagged = new ArrayList<>();
        for (Job job : tx.required(() -> jobs.findAll(true))) {
            List<Run> recent = tx.required(() -> runs.findRecentByJob(job.id(), n));
            if (recent.size() < n) continue;
            boolean allFailed = recent.stream().allMatch(x -> x.status().isFailure());
            if (!allFailed) continue;

            flagged.add(job.id());
            log.error("Job {} '{}' failed {} times in a row", job.id(), job.name(), n);
            Map<String, Object> f = fields("job_id", job.id());
            f.put("job_name", job.name());
            f.put("failure_count", n);
            emit(EVENT_CONSECUTIVE_FAILURES, now, f);
        }
        return flagged;
    }

    private void emit(String type, Instant now, Map<String, Object> f) {
        f.put("timestamp", now.toString());
        events.append(type, f);
    }

    private static Map<String, Object> fields(String key, Object value) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put(key, value);
        return m;
    }

    /** 간단 리포트 DTO */
    public static final class WatchdogReport {
        public Instant timestamp;
        public int stuckKilled;
        public int orphanLocksRemoved;
        public List<Long> chronicFailures = new ArrayList<>();

        @Override public String toString() {
            return "WatchdogReport{" +
                    "timestamp=" + timestamp +
                    ", stuckKilled=" + stuckKilled +
                    ", orphanLocksRemoved=" + orphanLocksRemoved +
                    ", chronicFailures=" + chronicFailures +
                    '}';
        }
    }
}
