package net.hourglass.core.service;

import net.hourglass.core.lease.LeaseLockService;
import net.hourglass.core.model.Job;
import net.hourglass.core.model.Run;
import net.hourglass.core.spi.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * tick → dispatch → execute.
 * - 잡별 리스 락("job:<id>")으로 잡당 동시 실행 1건
 * - runningCount(뮤텍스 보호)로 프로세스 전체 동시 실행 상한
 * - (job_id, scheduled_time) 유니크로 멱등 디스패치
 */
public final class SchedulingEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SchedulingEngine.class);

    /** 실행기 실패 메시지에 하나라도 포함되면 재시도 (대소문자 무시) */
    public static final List<String> RETRYABLE_KEYWORDS = List.of(
            "429", "403", "5", "network", "timeout", "connection", "temporarily unavailable");
    static final int NOTIFY_ERROR_MAX = 200;
    public static final String REJECTED_ERROR = "rejected: engine closed";

    private final JobRepository jobs;
    private final RunRepository runs;
    private final LeaseLockService leases;
    private final TxRunner tx;
    private final Clock clock;
    private final DueTimeCalculator dueTimes;
    private final PipelineExecutor executor;
    private final RunNotifier notifier;
    private final Sleeper sleeper;
    private final EngineOptions options;
    private final ExecutorService workers;

    private final Object mutex = new Object();
    private int runningCount;

    public SchedulingEngine(JobRepository jobs,
                            RunRepository runs,
                            LeaseLockService leases,
                            TxRunner tx,
                            Clock clock,
                            DueTimeCalculator dueTimes,
                            PipelineExecutor executor,
                            RunNotifier notifier,
                            Sleeper sleeper,
                            EngineOptions options) {
        this.jobs = jobs;
        this.runs = runs;
        this.leases = leases;
        this.tx = tx;
        this.clock = clock;
        this.dueTimes = dueTimes;
        this.executor = executor;
        this.notifier = notifier == null ? RunNotifier.noop() : notifier;
        this.sleeper = sleeper;
        this.options = options;
        AtomicInteger n = new AtomicInteger();
        this.workers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "hourglass-run-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /** 활성 잡 순회(최신 생성순) → due면 디스패치. 디스패치 제출 건수 반환 */
    public int tick(Instant now) throws Exception {
        List<Job> enabled = tx.required(() -> jobs.findAll(true));
        log.debug("tick at {}, checking {} jobs", now, enabled.size());

        int dispatched = 0;
        for (Job job : enabled) {
            try {
                Instant dueAt = dueTimes.nextDue(job, now);
                if (dueAt == null || dueAt.isAfter(now)) continue;

                List<Run> recent = tx.required(() -> runs.findRecentByJob(job.id(), 1));
                if (!recent.isEmpty() && !recent.get(0).scheduledTime().isBefore(dueAt)) {
                    log.debug("Job {} already has a run for {}, skip", job.id(), dueAt);
                    continue;
                }
                if (dispatch(job, dueAt, now) == DispatchResult.DISPATCHED) dispatched++;
            } catch (Exception e) {
                log.error("tick failed for job {} '{}'", job.id(), job.name(), e);
            }
        }
        return dispatched;
    }

    public DispatchResult dispatch(Job job, Instant dueTime, Instant now) {
        if (workers.isShutdown()) {
            log.warn("Engine closed, job {} not dispatched", job.id());
            return DispatchResult.FAILED;
        }
        String lockName = Job.lockName(job.id());
        String owner = leases.newOwner();

        // 1) 잡 락
        try {
            if (!leases.tryAcquire(lockName, owner, options.lockTtl())) {
                log.debug("Job {} is locked, skip", job.id());
                return DispatchResult.LOCKED;
            }
        } catch (Exception e) {
            log.error("Lock acquire failed for job {}", job.id(), e);
            return DispatchResult.FAILED;
        }

        // 2) 전역 동시 실행 한도
        boolean saturated;
        synchronized (mutex) {
            saturated = runningCount >= options.maxConcurrency();
            if (!saturated) runningCount++;
        }
        if (saturated) {
            log.debug("Max concurrency {} reached, skip job {}", options.maxConcurrency(), job.id());
            releaseQuietly(lockName, owner);
            return DispatchResult.SATURATED;
        }

        // 3) Run 생성 → 비동기 제출. 제출 전에 빠지면 여기서 정리, 제출 후엔 작업이 정리
        boolean handedOff = false;
        try {
            Duration jitter = Duration.ofSeconds(ThreadLocalRandom.current().nextInt(0, job.jitterSec() + 1));
            long runId = tx.required(() -> runs.create(Run.queued(job.id(), dueTime)));
            if (runId == 0) {
                log.debug("Run already exists for job {} at {}", job.id(), dueTime);
                return DispatchResult.DUPLICATE;
            }
            Run run = Run.queued(job.id(), dueTime).withId(runId);
            try {
                workers.execute(() -> runWithCleanup(job, run, jitter, lockName, owner));
            } catch (RejectedExecutionException rej) {
                // 삽입된 QUEUED 행이 슬롯을 영구 점유하지 않도록 종결
                finishFailed(job, run, REJECTED_ERROR);
                return DispatchResult.FAILED;
            }
            handedOff = true;
            log.info("Dispatched job {} '{}' run {} (due={}, jitter={}s)",
                    job.id(), job.name(), runId, dueTime, jitter.toSeconds());
            return DispatchResult.DISPATCHED;
        } catch (Exception e) {
            log.error("Dispatch failed for job {}", job.id(), e);
            return DispatchResult.FAILED;
        } finally {
            if (!handedOff) {
                decrement();
                releaseQuietly(lockName, owner);
            }
        }
    }

    private void runWithCleanup(Job job, Run run, Duration jitter, String lockName, String owner) {
        try {
            if (!jitter.isZero()) sleeper.sleep(jitter);
            execute(job, run);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            finishFailed(job, run, "interrupted before start");
        } finally {
            decrement();
            releaseQuietly(lockName, owner);
        }
    }

    /**
     * RUNNING 전환 후 실행기 호출. 재시도 가능한 실패는 고정 백오프로 최대 maxRetries회 재시도.
     * 실행기 예외는 밖으로 던지지 않고 Run 상태로 종결한다. Error는 ERROR로 종결한 뒤 다시 던진다.
     * 이미 종결된 행(워치독 TIMEOUT)은 덮어쓰지 않고, 그때는 정리/알림도 하지 않는다.
     */
    public Run execute(Job job, Run queued) {
        log.info("Starting run {} for job {} '{}'", queued.id(), job.id(), job.name());
        Run run = queued.running(clock.now());
        if (!saveActive(run)) return current(run);

        int maxRetries = options.maxRetries();
        for (int attempt = 0; ; attempt++) {
            ExecutionResult result;
            try {
                result = invoke(job, run);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return finishFailed(job, run.withRetryCount(attempt), "interrupted");
            } catch (Error err) {
                // 실행기 Error도 Run은 ERROR로 종결 후 그대로 전파
                finishFailed(job, run.withRetryCount(attempt), messageOf(err));
                throw err;
            } catch (Exception e) {
                String msg = messageOf(e);
                if (attempt < maxRetries && isRetryable(msg)) {
                    Duration delay = options.retryBackoff().nextBackoff(attempt);
                    log.warn("Run {} failed (attempt {}/{}), retry in {}s: {}",
                            run.id(), attempt + 1, maxRetries, delay.toSeconds(), Run.truncate(msg, 100));
                    run = run.withRetryCount(attempt + 1);
                    if (!saveActive(run)) return current(run);
                    try {
                        sleeper.sleep(delay);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        return finishFailed(job, run, "interrupted while waiting to retry: " + msg);
                    }
                    continue;
                }
                return finishFailed(job, run.withRetryCount(attempt), msg);
            }
            return finishSucceeded(job, run, result);
        }
    }

    /** 관리용 즉시 실행. scheduled_time=now, 락/동시성 제한 없음. 생성된 Run ID 반환 */
    public Optional<Long> runOnce(long jobId) throws Exception {
        if (workers.isShutdown()) {
            log.warn("Engine closed, run-once of job {} ignored", jobId);
            return Optional.empty();
        }
        Optional<Job> job = tx.required(() -> jobs.findById(jobId));
        if (job.isEmpty()) {
            log.error("Job {} not found", jobId);
            return Optional.empty();
        }
        Instant now = clock.now();
        long runId = tx.required(() -> runs.create(Run.queued(jobId, now)));
        if (runId == 0) {
            log.warn("Run already exists for job {} at {}", jobId, now);
            return Optional.empty();
        }
        Run run = Run.queued(jobId, now).withId(runId);
        try {
            workers.execute(() -> execute(job.get(), run));
        } catch (RejectedExecutionException rej) {
            finishFailed(job.get(), run, REJECTED_ERROR);
            return Optional.empty();
        }
        return Optional.of(runId);
    }

    public static boolean isRetryable(String message) {
        if (message == null) return false;
        String lower = message.toLowerCase(Locale.ROOT);
        for (String k : RETRYABLE_KEYWORDS) {
            if (lower.contains(k)) return true;
        }
        return false;
    }

    public int runningCount() {
        synchronized (mutex) {
            return runningCount;
        }
    }

    public EngineOptions options() {
        return options;
    }

    /** 신규 제출 중단. 진행 중 실행은 끝까지 수행 */
    @Override
    public void close() {
        workers.shutdown();
    }

    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return workers.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    // --- internals ---

    private ExecutionResult invoke(Job job, Run run) throws Exception {
        if (executor == null) throw new IllegalStateException("Executor not set");
        ExecutionResult r = executor.execute(
                new ExecutionRequest(job.id(), job.name(), run.id(), run.scheduledTime(), job.params()));
        return r == null ? ExecutionResult.of("") : r;
    }

    private Run finishSucceeded(Job job, Run run, ExecutionResult result) {
        Run done = run.succeeded(clock.now(), result.runDir());
        if (!saveActive(done)) return current(done);
        log.info("Run {} succeeded (job {}, retries={})", done.id(), job.id(), done.retryCount());

        try {
            int pruned = tx.required(() -> runs.deleteAllButNewest(job.id(), options.keepRuns()));
            if (pruned > 0) log.debug("Pruned {} old runs of job {}", pruned, job.id());
        } catch (Exception e) {
            log.warn("Failed to prune runs of job {}", job.id(), e);
        }

        Map<String, Object> payload = basePayload(job, done, "success");
        payload.put("run_dir", done.runDir());
        notifyQuietly(RunNotifier.JOB_FINISHED, payload);
        return done;
    }

    private Run finishFailed(Job job, Run run, String error) {
        Run failed = run.failed(Run.Status.ERROR, clock.now(), error);
        if (!saveActive(failed)) return current(failed);
        log.error("Run {} failed after {} attempt(s): {}",
                failed.id(), failed.retryCount() + 1, Run.truncate(error, NOTIFY_ERROR_MAX));

        Map<String, Object> payload = basePayload(job, failed, "error");
        payload.put("error", Run.truncate(error, NOTIFY_ERROR_MAX));
        notifyQuietly(RunNotifier.JOB_FAILED, payload);
        return failed;
    }

    private Map<String, Object> basePayload(Job job, Run run, String status) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("job_id", job.id());
        p.put("job_name", job.name());
        p.put("run_id", run.id());
        p.put("status", status);
        return p;
    }

    /** 아직 종결되지 않은 행에만 반영. 워치독 TIMEOUT 등으로 이미 종결됐거나 저장 실패면 false */
    private boolean saveActive(Run run) {
        try {
            boolean applied = tx.required(() -> runs.updateIfActive(run));
            if (!applied) log.warn("Run {} already finalized, {} not recorded", run.id(), run.status());
            return applied;
        } catch (Exception e) {
            log.error("Failed to persist run {} ({})", run.id(), run.status(), e);
            return false;
        }
    }

    /** 저장된 현재 행. 조회 실패 시 메모리 상태 그대로 */
    private Run current(Run run) {
        try {
            return tx.required(() -> runs.findById(run.id())).orElse(run);
        } catch (Exception e) {
            log.warn("Failed to reload run {}", run.id(), e);
            return run;
        }
    }

    private void notifyQuietly(String event, Map<String, Object> payload) {
        try {
            notifier.notify(event, payload);
        } catch (Exception e) {
            log.warn("Notifier failed for {} {}", event, payload.get("run_id"), e);
        }
    }

    private void releaseQuietly(String lockName, String owner) {
        try {
            if (!leases.release(lockName, owner)) {
                log.warn("Lock {} was no longer held by {}", lockName, owner);
            }
        } catch (Exception e) {
            log.error("Failed to release lock {}", lockName, e);
        }
    }

    private void decrement() {
        synchronized (mutex) {
            runningCount--;
        }
    }

    private static String messageOf(Throwable e) {
        String m = e.getMessage();
        return (m == null || m.isBlank()) ? e.getClass().getName() : m;
    }
}
