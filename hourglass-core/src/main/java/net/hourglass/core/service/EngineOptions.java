package net.hourglass.core.service;

import net.hourglass.core.retry.RetryPolicy;

import java.time.Duration;

public record EngineOptions(
        int maxConcurrency,
        Duration lockTtl,
        int keepRuns,            // 성공 후 잡당 보존 Run 수
        int maxRetries,          // 실행기 재시도 횟수 (최초 시도 제외)
        RetryPolicy retryBackoff
) {
    public EngineOptions {
        if (maxConcurrency < 1) throw new IllegalArgumentException("maxConcurrency must be >= 1");
        if (keepRuns < 1) throw new IllegalArgumentException("keepRuns must be >= 1");
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
    }

    public static EngineOptions defaults() {
        return new EngineOptions(2, Duration.ofHours(1), 100, 3,
                RetryPolicy.schedule(Duration.ofSeconds(60), Duration.ofSeconds(120), Duration.ofSeconds(240)));
    }

    public EngineOptions withMaxConcurrency(int n) {
        return new EngineOptions(n, lockTtl, keepRuns, maxRetries, retryBackoff);
    }
}
