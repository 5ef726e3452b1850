package net.hourglass.core.model;

import java.time.Instant;
import java.util.List;

public record Job(
        Long id,
        String name,
        boolean enabled,
        Frequency frequency,
        int byHour,         // 0..23
        int byMinute,       // 0..59
        Integer weekday,    // 0=월 .. 6=일, WEEKLY 전용
        int jitterSec,      // 디스패치 전 균등 지연 상한(초)
        ExecutorParams params,
        Instant createdAt,
        Instant updatedAt
) {
    public static final int DEFAULT_JITTER_SEC = 90;

    public enum Frequency {
        HOURLY, DAILY, WEEKLY;

        public static Frequency from(String s) {
            if (s == null) throw new IllegalArgumentException("frequency required");
            return Frequency.valueOf(s.trim().toUpperCase());
        }
        public String code() { return name(); }
    }

    /** 실행기로 그대로 전달되는 파라미터 (코어는 해석하지 않음) */
    public record ExecutorParams(
            String sourceUrl,
            String outputRoot,
            List<String> preferredLangs,
            boolean download
    ) {
        public ExecutorParams {
            if (outputRoot == null || outputRoot.isBlank()) outputRoot = "out";
            preferredLangs = preferredLangs == null ? List.of("zh", "en") : List.copyOf(preferredLangs);
        }

        public static ExecutorParams of(String sourceUrl) {
            return new ExecutorParams(sourceUrl, null, null, true);
        }
    }

    public static Job ofNew(String name, Frequency frequency, int byHour, int byMinute, Integer weekday, int jitterSec,
                            ExecutorParams params) {
        return new Job(null, name, true, frequency, byHour, byMinute, weekday, jitterSec,
                params == null ? ExecutorParams.of(null) : params, null, null);
    }

    public static Job hourly(String name, int byMinute) {
        return ofNew(name, Frequency.HOURLY, 0, byMinute, null, DEFAULT_JITTER_SEC, null);
    }

    public static Job daily(String name, int byHour, int byMinute) {
        return ofNew(name, Frequency.DAILY, byHour, byMinute, null, DEFAULT_JITTER_SEC, null);
    }

    public static Job weekly(String name, int weekday, int byHour, int byMinute) {
        return ofNew(name, Frequency.WEEKLY, byHour, byMinute, weekday, DEFAULT_JITTER_SEC, null);
    }

    public static String lockName(long jobId) {
        return "job:" + jobId;
    }

    /**
     * 저장 경계에서의 보정.
     * - byHour/byMinute 범위 클램프, jitter 음수 불가
     * - weekday는 WEEKLY일 때만 유지(필수), 그 외엔 null
     */
    public Job normalized() {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("job.name is required");
        if (frequency == null) throw new IllegalArgumentException("job.frequency is required");
        Integer wd = null;
        if (frequency == Frequency.WEEKLY) {
            if (weekday == null) throw new IllegalArgumentException("weekday is required for WEEKLY job: " + name);
            wd = clamp(weekday, 0, 6);
        }
        return new Job(id, name.trim(), enabled, frequency,
                clamp(byHour, 0, 23), clamp(byMinute, 0, 59), wd, Math.max(0, jitterSec),
                params == null ? ExecutorParams.of(null) : params,
                createdAt, updatedAt);
    }

    public Job withId(long newId) {
        return new Job(newId, name, enabled, frequency, byHour, byMinute, weekday, jitterSec, params, createdAt, updatedAt);
    }

    public Job withEnabled(boolean on) {
        return new Job(id, name, on, frequency, byHour, byMinute, weekday, jitterSec, params, createdAt, updatedAt);
    }

    public Job withJitterSec(int sec) {
        return new Job(id, name, enabled, frequency, byHour, byMinute, weekday, sec, params, createdAt, updatedAt);
    }

    private static int clamp(int v, int min, int max) {
        return Math.max(min, Math.min(max, v));
    }
}
