package net.hourglass.core.model;

import java.time.Instant;

public record Run(
        Long id,
        long jobId,
        Instant scheduledTime,  // 중복 방지 키 (job_id, scheduled_time)
        Instant startTime,
        Instant endTime,
        Status status,          // QUEUED/RUNNING/SUCCESS/ERROR/SKIPPED/TIMEOUT
        String errorText,
        String runDir,
        int retryCount,
        Instant createdAt
) {
    public static final int MAX_ERROR_TEXT = 500;

    public enum Status {
        QUEUED, RUNNING, SUCCESS, ERROR, SKIPPED, TIMEOUT, UNKNOWN;

        public static Status from(String s) {
            if (s == null) return UNKNOWN;
            try { return Status.valueOf(s.toUpperCase()); } catch (IllegalArgumentException e) { return UNKNOWN; }
        }
        public String code() { return name(); }

        public boolean isFailure() { return this == ERROR || this == TIMEOUT; }
    }

    public static Run queued(long jobId, Instant scheduledTime) {
        return new Run(null, jobId, scheduledTime, null, null, Status.QUEUED, null, null, 0, null);
    }

    public Run withId(long newId) {
        return new Run(newId, jobId, scheduledTime, startTime, endTime, status, errorText, runDir, retryCount, createdAt);
    }

    public Run running(Instant start) {
        return new Run(id, jobId, scheduledTime, start, null, Status.RUNNING, errorText, runDir, retryCount, createdAt);
    }

    public Run withRetryCount(int count) {
        return new Run(id, jobId, scheduledTime, startTime, endTime, status, errorText, runDir, count, createdAt);
    }

    public Run succeeded(Instant end, String dir) {
        return new Run(id, jobId, scheduledTime, startTime, end, Status.SUCCESS, "", dir, retryCount, createdAt);
    }

    public Run failed(Status terminal, Instant end, String error) {
        return new Run(id, jobId, scheduledTime, startTime, end, terminal, truncate(error, MAX_ERROR_TEXT), runDir,
                retryCount, createdAt);
    }

    public static String truncate(String s, int max) {
        if (s == null) return null;
        return s.length() <= max ? s : s.substring(0, max);
    }
}
