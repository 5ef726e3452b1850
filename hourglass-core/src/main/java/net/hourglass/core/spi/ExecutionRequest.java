package net.hourglass.core.spi;

import net.hourglass.core.model.Job;

import java.time.Instant;

public record ExecutionRequest(
        long jobId,
        String jobName,
        long runId,
        Instant scheduledTime,
        Job.ExecutorParams params
) {
}
