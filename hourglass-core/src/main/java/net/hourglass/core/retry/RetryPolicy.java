package net.hourglass.core.retry;

import java.time.Duration;
import java.util.List;

public interface RetryPolicy {
    /** attempt: 0부터 시작 */
    Duration nextBackoff(long attempt);

    /** 고정 백오프 정책 */
    static RetryPolicy fixed(Duration backoff) {
        return new ScheduleRetryPolicy(List.of(backoff));
    }

    /** 지정 순서 백오프. 목록을 넘으면 마지막 값 유지 */
    static RetryPolicy schedule(Duration... delays) {
        return new ScheduleRetryPolicy(List.of(delays));
    }
}
