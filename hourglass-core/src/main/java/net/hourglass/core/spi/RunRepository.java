package net.hourglass.core.spi;

import net.hourglass.core.model.Run;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface RunRepository {
    /** (jobId, scheduledTime)가 이미 있으면 0 반환 (예외 아님) */
    long create(Run run) throws Exception;

    void update(Run run) throws Exception;

    /** QUEUED/RUNNING 행에만 반영. 이미 종결된 행이면 false */
    boolean updateIfActive(Run run) throws Exception;

    Optional<Run> findById(long runId) throws Exception;

    /** 최신순 최대 limit건 */
    List<Run> findRecentByJob(long jobId, int limit) throws Exception;

    List<Run> findByStatus(Run.Status status) throws Exception;

    /** 최신 keepCount건만 남기고 삭제 */
    int deleteAllButNewest(long jobId, int keepCount) throws Exception;

    /** RUNNING 상태일 때만 TIMEOUT 전환 */
    boolean markTimedOut(long runId, Instant endTime, String error) throws Exception;
}
