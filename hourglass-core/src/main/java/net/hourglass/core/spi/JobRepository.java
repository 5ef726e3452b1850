package net.hourglass.core.spi;

import net.hourglass.core.model.Job;

import java.util.List;
import java.util.Optional;

public interface JobRepository {
    long create(Job job) throws Exception;             // 생성된 ID 반환

    void update(Job job) throws Exception;             // ID 기준 전체 갱신

    /** Job 삭제 + 해당 Run 전부 + "job:<id>" 락 삭제 */
    boolean delete(long jobId) throws Exception;

    Optional<Job> findById(long jobId) throws Exception;

    Optional<Job> findByName(String name) throws Exception;

    /** 최신 생성순 */
    List<Job> findAll(boolean enabledOnly) throws Exception;
}
