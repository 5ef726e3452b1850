package net.hourglass.core.spi;

import net.hourglass.core.model.Lock;

import java.time.Duration;
import java.util.Optional;

public interface LockRepository {
    /** 만료 행 정리 후 insert-if-absent. 삽입됐을 때만 true */
    boolean tryAcquire(String name, String owner, Duration ttl) throws Exception;

    boolean release(String name, String owner) throws Exception;   // name + owner 일치 시에만

    int deleteExpired() throws Exception;

    int deleteByName(String name) throws Exception;

    Optional<Lock> findByName(String name) throws Exception;
}
