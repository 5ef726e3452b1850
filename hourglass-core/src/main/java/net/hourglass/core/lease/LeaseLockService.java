package net.hourglass.core.lease;

import net.hourglass.core.model.Lock;
import net.hourglass.core.spi.LockRepository;
import net.hourglass.core.spi.TxRunner;

import java.lang.management.ManagementFactory;
import java.net.InetAddress;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/** 이름 기반 리스 락 획득/반납/회수 오퍼레이션 */
public final class LeaseLockService {
    private final LockRepository repo;
    private final TxRunner tx;
    private final String sessionToken;
    private final AtomicLong seq = new AtomicLong();

    public LeaseLockService(LockRepository repo, TxRunner tx) {
        this(repo, tx, defaultSessionToken());
    }

    public LeaseLockService(LockRepository repo, TxRunner tx, String sessionToken) {
        this.repo = repo;
        this.tx = tx;
        this.sessionToken = sessionToken;
    }

    /** hostname:pid:uuid */
    public static String defaultSessionToken() {
        String host;
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (Exception e) {
            host = "unknown-host";
        }
        String jvm = ManagementFactory.getRuntimeMXBean().getName(); // pid@host
        String pid = jvm.contains("@") ? jvm.substring(0, jvm.indexOf('@')) : jvm;
        return host + ":" + pid + ":" + UUID.randomUUID();
    }

    /** 디스패치마다 고유한 보유자 토큰 (세션 토큰 + 순번) */
    public String newOwner() {
        return sessionToken + "#" + seq.incrementAndGet();
    }

    public String sessionToken() {
        return sessionToken;
    }

    public boolean tryAcquire(String name, String owner, Duration ttl) throws Exception {
        return tx.requiresNew(() -> repo.tryAcquire(name, owner, ttl));
    }

    /** 반납 (owner 일치 시에만) */
    public boolean release(String name, String owner) throws Exception {
        return tx.requiresNew(() -> repo.release(name, owner));
    }

    /** 만료 락 일괄 회수 */
    public int reclaimExpired() throws Exception {
        return tx.requiresNew(repo::deleteExpired);
    }

    /** 소유자 무관 강제 삭제 (워치독 전용) */
    public int forceRelease(String name) throws Exception {
        return tx.requiresNew(() -> repo.deleteByName(name));
    }

    public Optional<Lock> find(String name) throws Exception {
        return tx.required(() -> repo.findByName(name));
    }
}
