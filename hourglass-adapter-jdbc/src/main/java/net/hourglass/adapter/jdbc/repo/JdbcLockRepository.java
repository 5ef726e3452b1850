package net.hourglass.adapter.jdbc.repo;

import net.hourglass.adapter.jdbc.JdbcUtil;
import net.hourglass.adapter.jdbc.TxContext;
import net.hourglass.adapter.jdbc.mapper.RowMappers;
import net.hourglass.core.model.Lock;
import net.hourglass.core.spi.Clock;
import net.hourglass.core.spi.LockRepository;

import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

public final class JdbcLockRepository implements LockRepository {
    private final Clock clock;

    public JdbcLockRepository(Clock clock) { this.clock = clock; }

    /** 만료 행 삭제 → PK 충돌 시 무시하는 INSERT. 삽입 1건이면 획득 */
    @Override
    public boolean tryAcquire(String name, String owner, Duration ttl) throws Exception {
        Connection c = TxContext.require();
        Instant now = clock.now();
        deleteExpired(c, now);
        try (var ps = c.prepareStatement("""
                INSERT INTO TB_LOCK (NAME, OWNER, EXPIRES_AT, CREATED_AT)
                VALUES (?, ?, ?, ?)
                ON CONFLICT (NAME) DO NOTHING
            """)) {
            ps.setString(1, name);
            ps.setString(2, owner);
            JdbcUtil.setInstant(ps, 3, now.plus(ttl));
            JdbcUtil.setInstant(ps, 4, now);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public boolean release(String name, String owner) throws Exception {
        try (var ps = TxContext.require().prepareStatement("DELETE FROM TB_LOCK WHERE NAME = ? AND OWNER = ?")) {
            ps.setString(1, name);
            ps.setString(2, owner);
            return ps.executeUpdate() > 0;
        }
    }

    @Override
    public int deleteExpired() throws Exception {
        return deleteExpired(TxContext.require(), clock.now());
    }

    @Override
    public int deleteByName(String name) throws Exception {
        try (var ps = TxContext.require().prepareStatement("DELETE FROM TB_LOCK WHERE NAME = ?")) {
            ps.setString(1, name);
            return ps.executeUpdate();
        }
    }

    @Override
    public Optional<Lock> findByName(String name) throws Exception {
        try (var ps = TxContext.require().prepareStatement("SELECT * FROM TB_LOCK WHERE NAME = ?")) {
            ps.setString(1, name);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toLock(rs)) : Optional.empty();
            }
        }
    }

    private static int deleteExpired(Connection c, Instant now) throws Exception {
        try (var ps = c.prepareStatement("DELETE FROM TB_LOCK WHERE EXPIRES_AT < ?")) {
            JdbcUtil.setInstant(ps, 1, now);
            return ps.executeUpdate();
        }
    }
}
