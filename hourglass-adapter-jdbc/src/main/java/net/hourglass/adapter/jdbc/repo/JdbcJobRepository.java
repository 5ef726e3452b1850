package net.hourglass.adapter.jdbc.repo;

import net.hourglass.adapter.jdbc.JdbcUtil;
import net.hourglass.adapter.jdbc.TxContext;
import net.hourglass.adapter.jdbc.mapper.RowMappers;
import net.hourglass.core.model.Job;
import net.hourglass.core.spi.Clock;
import net.hourglass.core.spi.JobRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class JdbcJobRepository implements JobRepository {
    private final Clock clock;

    public JdbcJobRepository(Clock clock) { this.clock = clock; }

    @Override
    public long create(Job job) throws Exception {
        Job j = job.normalized();
        Connection c = TxContext.require();
        Instant now = clock.now();
        try (PreparedStatement ps = c.prepareStatement("""
                INSERT INTO TB_JOB
                       (NAME, ENABLED, FREQUENCY, BY_HOUR, BY_MINUTE, WEEKDAY, JITTER_SEC,
                        SOURCE_URL, OUTPUT_ROOT, PREFERRED_LANGS, DO_DOWNLOAD, CREATED_AT, UPDATED_AT)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """)) {
            int i = bindColumns(ps, j);
            JdbcUtil.setInstant(ps, i++, now);
            JdbcUtil.setInstant(ps, i, now);
            ps.executeUpdate();
        }
        return JdbcUtil.lastInsertId(c);
    }

    @Override
    public void update(Job job) throws Exception {
        if (job.id() == null) throw new IllegalArgumentException("job.id required for update");
        Job j = job.normalized();
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                UPDATE TB_JOB
                   SET NAME            = ?,
                       ENABLED         = ?,
                       FREQUENCY       = ?,
                       BY_HOUR         = ?,
                       BY_MINUTE       = ?,
                       WEEKDAY         = ?,
                       JITTER_SEC      = ?,
                       SOURCE_URL      = ?,
                       OUTPUT_ROOT     = ?,
                       PREFERRED_LANGS = ?,
                       DO_DOWNLOAD     = ?,
                       UPDATED_AT      = ?
                 WHERE ID = ?
            """)) {
            int i = bindColumns(ps, j);
            JdbcUtil.setInstant(ps, i++, clock.now());
            ps.setLong(i, j.id());
            if (ps.executeUpdate() == 0) {
                throw new IllegalStateException("TB_JOB not found for ID=" + j.id());
            }
        }
    }

    /** FK CASCADE에 기대지 않고 Run/락까지 같은 트랜잭션에서 명시 삭제 */
    @Override
    public boolean delete(long jobId) throws Exception {
        Connection c = TxContext.require();
        try (var ps = c.prepareStatement("DELETE FROM TB_RUN WHERE JOB_ID = ?")) {
            ps.setLong(1, jobId);
            ps.executeUpdate();
        }
        try (var ps = c.prepareStatement("DELETE FROM TB_LOCK WHERE NAME = ?")) {
            ps.setString(1, Job.lockName(jobId));
            ps.executeUpdate();
        }
        try (var ps = c.prepareStatement("DELETE FROM TB_JOB WHERE ID = ?")) {
            ps.setLong(1, jobId);
            return ps.executeUpdate() > 0;
        }
    }

    @Override
    public Optional<Job> findById(long jobId) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                SELECT *
                  FROM TB_JOB
                 WHERE ID = ?
            """)) {
            ps.setLong(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toJob(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public Optional<Job> findByName(String name) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                SELECT *
                  FROM TB_JOB
                 WHERE UPPER(NAME) = UPPER(?)
                 ORDER BY ID
                 LIMIT 1
            """)) {
            ps.setString(1, name);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toJob(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public List<Job> findAll(boolean enabledOnly) throws Exception {
        String sql = enabledOnly
                ? "SELECT * FROM TB_JOB WHERE ENABLED = 1 ORDER BY CREATED_AT DESC, ID DESC"
                : "SELECT * FROM TB_JOB ORDER BY CREATED_AT DESC, ID DESC";
        try (var ps = TxContext.require().prepareStatement(sql); var rs = ps.executeQuery()) {
            List<Job> out = new ArrayList<>();
            while (rs.next()) out.add(RowMappers.toJob(rs));
            return out;
        }
    }

    /** NAME .. DO_DOWNLOAD 바인딩 후 다음 인덱스 반환 */
    private static int bindColumns(PreparedStatement ps, Job j) throws SQLException {
        int i = 1;
        ps.setString(i++, j.name());
        ps.setInt(i++, j.enabled() ? 1 : 0);
        ps.setString(i++, j.frequency().code());
        ps.setInt(i++, j.byHour());
        ps.setInt(i++, j.byMinute());
        JdbcUtil.setInteger(ps, i++, j.weekday());
        ps.setInt(i++, j.jitterSec());
        ps.setString(i++, j.params().sourceUrl());
        ps.setString(i++, j.params().outputRoot());
        ps.setString(i++, JdbcUtil.joinList(j.params().preferredLangs()));
        ps.setInt(i++, j.params().download() ? 1 : 0);
        return i;
    }
}
