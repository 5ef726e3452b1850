package net.hourglass.adapter.jdbc.repo;

import net.hourglass.adapter.jdbc.JdbcUtil;
import net.hourglass.adapter.jdbc.TxContext;
import net.hourglass.adapter.jdbc.mapper.RowMappers;
import net.hourglass.core.model.Run;
import net.hourglass.core.spi.Clock;
import net.hourglass.core.spi.RunRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class JdbcRunRepository implements RunRepository {
    private final Clock clock;

    public JdbcRunRepository(Clock clock) { this.clock = clock; }

    /** UNIQUE(JOB_ID, SCHEDULED_TIME) 충돌 시 아무것도 하지 않고 0 */
    @Override
    public long create(Run run) throws Exception {
        Connection c = TxContext.require();
        int inserted;
        try (PreparedStatement ps = c.prepareStatement("""
                INSERT INTO TB_RUN
                       (JOB_ID, SCHEDULED_TIME, START_TIME, END_TIME, STATUS,
                        ERROR_TEXT, RUN_DIR, RETRY_COUNT, CREATED_AT)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT (JOB_ID, SCHEDULED_TIME) DO NOTHING
            """)) {
            int i = 1;
            ps.setLong(i++, run.jobId());
            JdbcUtil.setInstant(ps, i++, run.scheduledTime());
            JdbcUtil.setInstant(ps, i++, run.startTime());
            JdbcUtil.setInstant(ps, i++, run.endTime());
            ps.setString(i++, run.status().code());
            ps.setString(i++, Run.truncate(run.errorText(), Run.MAX_ERROR_TEXT));
            ps.setString(i++, run.runDir());
            ps.setInt(i++, run.retryCount());
            JdbcUtil.setInstant(ps, i, clock.now());
            inserted = ps.executeUpdate();
        }
        return inserted == 0 ? 0L : JdbcUtil.lastInsertId(c);
    }

    @Override
    public void update(Run run) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                UPDATE TB_RUN
                   SET START_TIME  = ?,
                       END_TIME    = ?,
                       STATUS      = ?,
                       ERROR_TEXT  = ?,
                       RUN_DIR     = ?,
                       RETRY_COUNT = ?
                 WHERE ID = ?
            """)) {
            bindMutable(ps, run);
            if (ps.executeUpdate() == 0) {
                throw new IllegalStateException("TB_RUN not found for ID=" + run.id());
            }
        }
    }

    /** 워치독이 먼저 종결한 행(TIMEOUT)을 되살리지 않도록 상태 조건부 갱신 */
    @Override
    public boolean updateIfActive(Run run) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                UPDATE TB_RUN
                   SET START_TIME  = ?,
                       END_TIME    = ?,
                       STATUS      = ?,
                       ERROR_TEXT  = ?,
                       RUN_DIR     = ?,
                       RETRY_COUNT = ?
                 WHERE ID = ?
                   AND STATUS IN ('QUEUED', 'RUNNING')
            """)) {
            bindMutable(ps, run);
            return ps.executeUpdate() == 1;
        }
    }

    /** START_TIME .. RETRY_COUNT, ID */
    private static void bindMutable(PreparedStatement ps, Run run) throws Exception {
        int i = 1;
        JdbcUtil.setInstant(ps, i++, run.startTime());
        JdbcUtil.setInstant(ps, i++, run.endTime());
        ps.setString(i++, run.status().code());
        ps.setString(i++, Run.truncate(run.errorText(), Run.MAX_ERROR_TEXT));
        ps.setString(i++, run.runDir());
        ps.setInt(i++, run.retryCount());
        ps.setLong(i, run.id());
    }

    @Override
    public Optional<Run> findById(long runId) throws Exception {
        try (var ps = TxContext.require().prepareStatement("SELECT * FROM TB_RUN WHERE ID = ?")) {
            ps.setLong(1, runId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toRun(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public List<Run> findRecentByJob(long jobId, int limit) throws Exception {
        try (var ps = TxContext.require().prepareStatement("""
                SELECT *
                  FROM TB_RUN
                 WHERE JOB_ID = ?
                 ORDER BY ID DESC
                 LIMIT ?
            """)) {
            ps.setLong(1, jobId);
            ps.setInt(2, limit);
            return list(ps);
        }
    }

    @Override
    public List<Run> findByStatus(Run.Status status) throws Exception {
        try (var ps = TxContext.require().prepareStatement("SELECT * FROM TB_RUN WHERE STATUS = ? ORDER BY ID")) {
            ps.setString(1, status.code());
            return list(ps);
        }
    }

    @Override
    public int deleteAllButNewest(long jobId, int keepCount) throws Exception {
        try (var ps = TxContext.require().prepareStatement("""
                DELETE FROM TB_RUN
                 WHERE JOB_ID = ?
                   AND ID NOT IN (
                       SELECT ID
                         FROM TB_RUN
                        WHERE JOB_ID = ?
                        ORDER BY ID DESC
                        LIMIT ?
                   )
            """)) {
            ps.setLong(1, jobId);
            ps.setLong(2, jobId);
            ps.setInt(3, keepCount);
            return ps.executeUpdate();
        }
    }

    @Override
    public boolean markTimedOut(long runId, Instant endTime, String error) throws Exception {
        try (var ps = TxContext.require().prepareStatement("""
                UPDATE TB_RUN
                   SET STATUS     = 'TIMEOUT',
                       END_TIME   = ?,
                       ERROR_TEXT = ?
                 WHERE ID = ?
                   AND STATUS = 'RUNNING'
            """)) {
            JdbcUtil.setInstant(ps, 1, endTime);
            ps.setString(2, Run.truncate(error, Run.MAX_ERROR_TEXT));
            ps.setLong(3, runId);
            return ps.executeUpdate() == 1;
        }
    }

    private static List<Run> list(PreparedStatement ps) throws Exception {
        try (ResultSet rs = ps.executeQuery()) {
            List<Run> out = new ArrayList<>();
            while (rs.next()) out.add(RowMappers.toRun(rs));
            return out;
        }
    }
}
