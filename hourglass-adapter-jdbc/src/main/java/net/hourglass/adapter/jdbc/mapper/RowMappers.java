package net.hourglass.adapter.jdbc.mapper;

import net.hourglass.core.model.Job;
import net.hourglass.core.model.Lock;
import net.hourglass.core.model.Run;

import java.sql.ResultSet;
import java.sql.SQLException;

import static net.hourglass.adapter.jdbc.JdbcUtil.*;

public final class RowMappers {
    private RowMappers() {}

    // --- Job ---
    public static Job toJob(ResultSet rs) throws SQLException {
        return new Job(
                rs.getLong("ID"),
                rs.getString("NAME"),
                rs.getInt("ENABLED") == 1,
                Job.Frequency.from(rs.getString("FREQUENCY")),
                rs.getInt("BY_HOUR"),
                rs.getInt("BY_MINUTE"),
                getInteger(rs, "WEEKDAY"),
                rs.getInt("JITTER_SEC"),
                new Job.ExecutorParams(
                        rs.getString("SOURCE_URL"),
                        rs.getString("OUTPUT_ROOT"),
                        splitList(rs.getString("PREFERRED_LANGS")),
                        rs.getInt("DO_DOWNLOAD") == 1),
                getInstant(rs, "CREATED_AT"),
                getInstant(rs, "UPDATED_AT")
        );
    }

    // --- Run ---
    public static Run toRun(ResultSet rs) throws SQLException {
        return new Run(
                rs.getLong("ID"),
                rs.getLong("JOB_ID"),
                getInstant(rs, "SCHEDULED_TIME"),
                getInstant(rs, "START_TIME"),
                getInstant(rs, "END_TIME"),
                Run.Status.from(rs.getString("STATUS")),
                rs.getString("ERROR_TEXT"),
                rs.getString("RUN_DIR"),
                rs.getInt("RETRY_COUNT"),
                getInstant(rs, "CREATED_AT")
        );
    }

    // --- Lock ---
    public static Lock toLock(ResultSet rs) throws SQLException {
        return new Lock(
                rs.getString("NAME"),
                rs.getString("OWNER"),
                getInstant(rs, "EXPIRES_AT"),
                getInstant(rs, "CREATED_AT")
        );
    }
}
