package com.simqueue.db;

import com.simqueue.core.CreateJobInput;
import com.simqueue.core.JobConflictException;
import com.simqueue.core.JobFilter;
import com.simqueue.core.JobNotFoundException;
import com.simqueue.core.JobPage;
import com.simqueue.core.JobStatus;
import com.simqueue.core.JobStore;
import com.simqueue.core.SimulationJob;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * {@link JobStore} backed by the {@code simulation_jobs} table.
 * All methods use PreparedStatement and try-with-resources for resource management.
 *
 * <p><b>Claiming:</b> on PostgreSQL the next job is selected and moved to RUNNING by a
 * single {@code UPDATE ... WHERE id = (SELECT ... FOR UPDATE SKIP LOCKED)} statement.
 * On other engines an ordered batch of pending ids is read and the first id whose
 * status-guarded {@code UPDATE ... WHERE id = ? AND status = 'pending'} touches a row
 * wins; ids taken by a concurrent claimer in the meantime are skipped. Either way two
 * claimers never receive the same job.</p>
 */
public class JdbcJobStore implements JobStore {
    private static final Logger logger = Logger.getLogger(JdbcJobStore.class.getName());

    private static final int CLAIM_BATCH_SIZE = 10;
    // H2: row changed or locked by a concurrent transaction
    private static final int H2_CONCURRENT_UPDATE = 90131;
    private static final int H2_LOCK_TIMEOUT = 50200;

    private static final String COLUMNS =
        "id, user_id, service_id, llm_provider, prompt_version_id, current_config, proposed_config, " +
        "context, options, status, priority, result, error_message, queued_at, started_at, completed_at, " +
        "created_at, updated_at";

    private static final String POSTGRES_CLAIM_SQL =
        "UPDATE simulation_jobs SET status = 'running', started_at = ?, updated_at = ? " +
        "WHERE id = (SELECT id FROM simulation_jobs WHERE status = 'pending' " +
        "ORDER BY priority DESC, queued_at ASC, id ASC LIMIT 1 FOR UPDATE SKIP LOCKED) " +
        "RETURNING " + COLUMNS;

    private final Database database;

    public JdbcJobStore(Database database) {
        this.database = database;
    }

    @Override
    public SimulationJob enqueue(CreateJobInput input) throws SQLException {
        int priority = input.validate();

        String sql = "INSERT INTO simulation_jobs (user_id, service_id, llm_provider, prompt_version_id, " +
                     "current_config, proposed_config, context, options, status, priority, queued_at, created_at) " +
                     "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {

            Timestamp now = Timestamp.valueOf(LocalDateTime.now());

            stmt.setLong(1, input.getUserId());
            stmt.setString(2, input.getServiceId());
            stmt.setString(3, input.getLlmProvider());
            if (input.getPromptVersionId() != null) {
                stmt.setInt(4, input.getPromptVersionId());
            } else {
                stmt.setNull(4, Types.INTEGER);
            }
            stmt.setString(5, input.getCurrentConfig());
            stmt.setString(6, input.getProposedConfig());
            stmt.setString(7, input.getContext());
            stmt.setString(8, input.getOptions());
            stmt.setString(9, JobStatus.PENDING.getValue());
            stmt.setInt(10, priority);
            stmt.setTimestamp(11, now);
            stmt.setTimestamp(12, now);

            stmt.executeUpdate();

            long jobId;
            try (ResultSet keys = stmt.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("No id generated for new simulation job");
                }
                jobId = keys.getLong(1);
            }

            SimulationJob job = findById(conn, jobId)
                .orElseThrow(() -> new SQLException("Simulation job vanished after insert: " + jobId));
            logger.info("Enqueued simulation job " + jobId + " for service " + input.getServiceId()
                + " (priority " + priority + ")");
            return job;
        }
    }

    @Override
    public Optional<SimulationJob> claimNextReady() throws SQLException {
        try (Connection conn = database.getConnection()) {
            Optional<SimulationJob> claimed = database.isPostgres()
                ? claimWithSkipLocked(conn)
                : claimWithGuardedUpdate(conn);
            claimed.ifPresent(job -> logger.info("Claimed simulation job " + job.getId()
                + " (priority " + job.getPriority() + ")"));
            return claimed;
        }
    }

    private Optional<SimulationJob> claimWithSkipLocked(Connection conn) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(POSTGRES_CLAIM_SQL)) {
            Timestamp now = Timestamp.valueOf(LocalDateTime.now());
            stmt.setTimestamp(1, now);
            stmt.setTimestamp(2, now);

            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapResultSetToJob(rs));
                }
            }
        }
        return Optional.empty();
    }

    private Optional<SimulationJob> claimWithGuardedUpdate(Connection conn) throws SQLException {
        String candidatesSql = "SELECT id FROM simulation_jobs WHERE status = ? " +
                               "ORDER BY priority DESC, queued_at ASC, id ASC LIMIT ?";

        while (true) {
            List<Long> candidates = new ArrayList<>();
            try (PreparedStatement stmt = conn.prepareStatement(candidatesSql)) {
                stmt.setString(1, JobStatus.PENDING.getValue());
                stmt.setInt(2, CLAIM_BATCH_SIZE);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        candidates.add(rs.getLong("id"));
                    }
                }
            }

            if (candidates.isEmpty()) {
                return Optional.empty();
            }

            for (long candidateId : candidates) {
                if (tryClaim(conn, candidateId)) {
                    return findById(conn, candidateId);
                }
            }
            // every candidate went to another claimer; read the next batch
        }
    }

    private boolean tryClaim(Connection conn, long jobId) throws SQLException {
        String sql = "UPDATE simulation_jobs SET status = ?, started_at = ?, updated_at = ? " +
                     "WHERE id = ? AND status = ?";

        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            Timestamp now = Timestamp.valueOf(LocalDateTime.now());
            stmt.setString(1, JobStatus.RUNNING.getValue());
            stmt.setTimestamp(2, now);
            stmt.setTimestamp(3, now);
            stmt.setLong(4, jobId);
            stmt.setString(5, JobStatus.PENDING.getValue());

            return stmt.executeUpdate() == 1;

        } catch (SQLException e) {
            if (e.getErrorCode() == H2_CONCURRENT_UPDATE || e.getErrorCode() == H2_LOCK_TIMEOUT) {
                logger.fine("Job " + jobId + " is being claimed concurrently, skipping");
                return false;
            }
            throw e;
        }
    }

    @Override
    public boolean markCompleted(long jobId, String result) throws SQLException {
        String sql = "UPDATE simulation_jobs SET status = ?, result = ?, completed_at = ?, updated_at = ? " +
                     "WHERE id = ? AND status = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            Timestamp now = Timestamp.valueOf(LocalDateTime.now());
            stmt.setString(1, JobStatus.COMPLETED.getValue());
            stmt.setString(2, result);
            stmt.setTimestamp(3, now);
            stmt.setTimestamp(4, now);
            stmt.setLong(5, jobId);
            stmt.setString(6, JobStatus.RUNNING.getValue());

            return reportTerminalWrite(jobId, JobStatus.COMPLETED, stmt.executeUpdate());
        }
    }

    @Override
    public boolean markFailed(long jobId, String errorMessage) throws SQLException {
        String sql = "UPDATE simulation_jobs SET status = ?, error_message = ?, completed_at = ?, updated_at = ? " +
                     "WHERE id = ? AND status = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            Timestamp now = Timestamp.valueOf(LocalDateTime.now());
            stmt.setString(1, JobStatus.FAILED.getValue());
            stmt.setString(2, errorMessage);
            stmt.setTimestamp(3, now);
            stmt.setTimestamp(4, now);
            stmt.setLong(5, jobId);
            stmt.setString(6, JobStatus.RUNNING.getValue());

            return reportTerminalWrite(jobId, JobStatus.FAILED, stmt.executeUpdate());
        }
    }

    private boolean reportTerminalWrite(long jobId, JobStatus target, int rowsUpdated) {
        if (rowsUpdated == 1) {
            logger.info("Updated simulation job " + jobId + " to status: " + target);
            return true;
        }
        logger.warning("Simulation job " + jobId + " not marked " + target + ": job is not running");
        return false;
    }

    @Override
    public SimulationJob cancelJob(long jobId) throws SQLException {
        String sql = "UPDATE simulation_jobs SET status = ?, completed_at = ?, updated_at = ? " +
                     "WHERE id = ? AND status = ?";

        try (Connection conn = database.getConnection()) {
            int rowsUpdated;
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                Timestamp now = Timestamp.valueOf(LocalDateTime.now());
                stmt.setString(1, JobStatus.CANCELLED.getValue());
                stmt.setTimestamp(2, now);
                stmt.setTimestamp(3, now);
                stmt.setLong(4, jobId);
                stmt.setString(5, JobStatus.PENDING.getValue());
                rowsUpdated = stmt.executeUpdate();
            }

            Optional<SimulationJob> job = findById(conn, jobId);
            if (job.isEmpty()) {
                throw new JobNotFoundException(jobId);
            }
            if (rowsUpdated == 0) {
                logger.warning("Could not cancel simulation job " + jobId + " (status " + job.get().getStatus() + ")");
                throw new JobConflictException(jobId, job.get().getStatus(), JobStatus.CANCELLED);
            }

            logger.info("Cancelled simulation job " + jobId);
            return job.get();
        }
    }

    @Override
    public Optional<SimulationJob> getJob(long jobId) throws SQLException {
        try (Connection conn = database.getConnection()) {
            return findById(conn, jobId);
        }
    }

    private Optional<SimulationJob> findById(Connection conn, long jobId) throws SQLException {
        String sql = "SELECT " + COLUMNS + " FROM simulation_jobs WHERE id = ?";

        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setLong(1, jobId);

            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapResultSetToJob(rs));
                }
            }
        }

        return Optional.empty();
    }

    @Override
    public JobPage listJobs(JobFilter filter, int limit, int offset) throws SQLException {
        JobStore.checkPaging(limit, offset);

        StringBuilder where = new StringBuilder(" WHERE 1=1");
        List<Object> args = new ArrayList<>();
        if (filter.getUserId() != null) {
            where.append(" AND user_id = ?");
            args.add(filter.getUserId());
        }
        if (filter.getStatus() != null) {
            where.append(" AND status = ?");
            args.add(filter.getStatus().getValue());
        }

        String countSql = "SELECT COUNT(*) AS total FROM simulation_jobs" + where;
        String pageSql = "SELECT " + COLUMNS + " FROM simulation_jobs" + where +
                         " ORDER BY priority DESC, queued_at ASC, id ASC LIMIT ? OFFSET ?";

        try (Connection conn = database.getConnection()) {
            long total;
            try (PreparedStatement stmt = conn.prepareStatement(countSql)) {
                bind(stmt, args);
                try (ResultSet rs = stmt.executeQuery()) {
                    total = rs.next() ? rs.getLong("total") : 0;
                }
            }

            List<SimulationJob> jobs = new ArrayList<>();
            try (PreparedStatement stmt = conn.prepareStatement(pageSql)) {
                bind(stmt, args);
                stmt.setInt(args.size() + 1, limit);
                stmt.setInt(args.size() + 2, offset);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        jobs.add(mapResultSetToJob(rs));
                    }
                }
            }

            logger.fine("Listed " + jobs.size() + " of " + total + " simulation jobs for " + filter);
            return new JobPage(jobs, total);
        }
    }

    private static void bind(PreparedStatement stmt, List<Object> args) throws SQLException {
        for (int i = 0; i < args.size(); i++) {
            stmt.setObject(i + 1, args.get(i));
        }
    }

    @Override
    public Map<JobStatus, Long> getQueueStats() throws SQLException {
        String sql = "SELECT status, COUNT(*) AS job_count FROM simulation_jobs GROUP BY status";

        Map<JobStatus, Long> stats = new EnumMap<>(JobStatus.class);
        for (JobStatus status : JobStatus.values()) {
            stats.put(status, 0L);
        }

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {

            while (rs.next()) {
                stats.put(JobStatus.fromValue(rs.getString("status")), rs.getLong("job_count"));
            }
        }

        return stats;
    }

    /**
     * Map the current ResultSet row to a SimulationJob, keeping SQL NULLs as nulls.
     */
    private SimulationJob mapResultSetToJob(ResultSet rs) throws SQLException {
        SimulationJob job = new SimulationJob();

        job.setId(rs.getLong("id"));
        job.setUserId(rs.getLong("user_id"));
        job.setServiceId(rs.getString("service_id"));
        job.setLlmProvider(rs.getString("llm_provider"));
        int promptVersionId = rs.getInt("prompt_version_id");
        job.setPromptVersionId(rs.wasNull() ? null : promptVersionId);
        job.setCurrentConfig(rs.getString("current_config"));
        job.setProposedConfig(rs.getString("proposed_config"));
        job.setContext(rs.getString("context"));
        job.setOptions(rs.getString("options"));
        job.setStatus(JobStatus.fromValue(rs.getString("status")));
        job.setPriority(rs.getInt("priority"));
        job.setResult(rs.getString("result"));
        job.setErrorMessage(rs.getString("error_message"));

        job.setQueuedAt(toLocalDateTime(rs.getTimestamp("queued_at")));
        job.setStartedAt(toLocalDateTime(rs.getTimestamp("started_at")));
        job.setCompletedAt(toLocalDateTime(rs.getTimestamp("completed_at")));
        job.setCreatedAt(toLocalDateTime(rs.getTimestamp("created_at")));
        job.setUpdatedAt(toLocalDateTime(rs.getTimestamp("updated_at")));

        return job;
    }

    private static LocalDateTime toLocalDateTime(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toLocalDateTime();
    }
}
