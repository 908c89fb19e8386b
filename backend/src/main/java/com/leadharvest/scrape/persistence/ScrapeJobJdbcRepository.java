package com.leadharvest.scrape.persistence;

import com.leadharvest.scrape.model.Area;
import com.leadharvest.scrape.model.AreaTier;
import com.leadharvest.scrape.model.Checkpoint;
import com.leadharvest.scrape.model.JobErrorEntry;
import com.leadharvest.scrape.model.JobErrorKind;
import com.leadharvest.scrape.model.JobStatus;
import com.leadharvest.scrape.model.PlannedArea;
import com.leadharvest.scrape.model.ScrapeJob;
import com.leadharvest.scrape.model.ScrapeJobPlan;
import com.leadharvest.scrape.model.ScrapeJobRequest;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.leadharvest.scrape.persistence.DatabaseDialect.toInstant;
import static com.leadharvest.scrape.persistence.DatabaseDialect.toTimestamp;
import static com.leadharvest.scrape.persistence.DatabaseDialect.truncate;

@Repository
public class ScrapeJobJdbcRepository {
    private static final String JOB_COLUMNS = """
        id,
        client_id,
        query,
        country,
        min_population,
        max_priority,
        target_lead_count,
        status,
        current_area_index,
        current_page,
        current_area,
        leads_found,
        areas_completed,
        areas_total,
        api_calls,
        retry_count,
        estimated_leads,
        cost_estimate,
        last_error,
        created_at,
        updated_at,
        started_at,
        finished_at
        """;

    private final NamedParameterJdbcTemplate jdbc;

    public ScrapeJobJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    @Transactional
    public void insertJob(String jobId, ScrapeJobRequest request, ScrapeJobPlan plan, Instant createdAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", jobId)
            .addValue("clientId", request.clientId())
            .addValue("query", request.query())
            .addValue("country", request.country())
            .addValue("minPopulation", request.minPopulation())
            .addValue("maxPriority", request.maxPriority())
            .addValue("target", request.targetLeadCount())
            .addValue("status", JobStatus.PENDING.name())
            .addValue("areasTotal", plan.areas().size())
            .addValue("estimatedLeads", plan.estimatedLeads())
            .addValue("costEstimate", plan.estimatedCost())
            .addValue("createdAt", toTimestamp(createdAt));
        jdbc.update(
            """
                INSERT INTO scrape_jobs (
                    id,
                    client_id,
                    query,
                    country,
                    min_population,
                    max_priority,
                    target_lead_count,
                    status,
                    areas_total,
                    estimated_leads,
                    cost_estimate,
                    created_at,
                    updated_at
                )
                VALUES (
                    :id,
                    :clientId,
                    :query,
                    :country,
                    :minPopulation,
                    :maxPriority,
                    :target,
                    :status,
                    :areasTotal,
                    :estimatedLeads,
                    :costEstimate,
                    :createdAt,
                    :createdAt
                )
                """,
            params
        );
        if (plan.areas().isEmpty()) {
            return;
        }
        List<MapSqlParameterSource> rows = new ArrayList<>(plan.areas().size());
        for (PlannedArea planned : plan.areas()) {
            Area area = planned.area();
            rows.add(new MapSqlParameterSource()
                .addValue("jobId", jobId)
                .addValue("areaIndex", planned.position())
                .addValue("areaName", area.name())
                .addValue("country", area.country())
                .addValue("region", area.region())
                .addValue("population", area.population())
                .addValue("tier", area.tier() == null ? AreaTier.SKIP.name() : area.tier().name())
                .addValue("pageBudget", planned.pageBudget()));
        }
        jdbc.batchUpdate(
            """
                INSERT INTO scrape_job_areas (
                    job_id,
                    area_index,
                    area_name,
                    country,
                    region,
                    population,
                    tier,
                    page_budget
                )
                VALUES (
                    :jobId,
                    :areaIndex,
                    :areaName,
                    :country,
                    :region,
                    :population,
                    :tier,
                    :pageBudget
                )
                """,
            rows.toArray(new MapSqlParameterSource[0])
        );
    }

    public Optional<ScrapeJob> findJob(String jobId) {
        List<ScrapeJob> rows = jdbc.query(
            "SELECT " + JOB_COLUMNS + " FROM scrape_jobs WHERE id = :id",
            new MapSqlParameterSource("id", jobId),
            jobRowMapper()
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public List<ScrapeJob> findJobs(JobStatus status, String clientId, int limit) {
        int safeLimit = Math.max(1, Math.min(limit, 500));
        MapSqlParameterSource params = new MapSqlParameterSource().addValue("limit", safeLimit);
        StringBuilder sql = new StringBuilder("SELECT ").append(JOB_COLUMNS).append(" FROM scrape_jobs WHERE 1 = 1");
        if (status != null) {
            sql.append(" AND status = :status");
            params.addValue("status", status.name());
        }
        if (clientId != null && !clientId.isBlank()) {
            sql.append(" AND client_id = :clientId");
            params.addValue("clientId", clientId.trim());
        }
        sql.append(" ORDER BY created_at DESC, id DESC LIMIT :limit");
        return jdbc.query(sql.toString(), params, jobRowMapper());
    }

    public List<String> findJobIdsByStatus(JobStatus status) {
        return jdbc.queryForList(
            "SELECT id FROM scrape_jobs WHERE status = :status ORDER BY created_at",
            new MapSqlParameterSource("status", status.name()),
            String.class
        );
    }

    public List<PlannedArea> findPlannedAreas(String jobId) {
        return jdbc.query(
            """
                SELECT area_index,
                       area_name,
                       country,
                       region,
                       population,
                       tier,
                       page_budget
                FROM scrape_job_areas
                WHERE job_id = :jobId
                ORDER BY area_index
                """,
            new MapSqlParameterSource("jobId", jobId),
            (rs, rowNum) -> {
                long population = rs.getLong("population");
                Long safePopulation = rs.wasNull() ? null : population;
                Area area = new Area(
                    rs.getString("area_name"),
                    rs.getString("country"),
                    rs.getString("region"),
                    safePopulation,
                    AreaTier.parse(rs.getString("tier"))
                );
                return new PlannedArea(rs.getInt("area_index"), area, rs.getInt("page_budget"));
            }
        );
    }

    /**
     * Atomically moves a PENDING or PAUSED job to RUNNING.
     *
     * @return false if another runner already owns the job or it is terminal
     */
    public boolean claimForRun(String jobId, Instant now) {
        try {
            int updated = jdbc.update(
                """
                    UPDATE scrape_jobs
                    SET status = 'RUNNING',
                        started_at = COALESCE(started_at, :now),
                        updated_at = :now,
                        finished_at = NULL,
                        last_error = NULL
                    WHERE id = :id
                      AND status IN ('PENDING', 'PAUSED')
                    """,
                new MapSqlParameterSource()
                    .addValue("id", jobId)
                    .addValue("now", toTimestamp(now))
            );
            return updated == 1;
        } catch (DataAccessException e) {
            throw new StorageWriteException("claim failed for job " + jobId, e);
        }
    }

    public void updateProgress(
        String jobId,
        Checkpoint checkpoint,
        String currentArea,
        int apiCalls,
        int retryCount
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", jobId)
            .addValue("areaIndex", checkpoint.currentAreaIndex())
            .addValue("page", checkpoint.currentPage())
            .addValue("currentArea", currentArea)
            .addValue("leadsFound", checkpoint.leadsFound())
            .addValue("areasCompleted", checkpoint.areasCompleted())
            .addValue("apiCalls", apiCalls)
            .addValue("retryCount", retryCount)
            .addValue("now", toTimestamp(Instant.now()));
        try {
            jdbc.update(
                """
                    UPDATE scrape_jobs
                    SET current_area_index = :areaIndex,
                        current_page = :page,
                        current_area = :currentArea,
                        leads_found = :leadsFound,
                        areas_completed = :areasCompleted,
                        api_calls = :apiCalls,
                        retry_count = :retryCount,
                        updated_at = :now
                    WHERE id = :id
                    """,
                params
            );
        } catch (DataAccessException e) {
            throw new StorageWriteException("progress update failed for job " + jobId, e);
        }
    }

    /**
     * Records the outcome of a run. {@code finishedAt} is only set for terminal states.
     */
    public void finishRun(String jobId, JobStatus status, String lastError, Instant now) {
        Instant finishedAt = status.isTerminal() ? now : null;
        try {
            jdbc.update(
                """
                    UPDATE scrape_jobs
                    SET status = :status,
                        last_error = COALESCE(:lastError, last_error),
                        finished_at = :finishedAt,
                        updated_at = :now
                    WHERE id = :id
                    """,
                new MapSqlParameterSource()
                    .addValue("id", jobId)
                    .addValue("status", status.name())
                    .addValue("lastError", truncate(lastError))
                    .addValue("finishedAt", toTimestamp(finishedAt))
                    .addValue("now", toTimestamp(now))
            );
        } catch (DataAccessException e) {
            throw new StorageWriteException("status update to " + status + " failed for job " + jobId, e);
        }
    }

    /**
     * Moves every RUNNING job to PAUSED. Used on startup when no runner can own them.
     */
    public List<String> pauseRunningJobs(String reason, Instant now) {
        List<String> running = findJobIdsByStatus(JobStatus.RUNNING);
        List<String> paused = new ArrayList<>();
        for (String jobId : running) {
            int updated = jdbc.update(
                """
                    UPDATE scrape_jobs
                    SET status = 'PAUSED',
                        last_error = :reason,
                        updated_at = :now
                    WHERE id = :id
                      AND status = 'RUNNING'
                    """,
                new MapSqlParameterSource()
                    .addValue("id", jobId)
                    .addValue("reason", reason)
                    .addValue("now", toTimestamp(now))
            );
            if (updated == 1) {
                paused.add(jobId);
            }
        }
        return paused;
    }

    public void insertError(JobErrorEntry entry) {
        jdbc.update(
            """
                INSERT INTO scrape_job_errors (
                    job_id,
                    area_name,
                    page,
                    kind,
                    message,
                    observed_at
                )
                VALUES (
                    :jobId,
                    :areaName,
                    :page,
                    :kind,
                    :message,
                    :observedAt
                )
                """,
            new MapSqlParameterSource()
                .addValue("jobId", entry.jobId())
                .addValue("areaName", entry.areaName())
                .addValue("page", entry.page())
                .addValue("kind", entry.kind().name())
                .addValue("message", truncate(entry.message()))
                .addValue("observedAt", toTimestamp(entry.observedAt() == null ? Instant.now() : entry.observedAt()))
        );
    }

    public List<JobErrorEntry> findErrors(String jobId, int limit) {
        int safeLimit = Math.max(1, Math.min(limit, 1000));
        return jdbc.query(
            """
                SELECT job_id,
                       area_name,
                       page,
                       kind,
                       message,
                       observed_at
                FROM scrape_job_errors
                WHERE job_id = :jobId
                ORDER BY observed_at DESC, id DESC
                LIMIT :limit
                """,
            new MapSqlParameterSource()
                .addValue("jobId", jobId)
                .addValue("limit", safeLimit),
            (rs, rowNum) -> {
                int page = rs.getInt("page");
                Integer safePage = rs.wasNull() ? null : page;
                return new JobErrorEntry(
                    rs.getString("job_id"),
                    rs.getString("area_name"),
                    safePage,
                    JobErrorKind.valueOf(rs.getString("kind")),
                    rs.getString("message"),
                    toInstant(rs.getTimestamp("observed_at"))
                );
            }
        );
    }

    private RowMapper<ScrapeJob> jobRowMapper() {
        return (rs, rowNum) -> {
            JobStatus status = JobStatus.parse(rs.getString("status"));
            int areasCompleted = rs.getInt("areas_completed");
            int areasTotal = rs.getInt("areas_total");
            int leadsFound = rs.getInt("leads_found");
            int target = rs.getInt("target_lead_count");
            return new ScrapeJob(
                rs.getString("id"),
                rs.getString("client_id"),
                rs.getString("query"),
                rs.getString("country"),
                rs.getInt("min_population"),
                rs.getInt("max_priority"),
                target,
                status,
                rs.getInt("current_area_index"),
                rs.getInt("current_page"),
                rs.getString("current_area"),
                leadsFound,
                areasCompleted,
                areasTotal,
                ScrapeJob.progressOf(status, areasCompleted, areasTotal, leadsFound, target),
                rs.getInt("api_calls"),
                rs.getInt("retry_count"),
                rs.getInt("estimated_leads"),
                rs.getDouble("cost_estimate"),
                rs.getString("last_error"),
                toInstant(rs.getTimestamp("created_at")),
                toInstant(rs.getTimestamp("updated_at")),
                toInstant(rs.getTimestamp("started_at")),
                toInstant(rs.getTimestamp("finished_at"))
            );
        };
    }
}
