package com.leadharvest.scrape.persistence;

import com.leadharvest.scrape.model.Checkpoint;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.leadharvest.scrape.persistence.DatabaseDialect.toInstant;
import static com.leadharvest.scrape.persistence.DatabaseDialect.toTimestamp;

@Repository
public class CheckpointJdbcRepository implements CheckpointStore {
    private final NamedParameterJdbcTemplate jdbc;
    private final boolean postgres;

    public CheckpointJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
        this.postgres = DatabaseDialect.detectPostgres(jdbc);
    }

    @Override
    public void save(String jobId, Checkpoint checkpoint) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("areaIndex", checkpoint.currentAreaIndex())
            .addValue("page", checkpoint.currentPage())
            .addValue("leadsFound", checkpoint.leadsFound())
            .addValue("areasCompleted", checkpoint.areasCompleted())
            .addValue("updatedAt", toTimestamp(checkpoint.updatedAt() == null ? Instant.now() : checkpoint.updatedAt()));
        try {
            if (postgres) {
                jdbc.update(
                    """
                        INSERT INTO scrape_job_checkpoints (
                            job_id,
                            current_area_index,
                            current_page,
                            leads_found,
                            areas_completed,
                            updated_at
                        )
                        VALUES (
                            :jobId,
                            :areaIndex,
                            :page,
                            :leadsFound,
                            :areasCompleted,
                            :updatedAt
                        )
                        ON CONFLICT (job_id)
                        DO UPDATE SET
                            current_area_index = EXCLUDED.current_area_index,
                            current_page = EXCLUDED.current_page,
                            leads_found = EXCLUDED.leads_found,
                            areas_completed = EXCLUDED.areas_completed,
                            updated_at = EXCLUDED.updated_at
                        """,
                    params
                );
                return;
            }
            jdbc.update(
                """
                    MERGE INTO scrape_job_checkpoints (
                        job_id,
                        current_area_index,
                        current_page,
                        leads_found,
                        areas_completed,
                        updated_at
                    )
                    KEY(job_id)
                    VALUES (
                        :jobId,
                        :areaIndex,
                        :page,
                        :leadsFound,
                        :areasCompleted,
                        :updatedAt
                    )
                    """,
                params
            );
        } catch (DataAccessException e) {
            throw new StorageWriteException("checkpoint write failed for job " + jobId, e);
        }
    }

    @Override
    public Optional<Checkpoint> load(String jobId) {
        List<Checkpoint> rows = jdbc.query(
            """
                SELECT job_id,
                       current_area_index,
                       current_page,
                       leads_found,
                       areas_completed,
                       updated_at
                FROM scrape_job_checkpoints
                WHERE job_id = :jobId
                """,
            new MapSqlParameterSource("jobId", jobId),
            (rs, rowNum) -> new Checkpoint(
                rs.getString("job_id"),
                rs.getInt("current_area_index"),
                rs.getInt("current_page"),
                rs.getInt("leads_found"),
                rs.getInt("areas_completed"),
                toInstant(rs.getTimestamp("updated_at"))
            )
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }
}
