package com.leadharvest.scrape.persistence;

import com.leadharvest.scrape.model.Lead;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

import static com.leadharvest.scrape.persistence.DatabaseDialect.toTimestamp;

@Repository
public class LeadJdbcRepository implements LeadSink {
    private static final String INSERT_COLUMNS = """
        INSERT INTO leads (
            client_id,
            fingerprint,
            job_id,
            company_name,
            area_name,
            country,
            address,
            phone,
            website,
            rating,
            reviews_count,
            external_id,
            source_query,
            source,
            raw_payload,
            created_at
        )
        VALUES (
            :clientId,
            :fingerprint,
            :jobId,
            :companyName,
            :areaName,
            :country,
            :address,
            :phone,
            :website,
            :rating,
            :reviewsCount,
            :externalId,
            :sourceQuery,
            :source,
            :rawPayload,
            :createdAt
        )
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final boolean postgres;

    public LeadJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
        this.postgres = DatabaseDialect.detectPostgres(jdbc);
    }

    @Override
    public boolean upsert(Lead lead) {
        try {
            return insertIgnoringDuplicate(lead);
        } catch (DataAccessException e) {
            throw new StorageWriteException("lead insert failed for fingerprint " + lead.fingerprint(), e);
        }
    }

    @Override
    @Transactional
    public int upsertMany(List<Lead> leads) {
        if (leads == null || leads.isEmpty()) {
            return 0;
        }
        int inserted = 0;
        try {
            for (Lead lead : leads) {
                if (insertIgnoringDuplicate(lead)) {
                    inserted++;
                }
            }
        } catch (DataAccessException e) {
            throw new StorageWriteException("lead batch insert failed after " + inserted + " rows", e);
        }
        return inserted;
    }

    public long countByClient(String clientId) {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM leads WHERE client_id = :clientId",
            new MapSqlParameterSource("clientId", clientId),
            Long.class
        );
        return count == null ? 0L : count;
    }

    public long countByJob(String jobId) {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM leads WHERE job_id = :jobId",
            new MapSqlParameterSource("jobId", jobId),
            Long.class
        );
        return count == null ? 0L : count;
    }

    private boolean insertIgnoringDuplicate(Lead lead) {
        MapSqlParameterSource params = params(lead);
        if (postgres) {
            int rows = jdbc.update(INSERT_COLUMNS + " ON CONFLICT (client_id, fingerprint) DO NOTHING", params);
            return rows > 0;
        }
        try {
            return jdbc.update(INSERT_COLUMNS, params) > 0;
        } catch (DuplicateKeyException e) {
            return false;
        }
    }

    private MapSqlParameterSource params(Lead lead) {
        return new MapSqlParameterSource()
            .addValue("clientId", lead.clientId())
            .addValue("fingerprint", lead.fingerprint())
            .addValue("jobId", lead.jobId())
            .addValue("companyName", lead.companyName())
            .addValue("areaName", lead.areaName())
            .addValue("country", lead.country())
            .addValue("address", lead.address())
            .addValue("phone", lead.phone())
            .addValue("website", lead.website())
            .addValue("rating", lead.rating())
            .addValue("reviewsCount", lead.reviewsCount())
            .addValue("externalId", lead.externalId())
            .addValue("sourceQuery", lead.sourceQuery())
            .addValue("source", lead.source())
            .addValue("rawPayload", lead.rawPayload())
            .addValue("createdAt", toTimestamp(lead.createdAt() == null ? Instant.now() : lead.createdAt()));
    }
}
