package com.leadharvest.scrape.persistence;

import com.leadharvest.scrape.model.Lead;

import java.util.List;

/**
 * Durable lead store. Uniqueness of {@code (clientId, fingerprint)} is enforced
 * here atomically, so concurrent jobs for the same client never double-insert.
 */
public interface LeadSink {

    /**
     * @return true if the lead was inserted, false if its fingerprint already existed for the client
     * @throws StorageWriteException when the write cannot be completed
     */
    boolean upsert(Lead lead);

    /**
     * Writes all leads in one unit of work.
     *
     * @return the number of leads actually inserted
     * @throws StorageWriteException when the write cannot be completed
     */
    int upsertMany(List<Lead> leads);
}
