package com.ivamare.transition.repository;

import com.ivamare.transition.model.ComplianceRecord;

import java.util.List;

/**
 * Repository for compliance check records.
 */
public interface ComplianceRepository {

    /**
     * Insert a compliance record.
     *
     * @param record The record (its id is ignored)
     * @return id assigned by the store
     */
    long record(ComplianceRecord record);

    /**
     * Get compliance records for an entity.
     *
     * @param entityType Entity type name
     * @param entityId Entity identifier
     * @param limit Maximum number of records (positive)
     * @return records, newest first
     */
    List<ComplianceRecord> findByEntity(String entityType, String entityId, int limit);
}
