package com.llamaservice.repository;

import com.llamaservice.model.ModelRecord;

import java.util.List;
import java.util.Optional;

/**
 * Durable storage for {@link ModelRecord}s keyed by model name.
 *
 * Every method may throw {@link PersistenceException} when the backing store
 * cannot be read or written.
 */
public interface ModelRecordStore {

    /**
     * Returns the persisted record. When none exists but the catalog knows the
     * name, a fresh NOT_DOWNLOADED record is persisted and returned.
     */
    Optional<ModelRecord> get(String name);

    /**
     * Upserts the record under its name.
     */
    void save(ModelRecord record);

    /**
     * Every record currently persisted. Catalog entries that were never
     * accessed are not included.
     */
    List<ModelRecord> all();

    /**
     * Removes the record and, best effort, its artifact directory.
     *
     * @return false if no record was stored under the name
     */
    boolean delete(String name);
}
