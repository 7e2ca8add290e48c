package com.business.deduplication.store;

import com.business.deduplication.core.model.BusinessRecord;

import java.util.List;
import java.util.Optional;

/**
 * Read access to the records the engine deduplicates against. The engine never
 * writes through this interface.
 */
public interface RecordStore {

    Optional<BusinessRecord> get(String id);

    /**
     * All stored records, used to build the candidate index.
     */
    List<BusinessRecord> list();
}
