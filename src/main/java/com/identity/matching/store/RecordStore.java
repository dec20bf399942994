package com.identity.matching.store;

import com.identity.matching.core.model.LocalRecord;

import java.util.List;

/**
 * Owner of the local records. Supplies the records still lacking a directory
 * link and persists approved links.
 */
public interface RecordStore {

    /**
     * Returns the local records of the scope whose external reference is not set.
     */
    List<LocalRecord> listUnlinkedLocalRecords(String scopeId);

    /**
     * Links a local record to a directory entry.
     *
     * @throws LinkPersistenceException if the link cannot be stored, including when
     *                                  the record was linked concurrently by someone else
     */
    void persistLink(String localId, String externalId);

    /**
     * Returns the number of local records of the scope without an external reference.
     */
    default int countUnlinkedLocalRecords(String scopeId) {
        return listUnlinkedLocalRecords(scopeId).size();
    }
}
