package com.identity.matching.directory;

import com.identity.matching.core.model.CandidateRecord;

import java.util.List;

/**
 * Source of candidate records for a scope (for example a list in an external people directory).
 * Implementations fetch every page before returning; a failure on any page fails the whole fetch.
 */
public interface DirectoryProvider {

    /**
     * Fetches every candidate record of the scope.
     *
     * @param scopeId      the directory scope to fetch
     * @param forceRefresh bypass any cached copy and ask the source to refresh first
     * @return the candidates in directory order
     * @throws DirectoryFetchException if any page cannot be fetched
     */
    List<CandidateRecord> fetchAllCandidates(String scopeId, boolean forceRefresh);
}
