package com.identity.matching.store;

import com.identity.matching.core.model.LocalRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Thread-safe in-memory {@link RecordStore}. Records keep their insertion order
 * within a scope. Linking a record that is already linked to another external id fails.
 */
public class InMemoryRecordStore implements RecordStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryRecordStore.class);

    private final Map<String, List<String>> idsByScope = new ConcurrentHashMap<>();
    private final Map<String, LocalRecord> records = new ConcurrentHashMap<>();

    /**
     * Adds or replaces a record in the scope.
     */
    public void save(String scopeId, LocalRecord record) {
        List<String> ids = idsByScope.computeIfAbsent(scopeId, k -> new CopyOnWriteArrayList<>());
        if (records.put(record.getId(), record) == null) {
            ids.add(record.getId());
        }
    }

    public void saveAll(String scopeId, Collection<LocalRecord> toSave) {
        toSave.forEach(record -> save(scopeId, record));
    }

    public Optional<LocalRecord> findById(String localId) {
        return Optional.ofNullable(records.get(localId));
    }

    @Override
    public List<LocalRecord> listUnlinkedLocalRecords(String scopeId) {
        List<LocalRecord> result = new ArrayList<>();
        for (String id : idsByScope.getOrDefault(scopeId, List.of())) {
            LocalRecord record = records.get(id);
            if (record != null && !record.isLinked()) {
                result.add(record);
            }
        }
        return result;
    }

    @Override
    public void persistLink(String localId, String externalId) {
        if (externalId == null || externalId.isBlank()) {
            throw new LinkPersistenceException(localId, "externalId is required");
        }
        LocalRecord updated = records.computeIfPresent(localId, (id, current) -> {
            Optional<String> existing = current.getExternalReference();
            if (existing.isPresent() && !existing.get().equals(externalId)) {
                throw new LinkPersistenceException(localId,
                        "Local record " + localId + " is already linked to " + existing.get());
            }
            return current.withExternalReference(externalId);
        });
        if (updated == null) {
            throw new LinkPersistenceException(localId, "Local record not found: " + localId);
        }
        log.debug("store.link.persisted localId={} externalId={}", localId, externalId);
    }
}
