package com.business.deduplication.index;

import com.business.deduplication.rules.NormalizedRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Inverted index from blocking keys to record ids.
 *
 * <p>Writers serialize per key through {@link ConcurrentHashMap#compute}, never on
 * the whole index. Readers never block and may observe a slightly stale key set.
 * Indexing the same id again replaces its previous keys.</p>
 */
public class CandidateIndex {
    private static final Logger log = LoggerFactory.getLogger(CandidateIndex.class);

    private final BlockingKeyStrategy strategy;
    private final ConcurrentHashMap<String, Set<String>> idsByKey = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Set<String>> keysById = new ConcurrentHashMap<>();

    public CandidateIndex() {
        this(new DefaultBlockingKeyStrategy());
    }

    public CandidateIndex(BlockingKeyStrategy strategy) {
        this.strategy = Objects.requireNonNull(strategy, "strategy is required");
    }

    /**
     * Adds or re-indexes a record under its blocking keys.
     *
     * @throws IllegalArgumentException if the record has no id
     */
    public void index(NormalizedRecord record) {
        String id = record.id();
        if (id == null) {
            throw new IllegalArgumentException("Cannot index a record without an id");
        }
        Set<String> keys = Collections.unmodifiableSet(strategy.generateKeys(record));

        Set<String> previous = keysById.put(id, keys);
        if (previous != null) {
            for (String key : previous) {
                if (!keys.contains(key)) {
                    detach(key, id);
                }
            }
        }
        for (String key : keys) {
            idsByKey.compute(key, (k, ids) -> {
                Set<String> target = ids != null ? ids : ConcurrentHashMap.newKeySet();
                target.add(id);
                return target;
            });
        }
        log.trace("index.updated recordId={} keys={}", id, keys);
    }

    /**
     * Removes a record from the index. Unknown ids are ignored.
     *
     * @return true if the id was indexed
     */
    public boolean remove(String id) {
        Set<String> keys = keysById.remove(id);
        if (keys == null) {
            return false;
        }
        for (String key : keys) {
            detach(key, id);
        }
        return true;
    }

    /**
     * Ids that share at least one blocking key with the record, excluding its own id.
     * The record itself need not be indexed.
     */
    public Set<String> candidates(NormalizedRecord record) {
        Set<String> result = new LinkedHashSet<>();
        for (String key : strategy.generateKeys(record)) {
            Set<String> ids = idsByKey.get(key);
            if (ids != null) {
                result.addAll(ids);
            }
        }
        if (record.id() != null) {
            result.remove(record.id());
        }
        return result;
    }

    public Set<String> keysFor(NormalizedRecord record) {
        return strategy.generateKeys(record);
    }

    public boolean contains(String id) {
        return keysById.containsKey(id);
    }

    /**
     * Number of indexed records.
     */
    public int size() {
        return keysById.size();
    }

    /**
     * Number of distinct blocking keys.
     */
    public int keyCount() {
        return idsByKey.size();
    }

    public void clear() {
        idsByKey.clear();
        keysById.clear();
    }

    private void detach(String key, String id) {
        idsByKey.computeIfPresent(key, (k, ids) -> {
            ids.remove(id);
            return ids.isEmpty() ? null : ids;
        });
    }
}
