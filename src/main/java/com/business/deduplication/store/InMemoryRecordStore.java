package com.business.deduplication.store;

import com.business.deduplication.core.model.BusinessRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Thread-safe in-memory {@link RecordStore} that lists records in insertion order.
 */
public class InMemoryRecordStore implements RecordStore {

    private final Map<String, BusinessRecord> records = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public InMemoryRecordStore() {
    }

    public InMemoryRecordStore(Collection<BusinessRecord> initial) {
        initial.forEach(this::save);
    }

    @Override
    public Optional<BusinessRecord> get(String id) {
        if (id == null) {
            return Optional.empty();
        }
        lock.readLock().lock();
        try {
            return Optional.ofNullable(records.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<BusinessRecord> list() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(records.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Inserts or replaces a record.
     *
     * @return true if a record with the same id was replaced
     * @throws IllegalArgumentException if the record has no id
     */
    public boolean save(BusinessRecord record) {
        if (!record.hasId()) {
            throw new IllegalArgumentException("Cannot store a record without an id");
        }
        lock.writeLock().lock();
        try {
            return records.put(record.getId(), record) != null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean delete(String id) {
        lock.writeLock().lock();
        try {
            return records.remove(id) != null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return records.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            records.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
