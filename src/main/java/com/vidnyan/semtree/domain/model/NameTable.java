package com.vidnyan.semtree.domain.model;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Interning table for element and attribute names shared by every arena.
 * Filled from the rule tables at startup; construction only reads it, so names taken from
 * source text (data keys, raw kinds) are never added.
 */
public final class NameTable {

    private final Map<String, String> names = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Returns the registered instance of {@code name}, or {@code name} itself when it was never
     * registered. Never modifies the table.
     */
    public String lookup(String name) {
        lock.readLock().lock();
        try {
            String known = names.get(name);
            return known != null ? known : name;
        } finally {
            lock.readLock().unlock();
        }
    }

    public void registerAll(Collection<String> values) {
        lock.writeLock().lock();
        try {
            for (String value : values) {
                names.putIfAbsent(value, value);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean contains(String name) {
        lock.readLock().lock();
        try {
            return names.containsKey(name);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return names.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
