package org.varavin.zones;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Мемоизация производных величин (уровней, карт) по {@link CacheKey}.
 * Очищается только явным вызовом {@link #invalidate()} из цикла по дням.
 */
public class SeriesCache<V> {

    private final String name;
    private final Map<CacheKey, V> entries = new HashMap<>();
    private long hits;
    private long misses;

    public SeriesCache(String name) {
        this.name = name;
    }

    public V getOrCompute(CacheKey key, Supplier<V> loader) {
        V cached = entries.get(key);
        if (cached != null) {
            hits++;
            return cached;
        }
        misses++;
        V value = loader.get();
        entries.put(key, value);
        return value;
    }

    public void put(CacheKey key, V value) {
        entries.put(key, value);
    }

    public boolean contains(CacheKey key) {
        return entries.containsKey(key);
    }

    public void invalidate() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    public long hits() {
        return hits;
    }

    public long misses() {
        return misses;
    }

    @Override
    public String toString() {
        return name + "{size=" + entries.size() + ", hits=" + hits + ", misses=" + misses + '}';
    }
}
