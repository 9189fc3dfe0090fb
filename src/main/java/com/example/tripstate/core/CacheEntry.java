package com.example.tripstate.core;

public class CacheEntry<V> {
    public V value;
    public long createdAt;    // epoch millis of the last write, drives TTL
    public long accessedAt;   // epoch millis of the last write or successful read, drives LRU

    public CacheEntry(V value, long now) {
        this.value = value;
        this.createdAt = now;
        this.accessedAt = now;
    }

    void rewrite(V newValue, long now) {
        this.value = newValue;
        this.createdAt = now;
        this.accessedAt = now;
    }

    void touch(long now) {
        this.accessedAt = now;
    }
}
