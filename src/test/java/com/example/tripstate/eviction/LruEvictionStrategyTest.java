package com.example.tripstate.eviction;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.example.tripstate.core.CacheEntry;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class LruEvictionStrategyTest {

    private final LruEvictionStrategy<String> strategy = new LruEvictionStrategy<>();
    private final Map<String, CacheEntry<Integer>> store = new HashMap<>();

    @Test
    void victimsComeOutInLeastRecentlyUsedOrder() {
        insert("a");
        insert("b");
        insert("c");
        strategy.onHit("a");

        assertEquals(Optional.of("b"), victim());
        assertEquals(Optional.of("c"), victim());
        assertEquals(Optional.of("a"), victim());
        assertEquals(Optional.empty(), victim());
    }

    @Test
    void reinsertMovesKeyToFront() {
        insert("a");
        insert("b");
        strategy.onInsert("a");

        assertEquals(Optional.of("b"), victim());
    }

    @Test
    void removedKeysAreNeverVictims() {
        insert("a");
        insert("b");
        strategy.onRemove("a");
        store.remove("a");

        assertEquals(Optional.of("b"), victim());
        assertEquals(Optional.empty(), victim());
    }

    @Test
    void skipsKeysTheStoreNoLongerHolds() {
        insert("a");
        insert("b");
        store.remove("a");

        assertEquals(Optional.of("b"), victim());
    }

    @Test
    void hitOnUnknownKeyIsIgnored() {
        insert("a");
        strategy.onHit("ghost");

        assertEquals(Optional.of("a"), victim());
    }

    @Test
    void clearForgetsEverything() {
        insert("a");
        strategy.clear();

        assertEquals(Optional.empty(), strategy.selectVictim(store));
    }

    private void insert(String key) {
        store.put(key, new CacheEntry<>(1, 0L));
        strategy.onInsert(key);
    }

    private Optional<String> victim() {
        Optional<String> victim = strategy.selectVictim(store);
        victim.ifPresent(store::remove);
        return victim;
    }
}
