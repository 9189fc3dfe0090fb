package com.example.tripstate.eviction;

import com.example.tripstate.core.CacheEntry;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * LRU eviction backed by an intrusive doubly linked list.
 * Head is the most recently used key, tail the least recently used one.
 * Every operation is O(1).
 */
public class LruEvictionStrategy<K> implements EvictionStrategy<K> {

    private static class Node<K> {
        final K key;
        Node<K> prev;
        Node<K> next;

        Node(K key) {
            this.key = key;
        }
    }

    // Key -> Node map for O(1) access
    private final Map<K, Node<K>> nodeMap = new HashMap<>();

    private Node<K> head;
    private Node<K> tail;

    @Override
    public void onHit(K key) {
        Node<K> node = nodeMap.get(key);
        if (node != null && node != head) {
            unlink(node);
            addToHead(node);
        }
    }

    @Override
    public void onInsert(K key) {
        Node<K> node = nodeMap.get(key);
        if (node != null) {
            // Rewrite of an existing key counts as an access
            onHit(key);
            return;
        }
        node = new Node<>(key);
        nodeMap.put(key, node);
        addToHead(node);
    }

    @Override
    public void onRemove(K key) {
        Node<K> node = nodeMap.remove(key);
        if (node != null) {
            unlink(node);
        }
    }

    @Override
    public Optional<K> selectVictim(Map<K, ? extends CacheEntry<?>> store) {
        while (tail != null) {
            Node<K> candidate = tail;
            unlink(candidate);
            nodeMap.remove(candidate.key);
            // candidate may already be removed from store
            if (store.containsKey(candidate.key)) {
                return Optional.of(candidate.key);
            }
        }
        return Optional.empty();
    }

    @Override
    public void clear() {
        nodeMap.clear();
        head = null;
        tail = null;
    }

    // --- Doubly linked list operations ---

    private void addToHead(Node<K> node) {
        node.prev = null;
        node.next = head;
        if (head != null) {
            head.prev = node;
        }
        head = node;
        if (tail == null) {
            tail = node;
        }
    }

    private void unlink(Node<K> node) {
        if (node.prev != null) {
            node.prev.next = node.next;
        } else {
            head = node.next;
        }

        if (node.next != null) {
            node.next.prev = node.prev;
        } else {
            tail = node.prev;
        }
        node.prev = null;
        node.next = null;
    }
}
