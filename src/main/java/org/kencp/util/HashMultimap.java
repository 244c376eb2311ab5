/*
 * KenCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.kencp.util;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Insertion-ordered multimap. Keys registered with {@link #putKey(Object)}
 * are kept even when they have no value.
 */
public class HashMultimap<K,V> {
    private final LinkedHashMap<K, LinkedHashSet<V>> map;
    private final Set<V> emptySet = Collections.unmodifiableSet(new LinkedHashSet<>());

    public HashMultimap() {
        map = new LinkedHashMap<>();
    }

    public Set<V> get(K key) {
        if(map.containsKey(key))
            return Collections.unmodifiableSet(map.get(key));
        return emptySet;
    }

    public void putKey(K key) {
        map.computeIfAbsent(key, k -> new LinkedHashSet<>());
    }

    public void put(K key, V value) {
        putKey(key);
        map.get(key).add(value);
    }

    public boolean containsEntry(K key, V value) {
        return map.containsKey(key) && map.get(key).contains(value);
    }

    public int size() {
        int n = 0;
        for (LinkedHashSet<V> values: map.values())
            n += values.size();
        return n;
    }

    public boolean isEmpty() {
        return map.isEmpty();
    }

    public Set<K> keySet() {
        return Collections.unmodifiableSet(map.keySet());
    }
}
