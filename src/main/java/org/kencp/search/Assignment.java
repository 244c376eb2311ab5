/*
 * KenCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.kencp.search;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A partial mapping from variables to tuples.
 *
 * @param <V> the variable type
 */
public class Assignment<V> {

    private final LinkedHashMap<V, int[]> values = new LinkedHashMap<>();

    public Assignment() {}

    public Assignment(Assignment<V> other) {
        values.putAll(other.values);
    }

    public void assign(V var, int[] tuple) {
        values.put(var, tuple);
    }

    public void unassign(V var) {
        values.remove(var);
    }

    public Optional<int[]> get(V var) {
        return Optional.ofNullable(values.get(var));
    }

    public boolean isAssigned(V var) {
        return values.containsKey(var);
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Set<V> variables() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public Map<V, int[]> asMap() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (Map.Entry<V, int[]> e : values.entrySet()) {
            if (sb.length() > 1) sb.append(", ");
            sb.append(e.getKey()).append("=").append(java.util.Arrays.toString(e.getValue()));
        }
        return sb.append("}").toString();
    }
}
