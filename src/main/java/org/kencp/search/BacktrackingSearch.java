/*
 * KenCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.kencp.search;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Depth-first backtracking search over a {@link BinaryCSP}, optionally
 * interleaved with forward checking or arc consistency maintenance.
 * The problem is never modified: each call to {@link #solve(Predicate)} works on
 * a fresh assignment and on its own copy of the current domains.
 *
 * @param <V> the variable type
 */
public class BacktrackingSearch<V> {

    private record Removal(int var, int index) {}

    private final BinaryCSP<V> csp;
    private final Inference inference;
    private final VariableOrdering ordering;
    private final List<Consumer<Assignment<V>>> solutionListeners = new ArrayList<>();

    private final List<V> vars;
    private final Map<V, Integer> varIndex = new HashMap<>();
    private final List<List<int[]>> domains = new ArrayList<>();
    private final int[][] neighbors;

    // state of the current run
    private BitSet[] alive;
    private Assignment<V> assignment;
    private SearchStatistics stats;
    private Assignment<V> solution;

    public BacktrackingSearch(BinaryCSP<V> csp) {
        this(csp, Inference.NONE, VariableOrdering.STATIC);
    }

    public BacktrackingSearch(BinaryCSP<V> csp, Inference inference) {
        this(csp, inference, VariableOrdering.STATIC);
    }

    public BacktrackingSearch(BinaryCSP<V> csp, Inference inference, VariableOrdering ordering) {
        this.csp = csp;
        this.inference = inference;
        this.ordering = ordering;
        this.vars = List.copyOf(csp.variables());
        for (int i = 0; i < vars.size(); i++) {
            varIndex.put(vars.get(i), i);
            domains.add(csp.domain(vars.get(i)));
        }
        this.neighbors = new int[vars.size()][];
        for (int i = 0; i < vars.size(); i++) {
            neighbors[i] = csp.neighbors(vars.get(i)).stream().mapToInt(varIndex::get).toArray();
        }
    }

    /**
     * Adds a listener called with a copy of each complete assignment found.
     */
    public void onSolution(Consumer<Assignment<V>> listener) {
        solutionListeners.add(listener);
    }

    /**
     * Explores the whole search tree.
     */
    public SearchStatistics solve() {
        return solve(s -> false);
    }

    /**
     * Explores the search tree until it is exhausted or until limit holds after a solution.
     * A run with no solution means the problem is unsatisfiable.
     *
     * @param limit checked after each solution, the search stops when it returns true
     * @return the statistics of this run
     */
    public SearchStatistics solve(Predicate<SearchStatistics> limit) {
        alive = new BitSet[vars.size()];
        for (int i = 0; i < vars.size(); i++) {
            alive[i] = new BitSet(domains.get(i).size());
            alive[i].set(0, domains.get(i).size());
        }
        assignment = new Assignment<>();
        stats = new SearchStatistics();
        solution = null;
        if (!dfs(limit))
            stats.setCompleted();
        return stats;
    }

    /**
     * @return the first solution of the last run, empty if it found none
     */
    public Optional<Assignment<V>> solution() {
        return Optional.ofNullable(solution);
    }

    /**
     * @return true if the search must stop
     */
    private boolean dfs(Predicate<SearchStatistics> limit) {
        stats.incrNodes();
        if (assignment.size() == vars.size()) {
            stats.incrSolutions();
            Assignment<V> found = new Assignment<>(assignment);
            if (solution == null)
                solution = found;
            for (Consumer<Assignment<V>> listener : solutionListeners)
                listener.accept(found);
            return limit.test(stats);
        }
        int var = selectVariable();
        List<int[]> domain = domains.get(var);
        // the bits of var may change while propagating, iterate over a snapshot
        BitSet values = (BitSet) alive[var].clone();
        for (int k = values.nextSetBit(0); k >= 0; k = values.nextSetBit(k + 1)) {
            int[] value = domain.get(k);
            if (!consistent(var, value)) {
                stats.incrFailures();
                continue;
            }
            assignment.assign(vars.get(var), value);
            stats.incrAssignments();
            List<Removal> removals = new ArrayList<>();
            boolean stop = false;
            if (propagate(var, k, removals)) {
                stop = dfs(limit);
            } else {
                stats.incrFailures();
            }
            restore(removals);
            assignment.unassign(vars.get(var));
            if (stop)
                return true;
        }
        return false;
    }

    private int selectVariable() {
        int best = -1;
        for (int i = 0; i < vars.size(); i++) {
            if (assignment.isAssigned(vars.get(i)))
                continue;
            if (ordering == VariableOrdering.STATIC)
                return i;
            if (best < 0 || alive[i].cardinality() < alive[best].cardinality())
                best = i;
        }
        return best;
    }

    private boolean consistent(int var, int[] value) {
        for (int n : neighbors[var]) {
            Optional<int[]> other = assignment.get(vars.get(n));
            if (other.isPresent() && !check(var, value, n, other.get()))
                return false;
        }
        return true;
    }

    private boolean propagate(int var, int k, List<Removal> removals) {
        switch (inference) {
            case NONE:
                return true;
            case FORWARD_CHECKING:
                suppose(var, k, removals);
                return forwardCheck(var, domains.get(var).get(k), removals);
            case MAC:
                suppose(var, k, removals);
                return arcConsistency(var, removals);
            default:
                throw new IllegalStateException("unknown inference " + inference);
        }
    }

    /**
     * Reduces the current domain of var to the value at index k.
     */
    private void suppose(int var, int k, List<Removal> removals) {
        BitSet bits = alive[var];
        for (int i = bits.nextSetBit(0); i >= 0; i = bits.nextSetBit(i + 1)) {
            if (i != k)
                removals.add(new Removal(var, i));
        }
        bits.clear();
        bits.set(k);
    }

    private boolean forwardCheck(int var, int[] value, List<Removal> removals) {
        for (int n : neighbors[var]) {
            if (assignment.isAssigned(vars.get(n)))
                continue;
            BitSet bits = alive[n];
            List<int[]> domain = domains.get(n);
            for (int i = bits.nextSetBit(0); i >= 0; i = bits.nextSetBit(i + 1)) {
                if (!check(var, value, n, domain.get(i))) {
                    bits.clear(i);
                    removals.add(new Removal(n, i));
                }
            }
            if (bits.isEmpty())
                return false;
        }
        return true;
    }

    /**
     * AC-3 starting from the arcs pointing to var.
     */
    private boolean arcConsistency(int var, List<Removal> removals) {
        Deque<int[]> queue = new ArrayDeque<>();
        for (int n : neighbors[var])
            queue.add(new int[]{n, var});
        while (!queue.isEmpty()) {
            int[] arc = queue.poll();
            int xi = arc[0], xj = arc[1];
            if (revise(xi, xj, removals)) {
                if (alive[xi].isEmpty())
                    return false;
                for (int xk : neighbors[xi]) {
                    if (xk != xj)
                        queue.add(new int[]{xk, xi});
                }
            }
        }
        return true;
    }

    /**
     * Removes the tuples of xi without support in xj.
     *
     * @return true if the domain of xi changed
     */
    private boolean revise(int xi, int xj, List<Removal> removals) {
        boolean revised = false;
        BitSet bi = alive[xi];
        BitSet bj = alive[xj];
        List<int[]> di = domains.get(xi);
        List<int[]> dj = domains.get(xj);
        for (int i = bi.nextSetBit(0); i >= 0; i = bi.nextSetBit(i + 1)) {
            boolean supported = false;
            for (int j = bj.nextSetBit(0); j >= 0 && !supported; j = bj.nextSetBit(j + 1)) {
                supported = check(xi, di.get(i), xj, dj.get(j));
            }
            if (!supported) {
                bi.clear(i);
                removals.add(new Removal(xi, i));
                revised = true;
            }
        }
        return revised;
    }

    private void restore(List<Removal> removals) {
        for (Removal r : removals)
            alive[r.var()].set(r.index());
    }

    private boolean check(int a, int[] ta, int b, int[] tb) {
        stats.incrChecks();
        return csp.compatible(vars.get(a), ta, vars.get(b), tb);
    }
}
