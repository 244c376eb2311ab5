/*
 * KenCP is under MIT License
 * Copyright (c)  2024 UCLouvain
 */

package org.kencp.search;

/**
 * Counters of one search run.
 */
public class SearchStatistics {

    private int nNodes;
    private int nFailures;
    private int nSolutions;
    private long nAssignments;
    private long nChecks;
    private boolean completed;

    void incrNodes() {
        nNodes++;
    }

    void incrFailures() {
        nFailures++;
    }

    void incrSolutions() {
        nSolutions++;
    }

    void incrAssignments() {
        nAssignments++;
    }

    void incrChecks() {
        nChecks++;
    }

    void setCompleted() {
        completed = true;
    }

    public int numberOfNodes() {
        return nNodes;
    }

    public int numberOfFailures() {
        return nFailures;
    }

    public int numberOfSolutions() {
        return nSolutions;
    }

    public long numberOfAssignments() {
        return nAssignments;
    }

    public long numberOfConstraintChecks() {
        return nChecks;
    }

    /**
     * @return true if the search space was exhausted, false if it stopped on its limit
     */
    public boolean isCompleted() {
        return completed;
    }

    @Override
    public String toString() {
        return String.format("\n\t#nodes: %d\n\t#failures: %d\n\t#solutions: %d\n\t#assignments: %d\n\t#checks: %d\n\tcompleted: %b\n",
                nNodes, nFailures, nSolutions, nAssignments, nChecks, completed);
    }
}
