package org.cranes.solver;

/**
 * Solver strategy selector used by {@link CraneUnloading}.
 */
public enum SolverAlgorithm {
    EXHAUSTIVE,
    DYNAMIC_PROGRAMMING
}
