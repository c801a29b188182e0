package org.cranes.solver;

import org.cranes.grid.Grid;
import org.cranes.path.Path;

/**
 * Solver abstraction for the crane unloading problem.
 */
public interface CraneUnloadingSolver {
    /**
     * Finds a monotone East/South path from (0,0) that collects the most cranes.
     *
     * @param grid non-empty grid whose start cell is not a building.
     * @return best path found.
     * @throws org.cranes.core.CraneUnloadingException when grid preconditions fail.
     */
    Path solve(Grid grid);

    /**
     * Returns the algorithm this solver implements.
     */
    SolverAlgorithm algorithm();
}
