package org.cranes.solver;

import lombok.experimental.UtilityClass;
import org.cranes.core.CraneUnloadingException;
import org.cranes.grid.CellKind;
import org.cranes.grid.Grid;

/**
 * Preconditions shared by every solver, checked before any work starts.
 */
@UtilityClass
class SolverContracts {

    /**
     * Rejects null or empty grids and grids whose start cell is a building.
     */
    static void requireSolvable(Grid grid) {
        if (grid == null) {
            throw new CraneUnloadingException(CraneUnloadingException.REASON_GRID_REQUIRED, "grid must be provided");
        }
        if (grid.isEmpty()) {
            throw new CraneUnloadingException(
                    CraneUnloadingException.REASON_GRID_EMPTY,
                    "grid must be non-empty, got " + grid.rows() + "x" + grid.columns()
            );
        }
        if (grid.get(0, 0) == CellKind.BUILDING) {
            throw new CraneUnloadingException(
                    CraneUnloadingException.REASON_START_BLOCKED,
                    "start cell (0,0) must not be a building"
            );
        }
    }
}
