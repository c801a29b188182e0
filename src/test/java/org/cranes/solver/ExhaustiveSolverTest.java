package org.cranes.solver;

import org.cranes.core.CraneUnloadingException;
import org.cranes.grid.Grid;
import org.cranes.path.Path;
import org.cranes.testutil.GridFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.cranes.path.StepDirection.EAST;
import static org.cranes.path.StepDirection.SOUTH;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("Exhaustive Solver Tests")
class ExhaustiveSolverTest {
    private final ExhaustiveSolver solver = new ExhaustiveSolver(SearchBudget.of(SearchBudget.MAX_STEPS_CEILING));

    @Test
    @DisplayName("1x1: zero-length path counting the single cell")
    void testSingleCell() {
        Path crane = solver.solve(GridFixtures.parse("C"));
        assertEquals(0, crane.length());
        assertEquals(1, crane.totalCranes());

        Path empty = solver.solve(GridFixtures.parse("."));
        assertEquals(0, empty.length());
        assertEquals(0, empty.totalCranes());
    }

    @Test
    @DisplayName("Diagonal cranes: first full-length pattern (EAST, SOUTH) wins")
    void testDiagonalCranes() {
        Path best = solver.solve(GridFixtures.parse("C.", ".C"));
        assertEquals(2, best.totalCranes());
        assertEquals(List.of(EAST, SOUTH), best.steps());
    }

    @Test
    @DisplayName("Building east of start: only SOUTH, EAST survives")
    void testBuildingForcesSouth() {
        Path best = solver.solve(GridFixtures.parse("CX", ".C"));
        assertEquals(2, best.totalCranes());
        assertEquals(List.of(SOUTH, EAST), best.steps());
        GridFixtures.assertWellFormed(best);
    }

    @Test
    @DisplayName("Ties keep the shorter path")
    void testTieKeepsShorter() {
        Path best = solver.solve(GridFixtures.parse("C.C."));
        assertEquals(2, best.totalCranes());
        assertEquals(List.of(EAST, EAST), best.steps());
    }

    @Test
    @DisplayName("Single row and single column stop at the first building")
    void testSingleLine() {
        assertEquals(2, solver.solve(GridFixtures.parse("C.CXC")).totalCranes());
        assertEquals(2, solver.solve(GridFixtures.parse("C", ".", "C", "X", "C")).totalCranes());
        assertEquals(3, solver.solve(GridFixtures.parse("CC.C")).totalCranes());
    }

    @Test
    @DisplayName("Walled-in start returns the trivial path")
    void testWalledIn() {
        Path best = solver.solve(GridFixtures.parse("CXC", "XCC"));
        assertEquals(0, best.length());
        assertEquals(1, best.totalCranes());
    }

    @Test
    @DisplayName("Preconditions: null, empty and blocked-start grids are rejected")
    void testPreconditions() {
        CraneUnloadingException nullGrid = assertThrows(CraneUnloadingException.class, () -> solver.solve(null));
        assertEquals(CraneUnloadingException.REASON_GRID_REQUIRED, nullGrid.getReasonCode());

        CraneUnloadingException empty = assertThrows(
                CraneUnloadingException.class,
                () -> solver.solve(Grid.builder(0, 3).build())
        );
        assertEquals(CraneUnloadingException.REASON_GRID_EMPTY, empty.getReasonCode());

        CraneUnloadingException blocked = assertThrows(
                CraneUnloadingException.class,
                () -> solver.solve(GridFixtures.parse("X.", ".."))
        );
        assertEquals(CraneUnloadingException.REASON_START_BLOCKED, blocked.getReasonCode());
    }

    @Test
    @DisplayName("Budget: 64 steps exceed the 64-bit enumeration ceiling before any work")
    void testCeilingEnforced() {
        CraneUnloadingException ex = assertThrows(
                CraneUnloadingException.class,
                () -> solver.solve(Grid.builder(33, 33).build())
        );
        assertEquals(CraneUnloadingException.REASON_GRID_TOO_LARGE, ex.getReasonCode());
    }

    @Test
    @DisplayName("Budget: configured bound below the ceiling is enforced")
    void testConfiguredBudget() {
        ExhaustiveSolver bounded = new ExhaustiveSolver(SearchBudget.of(4));
        assertEquals(1, bounded.solve(GridFixtures.parse("C..", "...", "...")).totalCranes());

        CraneUnloadingException ex = assertThrows(
                CraneUnloadingException.class,
                () -> bounded.solve(GridFixtures.parse("C...", "....", "...."))
        );
        assertEquals(CraneUnloadingException.REASON_GRID_TOO_LARGE, ex.getReasonCode());
    }

    @Test
    @DisplayName("Algorithm identity")
    void testAlgorithm() {
        assertEquals(SolverAlgorithm.EXHAUSTIVE, solver.algorithm());
    }
}
