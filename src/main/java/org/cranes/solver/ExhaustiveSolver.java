package org.cranes.solver;

import lombok.extern.slf4j.Slf4j;
import org.cranes.grid.Grid;
import org.cranes.path.Path;
import org.cranes.path.StepDirection;

import java.util.Objects;

/**
 * Brute-force crane unloading solver.
 *
 * <p>For every length {@code L} in {@code [1, rows + columns - 2]} the solver walks
 * all {@code 2^L} bit patterns in ascending order. Bit {@code k} (least significant
 * first) selects the k-th move: {@code 1 -> EAST}, {@code 0 -> SOUTH}. A pattern that
 * hits an invalid move is discarded outright; the alternate direction is never tried.</p>
 *
 * <p>A complete candidate replaces the incumbent only when it collects strictly more
 * cranes, so ties keep the shorter path, then the lower bit pattern. Running time is
 * exponential; this solver is the correctness reference for
 * {@link DynamicProgrammingSolver}.</p>
 */
@Slf4j
public final class ExhaustiveSolver implements CraneUnloadingSolver {
    private final SearchBudget budget;

    /**
     * Creates a solver bounded by {@link SearchBudget#defaults()}.
     */
    public ExhaustiveSolver() {
        this(SearchBudget.defaults());
    }

    /**
     * Creates a solver bounded by an explicit budget.
     *
     * @param budget maximum path length to enumerate.
     */
    public ExhaustiveSolver(SearchBudget budget) {
        this.budget = Objects.requireNonNull(budget, "budget");
    }

    @Override
    public Path solve(Grid grid) {
        SolverContracts.requireSolvable(grid);
        int maxSteps = grid.rows() + grid.columns() - 2;
        budget.checkSteps(maxSteps);

        Path best = new Path(grid);
        long enumerated = 0L;
        long accepted = 0L;

        for (int steps = 1; steps <= maxSteps; steps++) {
            long lastPattern = (1L << steps) - 1L;
            // lastPattern may be Long.MAX_VALUE for 63 steps, so the loop exits on equality.
            for (long bits = 0L; ; bits++) {
                enumerated++;
                Path candidate = replayPattern(grid, bits, steps);
                if (candidate != null) {
                    accepted++;
                    if (candidate.totalCranes() > best.totalCranes()) {
                        best = candidate;
                    }
                }
                if (bits == lastPattern) {
                    break;
                }
            }
        }

        log.debug("exhaustive solve {}x{}: enumerated={}, valid={}, bestCranes={}",
                grid.rows(), grid.columns(), enumerated, accepted, best.totalCranes());
        return best;
    }

    @Override
    public SolverAlgorithm algorithm() {
        return SolverAlgorithm.EXHAUSTIVE;
    }

    /**
     * Builds the candidate encoded by the low {@code steps} bits of {@code bits}.
     *
     * @return the candidate, or {@code null} when any encoded move is invalid.
     */
    private static Path replayPattern(Grid grid, long bits, int steps) {
        Path candidate = new Path(grid);
        for (int k = 0; k < steps; k++) {
            StepDirection direction = ((bits >>> k) & 1L) == 1L ? StepDirection.EAST : StepDirection.SOUTH;
            if (!candidate.isStepValid(direction)) {
                return null;
            }
            candidate.addStep(direction);
        }
        return candidate;
    }
}
