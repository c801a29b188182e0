package org.cranes.solver;

import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.cranes.core.CraneUnloadingException;
import org.cranes.grid.Grid;
import org.cranes.path.Path;

/**
 * Entry point for solving crane unloading problems.
 *
 * <p>The facade owns one instance of each solver and dispatches on
 * {@link SolverAlgorithm}. Both solvers are stateless, so one facade can serve
 * concurrent callers. Execution flow:</p>
 * <ul>
 * <li>Validate the algorithm selector.</li>
 * <li>Delegate to the selected solver, which validates grid preconditions before any work.</li>
 * </ul>
 */
@Slf4j
public final class CraneUnloading {
    private static final CraneUnloading DEFAULT = CraneUnloading.builder().build();

    private final CraneUnloadingSolver exhaustiveSolver;
    private final CraneUnloadingSolver dynamicProgrammingSolver;

    /**
     * Creates the facade.
     *
     * @param searchBudget optional exhaustive-search bound; {@link SearchBudget#defaults()} when null.
     */
    @Builder
    public CraneUnloading(SearchBudget searchBudget) {
        this.exhaustiveSolver = new ExhaustiveSolver(searchBudget == null ? SearchBudget.defaults() : searchBudget);
        this.dynamicProgrammingSolver = new DynamicProgrammingSolver();
    }

    /**
     * Solves with the exhaustive reference algorithm.
     *
     * @param grid non-empty grid with {@code rows + columns - 2} inside the search budget.
     * @return best path found.
     * @throws CraneUnloadingException when grid preconditions fail.
     */
    public static Path exhaustive(Grid grid) {
        return DEFAULT.solve(grid, SolverAlgorithm.EXHAUSTIVE);
    }

    /**
     * Solves with the dynamic-programming algorithm.
     *
     * @param grid non-empty grid.
     * @return best path found.
     * @throws CraneUnloadingException when grid preconditions fail.
     */
    public static Path dynamicProgramming(Grid grid) {
        return DEFAULT.solve(grid, SolverAlgorithm.DYNAMIC_PROGRAMMING);
    }

    /**
     * Solves one grid with the selected algorithm.
     *
     * @param grid grid to solve.
     * @param algorithm algorithm to run.
     * @return best path found.
     * @throws CraneUnloadingException when the algorithm is missing or grid preconditions fail.
     */
    public Path solve(Grid grid, SolverAlgorithm algorithm) {
        CraneUnloadingSolver solver = solver(algorithm);
        log.debug("dispatching {} solve for {}", algorithm, grid);
        return solver.solve(grid);
    }

    /**
     * Returns the solver instance bound to one algorithm.
     *
     * @throws CraneUnloadingException when {@code algorithm} is null.
     */
    public CraneUnloadingSolver solver(SolverAlgorithm algorithm) {
        if (algorithm == null) {
            throw new CraneUnloadingException(
                    CraneUnloadingException.REASON_ALGORITHM_REQUIRED,
                    "algorithm must be specified"
            );
        }
        return switch (algorithm) {
            case EXHAUSTIVE -> exhaustiveSolver;
            case DYNAMIC_PROGRAMMING -> dynamicProgrammingSolver;
        };
    }
}
