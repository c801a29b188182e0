package org.cranes.solver;

import org.cranes.core.CraneUnloadingException;

/**
 * Bound on the path length the exhaustive solver is allowed to enumerate.
 *
 * <p>Candidates of length {@code L} are encoded in the low {@code L} bits of a
 * 64-bit counter, so {@link #MAX_STEPS_CEILING} is a hard limit regardless of
 * configuration.</p>
 */
public final class SearchBudget {
    public static final int MAX_STEPS_CEILING = 63;
    public static final String PROP_MAX_STEPS = "cranes.exhaustive.maxSteps";

    private final int maxSteps;

    private SearchBudget(int maxSteps) {
        this.maxSteps = normalizeBound(maxSteps);
    }

    /**
     * Creates a budget with an explicit bound.
     *
     * <p>Non-positive bounds and bounds above the ceiling normalize to the ceiling.</p>
     */
    public static SearchBudget of(int maxSteps) {
        return new SearchBudget(maxSteps);
    }

    /**
     * Loads the bound from the {@value #PROP_MAX_STEPS} system property.
     */
    public static SearchBudget defaults() {
        return SearchBudget.of(readBound(PROP_MAX_STEPS));
    }

    /**
     * Returns the effective bound.
     */
    public int maxSteps() {
        return maxSteps;
    }

    /**
     * Validates the step count a grid needs against the configured bound.
     *
     * @param requiredSteps {@code rows + columns - 2} for the grid being solved.
     * @throws CraneUnloadingException with {@link CraneUnloadingException#REASON_GRID_TOO_LARGE}.
     */
    void checkSteps(int requiredSteps) {
        if (requiredSteps > maxSteps) {
            throw new CraneUnloadingException(
                    CraneUnloadingException.REASON_GRID_TOO_LARGE,
                    "exhaustive search step budget exceeded: " + requiredSteps + " > " + maxSteps
            );
        }
    }

    private static int normalizeBound(int bound) {
        if (bound <= 0 || bound > MAX_STEPS_CEILING) {
            return MAX_STEPS_CEILING;
        }
        return bound;
    }

    private static int readBound(String property) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return MAX_STEPS_CEILING;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            return MAX_STEPS_CEILING;
        }
    }

    @Override
    public String toString() {
        return "SearchBudget{maxSteps=" + maxSteps + '}';
    }
}
