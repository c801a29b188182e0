package org.cranes.path;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Moves allowed on a monotone path.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public enum StepDirection {
    EAST(0, 1),
    SOUTH(1, 0);

    /** Row delta applied by this move. */
    private final int rowDelta;
    /** Column delta applied by this move. */
    private final int columnDelta;
}
