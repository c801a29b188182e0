package org.cranes.grid;

/**
 * Classification of one grid cell.
 *
 * <p>{@code BUILDING} cells can never be occupied by a path. Every other cell
 * contributes at most one crane to a path's count.</p>
 */
public enum CellKind {
    EMPTY,
    CRANE,
    BUILDING
}
