package org.cranes.grid;

/**
 * One coordinate on a grid.
 *
 * @param row zero-based row, growing southwards.
 * @param column zero-based column, growing eastwards.
 */
public record GridCell(int row, int column) {
}
