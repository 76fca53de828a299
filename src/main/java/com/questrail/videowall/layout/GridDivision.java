package com.questrail.videowall.layout;

/**
 * GridDivision
 * -----------------------------------------------------------------------------
 * Immutable grid layout derived from a single non-negative "division index".
 *
 * <h2>Growth rule</h2>
 * Starting from a 1x1 grid, each increment of the index adds one column while
 * {@code columns <= rows}, otherwise one row. The screen is assumed to be wide
 * rather than tall, so columns never lag rows:
 *
 * <pre>
 *   0 -> 1x1    1 -> 2x1    2 -> 2x2    3 -> 3x2    4 -> 3x3
 * </pre>
 *
 * @param columns   number of columns (&gt; 0)
 * @param rows      number of rows (&gt; 0)
 * @param tileCount {@code columns * rows}
 */
public record GridDivision(int columns, int rows, int tileCount)
{
    public GridDivision {
        if (columns <= 0 || rows <= 0) {
            throw new IllegalArgumentException(
                    "columns and rows must be > 0, got " + columns + "x" + rows);
        }
        if (tileCount != columns * rows) {
            throw new IllegalArgumentException(
                    "tileCount must equal columns * rows, got " + tileCount);
        }
    }

    /**
     * Computes the division for the given index.
     *
     * @throws IllegalArgumentException if {@code index < 0}
     */
    public static GridDivision fromIndex(int index)
    {
        if (index < 0) {
            throw new IllegalArgumentException("division index must be >= 0, got " + index);
        }

        int columns = 1;
        int rows = 1;
        int remaining = index;
        while (remaining != 0) {
            remaining--;
            if (columns <= rows) {
                columns++;
            } else {
                rows++;
            }
        }
        return new GridDivision(columns, rows, columns * rows);
    }

    /**
     * Returns the column of a tile index (row-major placement).
     */
    public int columnOf(int tile)
    {
        requireTile(tile);
        return tile % columns;
    }

    /**
     * Returns the row of a tile index (row-major placement).
     */
    public int rowOf(int tile)
    {
        requireTile(tile);
        return tile / columns;
    }

    /**
     * Returns the geometry of a tile within this division.
     */
    public TileGeometry geometryOf(int tile)
    {
        return TileGeometry.of(columns, rows, columnOf(tile), rowOf(tile));
    }

    private void requireTile(int tile)
    {
        if (tile < 0 || tile >= tileCount) {
            throw new IllegalArgumentException(
                    "tile " + tile + " outside [0, " + tileCount + ")");
        }
    }

    @Override
    public String toString()
    {
        return columns + "x" + rows;
    }
}
