package com.questrail.videowall.layout;

/**
 * TileGeometry
 * -----------------------------------------------------------------------------
 * Placement of one tile inside a {@link GridDivision}.
 *
 * <p>The rendering surface consumes the geometry as an X11-style string
 * ({@link #toGeometryString()}): {@code <w>%x<h>%<x-anchor><y-anchor>}. Edge
 * tiles are anchored to the screen edge ({@code +0} or {@code -0}) so integer
 * percentages never leave a sliver uncovered at the right or bottom; inner
 * tiles carry an explicit offset. Nothing in this project interprets the
 * string beyond producing it.</p>
 *
 * <p>The exact fractional bounds ({@link #left()}, {@link #right()}, ...) are
 * exposed separately for layout reasoning independent of percent rounding.</p>
 */
public record TileGeometry(int columns, int rows, int column, int row)
{
    public TileGeometry {
        if (columns <= 0 || rows <= 0) {
            throw new IllegalArgumentException(
                    "columns and rows must be > 0, got " + columns + "x" + rows);
        }
        if (column < 0 || column >= columns) {
            throw new IllegalArgumentException(
                    "column " + column + " outside [0, " + columns + ")");
        }
        if (row < 0 || row >= rows) {
            throw new IllegalArgumentException(
                    "row " + row + " outside [0, " + rows + ")");
        }
    }

    public static TileGeometry of(int columns, int rows, int column, int row)
    {
        return new TileGeometry(columns, rows, column, row);
    }

    public int widthPercent()
    {
        return 100 / columns;
    }

    public int heightPercent()
    {
        return 100 / rows;
    }

    public double left()
    {
        return (double) column / columns;
    }

    public double right()
    {
        return (double) (column + 1) / columns;
    }

    public double top()
    {
        return (double) row / rows;
    }

    public double bottom()
    {
        return (double) (row + 1) / rows;
    }

    /**
     * Renders the geometry in the form understood by the rendering engine,
     * e.g. {@code 50%x100%+0+0} for the left half of a 2x1 grid.
     */
    public String toGeometryString()
    {
        return widthPercent() + "%x" + heightPercent() + "%"
                + anchor(columns, column)
                + anchor(rows, row);
    }

    private static String anchor(int divisions, int position)
    {
        if (position == 0) {
            return "+0";
        }
        if (position < divisions - 1) {
            return "+" + (100 * position / divisions) + "%";
        }
        return "-0";
    }

    @Override
    public String toString()
    {
        return toGeometryString();
    }
}
