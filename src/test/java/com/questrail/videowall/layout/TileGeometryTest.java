package com.questrail.videowall.layout;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TileGeometryTest {

    @Test
    void sideBySideHalves() {
        GridDivision d = GridDivision.fromIndex(1);
        assertEquals("50%x100%+0+0", d.geometryOf(0).toGeometryString());
        assertEquals("50%x100%-0+0", d.geometryOf(1).toGeometryString());
    }

    @Test
    void middleTilesUsePercentOffsets() {
        GridDivision d = GridDivision.fromIndex(4);
        assertEquals("33%x33%+0+0", d.geometryOf(0).toGeometryString());
        assertEquals("33%x33%+33%+0", d.geometryOf(1).toGeometryString());
        assertEquals("33%x33%-0+33%", d.geometryOf(5).toGeometryString());
        assertEquals("33%x33%+33%-0", d.geometryOf(7).toGeometryString());
    }

    @Test
    void singleTileFillsScreen() {
        assertEquals("100%x100%+0+0", GridDivision.fromIndex(0).geometryOf(0).toGeometryString());
    }

    @Test
    void positionMustLieInsideGrid() {
        assertThrows(IllegalArgumentException.class, () -> TileGeometry.of(2, 1, 2, 0));
        assertThrows(IllegalArgumentException.class, () -> TileGeometry.of(2, 1, 0, 1));
        assertThrows(IllegalArgumentException.class, () -> TileGeometry.of(0, 1, 0, 0));
    }
}
