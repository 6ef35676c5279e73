package com.transitlog.backend.util;

import com.transitlog.backend.model.Coordinate;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TransitUtilsTest {

    @Test
    void testIsExcludedHeadsign() {
        assertTrue(TransitUtils.isExcludedHeadsign("Canada Line To Waterfront"));
        assertTrue(TransitUtils.isExcludedHeadsign("SEABUS"));
        assertTrue(TransitUtils.isExcludedHeadsign("  expo line king george"));
        assertFalse(TransitUtils.isExcludedHeadsign("99 B-Line UBC"));
        assertFalse(TransitUtils.isExcludedHeadsign("To Canada Line"));
        assertFalse(TransitUtils.isExcludedHeadsign(""));
        assertFalse(TransitUtils.isExcludedHeadsign(null));
    }

    @Test
    void testToPoint_LongitudeFirst() {
        assertEquals("POINT(-123.1 49.25)", TransitUtils.toPoint(-123.1, 49.25));
        assertEquals("POINT(1 2)", TransitUtils.toPoint(1.0, 2.0));
    }

    @Test
    void testToLineString() {
        assertEquals("LINESTRING(1 1, 2 2)",
                TransitUtils.toLineString(List.of(Coordinate.of(1, 1), Coordinate.of(2, 2))));
        assertEquals("LINESTRING(5 5)", TransitUtils.toLineString(List.of(Coordinate.of(5, 5))));
    }
}
