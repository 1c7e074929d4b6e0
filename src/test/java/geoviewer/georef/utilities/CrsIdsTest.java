package geoviewer.georef.utilities;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class CrsIdsTest {

    @ParameterizedTest
    @CsvSource({
            "EPSG:2039, EPSG:2039",
            "epsg:2039, EPSG:2039",
            "' EPSG:4326 ', EPSG:4326",
            "urn:ogc:def:crs:EPSG::2039, EPSG:2039",
            "urn:ogc:def:crs:EPSG:9.8.15:3857, EPSG:3857",
            "urn:ogc:def:crs:OGC:1.3:CRS84, EPSG:4326",
            "UNKNOWN, unknown"
    })
    @DisplayName("Identifiers normalize to AUTHORITY:code")
    void testNormalize(String input, String expected) {
        assertEquals(expected, CrsIds.normalize(input));
    }

    @Test
    @DisplayName("Null and blank identifiers normalize to null")
    void testNormalizeAbsent() {
        assertNull(CrsIds.normalize(null));
        assertNull(CrsIds.normalize("   "));
    }

    @Test
    @DisplayName("Unknown and absent identifiers are not known CRSs")
    void testIsKnown() {
        assertTrue(CrsIds.isKnown("EPSG:2039"));
        assertFalse(CrsIds.isKnown(CrsIds.UNKNOWN));
        assertFalse(CrsIds.isKnown(null));
        assertFalse(CrsIds.isKnown(""));
    }

    @Test
    @DisplayName("Equality is decided after normalization")
    void testSame() {
        assertTrue(CrsIds.same("epsg:2039", "urn:ogc:def:crs:EPSG::2039"));
        assertFalse(CrsIds.same("EPSG:2039", "EPSG:4326"));
        assertFalse(CrsIds.same(null, null));
    }
}
