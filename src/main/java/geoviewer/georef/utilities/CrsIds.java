package geoviewer.georef.utilities;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Helpers for CRS identifier strings such as {@code EPSG:2039}.
 *
 * <p>Identifiers are compared after normalization, so {@code epsg:2039},
 * {@code EPSG:2039} and {@code urn:ogc:def:crs:EPSG::2039} all refer to the same CRS.
 */
public final class CrsIds {

    /** Tag of a raster loaded without georeferencing. */
    public static final String UNKNOWN = "unknown";

    private static final Pattern URN = Pattern.compile(
            "(?i)^urn:ogc:def:crs:([a-z0-9]+):[^:]*:([a-z0-9.]+)$");
    private static final Pattern AUTHORITY_CODE = Pattern.compile("(?i)^([a-z0-9]+):([a-z0-9.]+)$");

    private CrsIds() {
    }

    /**
     * Canonical form of an identifier: {@code AUTHORITY:code} in upper case,
     * {@link #UNKNOWN} for the unknown tag, or {@code null} for null/blank input.
     */
    public static String normalize(String crs) {
        if (crs == null || crs.isBlank()) {
            return null;
        }
        String trimmed = crs.strip();
        if (trimmed.equalsIgnoreCase(UNKNOWN)) {
            return UNKNOWN;
        }
        if (trimmed.equalsIgnoreCase("urn:ogc:def:crs:OGC:1.3:CRS84") || trimmed.equalsIgnoreCase("CRS84")) {
            return "EPSG:4326";
        }
        Matcher urn = URN.matcher(trimmed);
        if (urn.matches()) {
            return urn.group(1).toUpperCase(Locale.ROOT) + ":" + urn.group(2).toUpperCase(Locale.ROOT);
        }
        Matcher code = AUTHORITY_CODE.matcher(trimmed);
        if (code.matches()) {
            return code.group(1).toUpperCase(Locale.ROOT) + ":" + code.group(2).toUpperCase(Locale.ROOT);
        }
        return trimmed;
    }

    /**
     * True when the identifier names an actual CRS (not null, blank or unknown).
     */
    public static boolean isKnown(String crs) {
        String normalized = normalize(crs);
        return normalized != null && !UNKNOWN.equals(normalized);
    }

    public static boolean same(String first, String second) {
        String a = normalize(first);
        return a != null && a.equals(normalize(second));
    }
}
