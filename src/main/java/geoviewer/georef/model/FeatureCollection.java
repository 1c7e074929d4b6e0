package geoviewer.georef.model;

import geoviewer.georef.utilities.BoundingBox;
import geoviewer.georef.utilities.CrsIds;
import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Vector features with their attribute table and a navigation cursor.
 *
 * <p>The attribute table is a set of named columns in insertion order, each holding one
 * value per feature. Geometries are fixed at construction; attribute cells are edited in
 * place.
 *
 * <p>The cursor ({@link #getCurrentIndex()}) always satisfies {@code 0 <= index < size()}
 * for a non-empty collection. {@link #moveNext()} and {@link #movePrevious()} wrap around;
 * {@link #moveToIndex(int)} refuses out-of-range targets and leaves the cursor unchanged.
 */
public class FeatureCollection {
    private static final Logger logger = LoggerFactory.getLogger(FeatureCollection.class);

    private final List<FeatureGeometry> geometries;
    private final LinkedHashMap<String, List<Object>> columns = new LinkedHashMap<>();
    private final String crs;
    private int currentIndex = 0;

    /**
     * @param geometries one geometry per feature
     * @param columns    attribute columns; each must hold exactly one value per feature
     * @param crs        CRS identifier of the coordinates, or null when unknown
     */
    public FeatureCollection(List<FeatureGeometry> geometries, Map<String, ? extends List<?>> columns, String crs) {
        this.geometries = List.copyOf(geometries);
        if (columns != null) {
            for (Map.Entry<String, ? extends List<?>> column : columns.entrySet()) {
                if (column.getValue().size() != this.geometries.size()) {
                    throw new IllegalArgumentException(String.format(
                            "Column '%s' has %d values for %d features",
                            column.getKey(), column.getValue().size(), this.geometries.size()));
                }
                this.columns.put(column.getKey(), new ArrayList<>(column.getValue()));
            }
        }
        this.crs = CrsIds.normalize(crs);
    }

    public FeatureCollection(List<FeatureGeometry> geometries, String crs) {
        this(geometries, null, crs);
    }

    public int size() {
        return geometries.size();
    }

    public boolean isEmpty() {
        return geometries.isEmpty();
    }

    public List<FeatureGeometry> getGeometries() {
        return geometries;
    }

    public FeatureGeometry getGeometry(int index) {
        return geometries.get(index);
    }

    /**
     * Normalized CRS identifier, or empty when the layer carries none.
     */
    public Optional<String> getCrs() {
        return Optional.ofNullable(crs);
    }

    // ==================== Navigation ====================

    public int getCurrentIndex() {
        return currentIndex;
    }

    public Optional<FeatureGeometry> current() {
        return isEmpty() ? Optional.empty() : Optional.of(geometries.get(currentIndex));
    }

    /**
     * Advances the cursor, wrapping from the last feature to the first.
     *
     * @return false when the collection is empty
     */
    public boolean moveNext() {
        if (isEmpty()) {
            return false;
        }
        currentIndex = (currentIndex + 1) % size();
        return true;
    }

    /**
     * Moves the cursor back, wrapping from the first feature to the last.
     *
     * @return false when the collection is empty
     */
    public boolean movePrevious() {
        if (isEmpty()) {
            return false;
        }
        currentIndex = Math.floorMod(currentIndex - 1, size());
        return true;
    }

    /**
     * @return false, with the cursor unchanged, when {@code index} is outside {@code 0..size()-1}
     */
    public boolean moveToIndex(int index) {
        if (index < 0 || index >= size()) {
            logger.debug("Rejected move to index {} (size {})", index, size());
            return false;
        }
        currentIndex = index;
        return true;
    }

    // ==================== Attributes ====================

    public List<String> getColumnNames() {
        return List.copyOf(columns.keySet());
    }

    public boolean hasColumn(String column) {
        return columns.containsKey(column);
    }

    /**
     * Finds a column whose name equals {@code name} ignoring case; the first match in
     * column order wins.
     */
    public Optional<String> findColumnIgnoreCase(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String wanted = name.toUpperCase(Locale.ROOT);
        return columns.keySet().stream()
                .filter(c -> c.toUpperCase(Locale.ROOT).equals(wanted))
                .findFirst();
    }

    /**
     * Appends an empty column; does nothing when the column exists.
     */
    public void addColumn(String column) {
        columns.computeIfAbsent(column, k -> new ArrayList<>(Collections.nCopies(size(), null)));
    }

    public Object getValue(String column, int row) {
        return requireColumn(column).get(checkRow(row));
    }

    /**
     * Replaces one cell in place.
     *
     * @throws IllegalArgumentException if the column does not exist
     * @throws IndexOutOfBoundsException if the row does not exist
     */
    public void setValue(String column, int row, Object value) {
        requireColumn(column).set(checkRow(row), value);
        logger.debug("Set {}[{}] = {}", column, row, value);
    }

    /**
     * Attribute values of one feature, in column order.
     */
    public Map<String, Object> getRow(int row) {
        checkRow(row);
        Map<String, Object> values = new LinkedHashMap<>();
        columns.forEach((name, cells) -> values.put(name, cells.get(row)));
        return values;
    }

    private List<Object> requireColumn(String column) {
        List<Object> cells = columns.get(column);
        if (cells == null) {
            throw new IllegalArgumentException("No such column: " + column);
        }
        return cells;
    }

    private int checkRow(int row) {
        if (row < 0 || row >= size()) {
            throw new IndexOutOfBoundsException("Row " + row + " outside 0.." + (size() - 1));
        }
        return row;
    }

    /**
     * Envelope of all non-empty geometries, or empty when there are none.
     */
    public Optional<BoundingBox> bounds() {
        Envelope envelope = new Envelope();
        for (FeatureGeometry geometry : geometries) {
            if (!geometry.isEmpty()) {
                envelope.expandToInclude(geometry.getEnvelope());
            }
        }
        if (envelope.isNull()) {
            return Optional.empty();
        }
        return Optional.of(new BoundingBox(envelope.getMinX(), envelope.getMinY(),
                envelope.getMaxX(), envelope.getMaxY()));
    }

    @Override
    public String toString() {
        return "FeatureCollection[" + size() + " features, columns=" + columns.keySet()
                + ", crs=" + crs + ", index=" + currentIndex + "]";
    }
}
