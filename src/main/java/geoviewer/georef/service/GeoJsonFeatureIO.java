package geoviewer.georef.service;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import geoviewer.georef.model.FeatureCollection;
import geoviewer.georef.model.FeatureGeometry;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.MultiLineString;
import org.locationtech.jts.geom.MultiPoint;
import org.locationtech.jts.geom.MultiPolygon;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes vector layers as GeoJSON FeatureCollections.
 *
 * <p>Supported geometry types: Point, MultiPoint, LineString, MultiLineString, Polygon and
 * MultiPolygon. Property names become attribute columns in the order they are first seen;
 * features without a property get null in that column. Integers are read as {@code Long}
 * ({@code BigInteger} beyond its range), decimals as {@code Double}, and nested objects and
 * arrays as {@link JsonElement}s. The CRS is taken from the legacy
 * {@code crs.properties.name} member when present (e.g. {@code urn:ogc:def:crs:EPSG::2039});
 * a file without it yields a layer with no CRS.
 */
public class GeoJsonFeatureIO {
    private static final Logger logger = LoggerFactory.getLogger(GeoJsonFeatureIO.class);

    private final GeometryFactory geometryFactory = new GeometryFactory();
    private final Gson gson = new GsonBuilder()
            .setPrettyPrinting()
            .serializeNulls()
            .create();

    /**
     * @throws IOException if the file cannot be read or is not a GeoJSON FeatureCollection
     */
    public FeatureCollection read(Path path) throws IOException {
        JsonElement root;
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            root = JsonParser.parseReader(reader);
        } catch (JsonParseException e) {
            throw new IOException("Invalid JSON in " + path + ": " + e.getMessage(), e);
        }

        try {
            FeatureCollection collection = parseCollection(root);
            logger.info("Read {} features with columns {} from {} (CRS {})",
                    collection.size(), collection.getColumnNames(), path, collection.getCrs().orElse("none"));
            return collection;
        } catch (RuntimeException e) {
            // Gson and JTS report structural problems as unchecked exceptions
            throw new IOException("Invalid GeoJSON in " + path + ": " + e.getMessage(), e);
        }
    }

    private FeatureCollection parseCollection(JsonElement root) {
        if (!root.isJsonObject()) {
            throw new IllegalArgumentException("root is not an object");
        }
        JsonObject object = root.getAsJsonObject();
        if (!"FeatureCollection".equals(stringMember(object, "type"))) {
            throw new IllegalArgumentException("root type is not FeatureCollection");
        }

        List<FeatureGeometry> geometries = new ArrayList<>();
        List<Map<String, Object>> rows = new ArrayList<>();
        List<String> columnOrder = new ArrayList<>();

        JsonArray features = object.has("features") ? object.getAsJsonArray("features") : new JsonArray();
        for (JsonElement element : features) {
            JsonObject feature = element.getAsJsonObject();
            JsonElement geometry = feature.get("geometry");
            if (geometry == null || geometry.isJsonNull()) {
                throw new IllegalArgumentException("feature " + geometries.size() + " has no geometry");
            }
            geometries.add(FeatureGeometry.of(parseGeometry(geometry.getAsJsonObject())));

            Map<String, Object> row = new LinkedHashMap<>();
            JsonElement properties = feature.get("properties");
            if (properties != null && properties.isJsonObject()) {
                for (Map.Entry<String, JsonElement> property : properties.getAsJsonObject().entrySet()) {
                    if (!columnOrder.contains(property.getKey())) {
                        columnOrder.add(property.getKey());
                    }
                    row.put(property.getKey(), toValue(property.getValue()));
                }
            }
            rows.add(row);
        }

        Map<String, List<Object>> columns = new LinkedHashMap<>();
        for (String column : columnOrder) {
            List<Object> values = new ArrayList<>(rows.size());
            for (Map<String, Object> row : rows) {
                values.add(row.get(column));
            }
            columns.put(column, values);
        }
        return new FeatureCollection(geometries, columns, readCrs(object));
    }

    private static String readCrs(JsonObject object) {
        JsonElement crs = object.get("crs");
        if (crs == null || !crs.isJsonObject()) {
            return null;
        }
        JsonElement properties = crs.getAsJsonObject().get("properties");
        if (properties == null || !properties.isJsonObject()) {
            return null;
        }
        return stringMember(properties.getAsJsonObject(), "name");
    }

    private static String stringMember(JsonObject object, String name) {
        JsonElement element = object.get(name);
        return element != null && element.isJsonPrimitive() ? element.getAsString() : null;
    }

    private static Object toValue(JsonElement element) {
        if (element == null || element.isJsonNull()) {
            return null;
        }
        if (element.isJsonPrimitive()) {
            JsonPrimitive primitive = element.getAsJsonPrimitive();
            if (primitive.isBoolean()) {
                return primitive.getAsBoolean();
            }
            if (primitive.isNumber()) {
                String text = primitive.getAsString();
                if (text.contains(".") || text.contains("e") || text.contains("E")) {
                    return primitive.getAsDouble();
                }
                BigInteger integer = primitive.getAsBigInteger();
                return integer.bitLength() < Long.SIZE ? (Object) integer.longValue() : integer;
            }
            return primitive.getAsString();
        }
        // Nested objects and arrays are kept as JSON and written back unchanged
        return element.deepCopy();
    }

    // ==================== Geometry parsing ====================

    private Geometry parseGeometry(JsonObject geometry) {
        String type = stringMember(geometry, "type");
        if (type == null) {
            throw new IllegalArgumentException("geometry without type");
        }
        JsonArray coordinates = geometry.getAsJsonArray("coordinates");
        return switch (type) {
            case "Point" -> geometryFactory.createPoint(coordinate(coordinates));
            case "MultiPoint" -> geometryFactory.createMultiPointFromCoords(coordinateArray(coordinates));
            case "LineString" -> geometryFactory.createLineString(coordinateArray(coordinates));
            case "MultiLineString" -> {
                LineString[] lines = new LineString[coordinates.size()];
                for (int i = 0; i < lines.length; i++) {
                    lines[i] = geometryFactory.createLineString(coordinateArray(coordinates.get(i).getAsJsonArray()));
                }
                yield geometryFactory.createMultiLineString(lines);
            }
            case "Polygon" -> polygon(coordinates);
            case "MultiPolygon" -> {
                Polygon[] polygons = new Polygon[coordinates.size()];
                for (int i = 0; i < polygons.length; i++) {
                    polygons[i] = polygon(coordinates.get(i).getAsJsonArray());
                }
                yield geometryFactory.createMultiPolygon(polygons);
            }
            default -> throw new IllegalArgumentException("unsupported geometry type " + type);
        };
    }

    private Polygon polygon(JsonArray rings) {
        LinearRing shell = geometryFactory.createLinearRing(coordinateArray(rings.get(0).getAsJsonArray()));
        LinearRing[] holes = new LinearRing[rings.size() - 1];
        for (int i = 1; i < rings.size(); i++) {
            holes[i - 1] = geometryFactory.createLinearRing(coordinateArray(rings.get(i).getAsJsonArray()));
        }
        return geometryFactory.createPolygon(shell, holes);
    }

    private static Coordinate coordinate(JsonArray position) {
        return new Coordinate(position.get(0).getAsDouble(), position.get(1).getAsDouble());
    }

    private static Coordinate[] coordinateArray(JsonArray positions) {
        Coordinate[] coords = new Coordinate[positions.size()];
        for (int i = 0; i < coords.length; i++) {
            coords[i] = coordinate(positions.get(i).getAsJsonArray());
        }
        return coords;
    }

    // ==================== Writing ====================

    /**
     * Writes the collection with its current attribute values. Geometries are written as
     * stored, not as displayed.
     */
    public void write(FeatureCollection collection, Path path) throws IOException {
        JsonObject root = new JsonObject();
        root.addProperty("type", "FeatureCollection");
        collection.getCrs().ifPresent(crs -> {
            JsonObject properties = new JsonObject();
            properties.addProperty("name", toUrn(crs));
            JsonObject crsObject = new JsonObject();
            crsObject.addProperty("type", "name");
            crsObject.add("properties", properties);
            root.add("crs", crsObject);
        });

        JsonArray features = new JsonArray();
        for (int i = 0; i < collection.size(); i++) {
            JsonObject feature = new JsonObject();
            feature.addProperty("type", "Feature");
            JsonObject properties = new JsonObject();
            for (Map.Entry<String, Object> cell : collection.getRow(i).entrySet()) {
                properties.add(cell.getKey(), toJson(cell.getValue()));
            }
            feature.add("properties", properties);
            feature.add("geometry", writeGeometry(collection.getGeometry(i).getGeometry()));
            features.add(feature);
        }
        root.add("features", features);

        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            gson.toJson(root, writer);
        }
        logger.info("Wrote {} features to {}", collection.size(), path);
    }

    private static String toUrn(String crs) {
        int colon = crs.indexOf(':');
        if (colon < 0) {
            return crs;
        }
        return "urn:ogc:def:crs:" + crs.substring(0, colon) + "::" + crs.substring(colon + 1);
    }

    private static JsonElement toJson(Object value) {
        if (value == null) {
            return JsonNull.INSTANCE;
        }
        if (value instanceof JsonElement json) {
            return json.deepCopy();
        }
        if (value instanceof Number n) {
            return new JsonPrimitive(n);
        }
        if (value instanceof Boolean b) {
            return new JsonPrimitive(b);
        }
        return new JsonPrimitive(value.toString());
    }

    private static JsonObject writeGeometry(Geometry geometry) {
        JsonObject object = new JsonObject();
        object.addProperty("type", geometry.getGeometryType());
        object.add("coordinates", coordinatesOf(geometry));
        return object;
    }

    private static JsonArray coordinatesOf(Geometry geometry) {
        if (geometry instanceof Point point) {
            return position(point.getCoordinate());
        }
        if (geometry instanceof LineString line) {
            return positions(line.getCoordinates());
        }
        if (geometry instanceof Polygon polygon) {
            JsonArray rings = new JsonArray();
            rings.add(positions(polygon.getExteriorRing().getCoordinates()));
            for (int i = 0; i < polygon.getNumInteriorRing(); i++) {
                rings.add(positions(polygon.getInteriorRingN(i).getCoordinates()));
            }
            return rings;
        }
        if (geometry instanceof MultiPoint || geometry instanceof MultiLineString || geometry instanceof MultiPolygon) {
            JsonArray parts = new JsonArray();
            for (int i = 0; i < geometry.getNumGeometries(); i++) {
                parts.add(coordinatesOf(geometry.getGeometryN(i)));
            }
            return parts;
        }
        throw new IllegalArgumentException("Cannot write geometry type " + geometry.getGeometryType());
    }

    private static JsonArray position(Coordinate coordinate) {
        JsonArray position = new JsonArray();
        position.add(coordinate.x);
        position.add(coordinate.y);
        return position;
    }

    private static JsonArray positions(Coordinate[] coordinates) {
        JsonArray array = new JsonArray();
        for (Coordinate coordinate : coordinates) {
            array.add(position(coordinate));
        }
        return array;
    }
}
