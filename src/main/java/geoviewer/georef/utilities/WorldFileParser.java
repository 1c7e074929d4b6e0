package geoviewer.georef.utilities;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * WorldFileParser
 *
 * <p>Locates and reads the 6-parameter affine sidecar ("world file") of an image:
 * <ul>
 *   <li>Looks for a sidecar next to the image, preferring the extensions that belong to
 *       the image's own format.</li>
 *   <li>Reads the first six non-blank lines as numbers in file order A, D, B, E, C, F.</li>
 *   <li>Does not validate value ranges; several CRSs are legitimate.</li>
 * </ul>
 *
 * <p>A missing sidecar is a normal outcome and is returned as {@link Optional#empty()}.
 * A sidecar that exists but is malformed is reported with {@link WorldFileFormatException}.
 *
 * @since 0.1.0
 */
public class WorldFileParser {
    private static final Logger logger = LoggerFactory.getLogger(WorldFileParser.class);

    /** Every recognized world file extension, lower case, without the dot. */
    public static final List<String> KNOWN_EXTENSIONS = List.of(
            "jgw", "jgwx", "jpgw",   // JPEG
            "pgw", "pgwx",           // PNG
            "tfw", "tfwx",           // TIFF
            "wld"                    // generic
    );

    private static final Map<String, List<String>> CANONICAL_EXTENSIONS = Map.of(
            "jpg", List.of("jgw", "jgwx", "jpgw"),
            "jpeg", List.of("jgw", "jgwx", "jpgw"),
            "png", List.of("pgw", "pgwx"),
            "tif", List.of("tfw", "tfwx"),
            "tiff", List.of("tfw", "tfwx")
    );

    private static final int REQUIRED_VALUES = 6;

    // Plain decimal or scientific notation; no NaN, Infinity, hex or type suffixes
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    /**
     * Finds the world file belonging to an image.
     *
     * <p>Search order:
     * <ol>
     *   <li>Candidate extensions (format-specific first, then {@code wld}, then the rest
     *       of {@link #KNOWN_EXTENSIONS}), each tried as exact lower case, exact upper case,
     *       and finally case-insensitively against the directory listing.</li>
     *   <li>A scan of the directory for any file whose base name matches the image's base
     *       name (ignoring case) and whose extension is a known world file extension.</li>
     * </ol>
     *
     * @param imagePath Path of the image file
     * @return the sidecar path, or empty when the image has no world file
     */
    public Optional<Path> findWorldFile(Path imagePath) {
        if (imagePath == null || imagePath.getFileName() == null) {
            return Optional.empty();
        }

        Path directory = imagePath.toAbsolutePath().getParent();
        String fileName = imagePath.getFileName().toString();
        String baseName = baseName(fileName);
        List<String> listing = listDirectory(directory);

        for (String ext : candidateExtensions(extension(fileName))) {
            for (String cased : List.of(ext, ext.toUpperCase(Locale.ROOT))) {
                Path candidate = directory.resolve(baseName + "." + cased);
                if (Files.isRegularFile(candidate)) {
                    logger.debug("World file for {} found by extension: {}", fileName, candidate);
                    return Optional.of(candidate);
                }
            }
            String wanted = baseName + "." + ext;
            for (String entry : listing) {
                if (entry.equalsIgnoreCase(wanted)) {
                    Path candidate = directory.resolve(entry);
                    logger.debug("World file for {} found case-insensitively: {}", fileName, candidate);
                    return Optional.of(candidate);
                }
            }
        }

        for (String entry : listing) {
            String entryExt = extension(entry).toLowerCase(Locale.ROOT);
            if (KNOWN_EXTENSIONS.contains(entryExt) && baseName(entry).equalsIgnoreCase(baseName)) {
                Path candidate = directory.resolve(entry);
                if (Files.isRegularFile(candidate)) {
                    logger.debug("World file for {} found by directory scan: {}", fileName, candidate);
                    return Optional.of(candidate);
                }
            }
        }

        logger.debug("No world file found for {}", imagePath);
        return Optional.empty();
    }

    /**
     * Reads a world file into a record.
     *
     * @param worldFile Path to the sidecar
     * @return the six values in file order
     * @throws WorldFileFormatException if the file cannot be read, has fewer than six
     *         non-blank lines, or one of the first six is not a finite decimal number
     */
    public WorldFileRecord parse(Path worldFile) throws WorldFileFormatException {
        List<String> lines;
        try {
            lines = Files.readAllLines(worldFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new WorldFileFormatException(worldFile,
                    "Cannot read world file " + worldFile + ": " + e.getMessage(), e);
        }

        List<String> nonBlank = lines.stream()
                .map(line -> line.replace("\uFEFF", "").strip())
                .filter(line -> !line.isEmpty())
                .collect(Collectors.toList());

        if (nonBlank.size() < REQUIRED_VALUES) {
            throw new WorldFileFormatException(worldFile, String.format(
                    "World file %s has only %d non-blank lines, need at least %d",
                    worldFile.getFileName(), nonBlank.size(), REQUIRED_VALUES));
        }

        double[] values = new double[REQUIRED_VALUES];
        for (int i = 0; i < REQUIRED_VALUES; i++) {
            String line = nonBlank.get(i);
            if (!DECIMAL.matcher(line).matches()) {
                throw new WorldFileFormatException(worldFile, String.format(
                        "Cannot parse line %d of %s as a number: '%s'",
                        i + 1, worldFile.getFileName(), line));
            }
            values[i] = Double.parseDouble(line);
            if (!Double.isFinite(values[i])) {
                throw new WorldFileFormatException(worldFile, String.format(
                        "Value on line %d of %s is out of range: '%s'",
                        i + 1, worldFile.getFileName(), line));
            }
        }

        WorldFileRecord record = WorldFileRecord.fromFileOrder(values);
        logger.info("Parsed world file {}: {}", worldFile, record);
        return record;
    }

    /**
     * Looks up and parses the world file of an image in one step.
     *
     * @return the record, or empty when there is no sidecar
     * @throws WorldFileFormatException if a sidecar exists but is malformed
     */
    public Optional<WorldFileRecord> read(Path imagePath) throws WorldFileFormatException {
        Optional<Path> worldFile = findWorldFile(imagePath);
        if (worldFile.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(parse(worldFile.get()));
    }

    private static List<String> candidateExtensions(String imageExtension) {
        LinkedHashSet<String> ordered = new LinkedHashSet<>(
                CANONICAL_EXTENSIONS.getOrDefault(imageExtension.toLowerCase(Locale.ROOT), List.of()));
        ordered.add("wld");
        ordered.addAll(KNOWN_EXTENSIONS);
        return new ArrayList<>(ordered);
    }

    private static List<String> listDirectory(Path directory) {
        if (directory == null || !Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(directory)) {
            return entries.map(p -> p.getFileName().toString())
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            logger.warn("Cannot list {} while looking for a world file: {}", directory, e.getMessage());
            return List.of();
        }
    }

    static String baseName(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    static String extension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(dot + 1) : "";
    }
}
