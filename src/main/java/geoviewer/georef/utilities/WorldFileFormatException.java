package geoviewer.georef.utilities;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Thrown when a world file exists but cannot be turned into a record: too few
 * non-blank lines, a value that is not a number, or the file cannot be read.
 *
 * <p>A raster whose sidecar fails this way is still usable in pixel-only mode, so callers
 * are expected to catch this and fall back rather than abort the image load.
 *
 * @since 0.1.0
 */
public class WorldFileFormatException extends IOException {

    private final Path worldFile;

    /**
     * Constructs a new world file exception with the specified detail message.
     *
     * @param worldFile the sidecar that failed to parse
     * @param message the detail message
     */
    public WorldFileFormatException(Path worldFile, String message) {
        super(message);
        this.worldFile = worldFile;
    }

    /**
     * Constructs a new world file exception with the specified detail message and cause.
     *
     * @param worldFile the sidecar that failed to parse
     * @param message the detail message
     * @param cause the cause
     */
    public WorldFileFormatException(Path worldFile, String message, Throwable cause) {
        super(message, cause);
        this.worldFile = worldFile;
    }

    public Path getWorldFile() {
        return worldFile;
    }
}
