package geoviewer.georef.service;

/**
 * Exception thrown when vector coordinates cannot be moved from one CRS to another,
 * e.g. because a CRS code is unknown or a coordinate falls outside the projection's domain.
 *
 * <p>Reconciliation recovers from this by keeping the original coordinates.
 *
 * @since 0.1.0
 */
public class ReprojectionException extends Exception {

    private final String sourceCrs;
    private final String targetCrs;

    /**
     * Constructs a new reprojection exception with the specified detail message and cause.
     *
     * @param sourceCrs CRS the coordinates were in
     * @param targetCrs CRS they were being moved to
     * @param message the detail message
     * @param cause the cause, may be null
     */
    public ReprojectionException(String sourceCrs, String targetCrs, String message, Throwable cause) {
        super(message, cause);
        this.sourceCrs = sourceCrs;
        this.targetCrs = targetCrs;
    }

    public ReprojectionException(String sourceCrs, String targetCrs, String message) {
        this(sourceCrs, targetCrs, message, null);
    }

    public String getSourceCrs() {
        return sourceCrs;
    }

    public String getTargetCrs() {
        return targetCrs;
    }
}
