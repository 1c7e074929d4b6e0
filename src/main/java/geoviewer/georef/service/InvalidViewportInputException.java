package geoviewer.georef.service;

/**
 * Thrown when a zoom factor is not a positive finite number, or a view center is not a
 * finite point.
 *
 * @since 0.1.0
 */
public class InvalidViewportInputException extends IllegalArgumentException {

    public InvalidViewportInputException(String message) {
        super(message);
    }
}
