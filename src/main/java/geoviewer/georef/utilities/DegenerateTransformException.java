package geoviewer.georef.utilities;

/**
 * Thrown when an affine transform cannot be inverted, typically because a world file
 * declares a zero pixel size, or when one of its coefficients is not finite.
 *
 * @since 0.1.0
 */
public class DegenerateTransformException extends IllegalArgumentException {

    public DegenerateTransformException(String message) {
        super(message);
    }
}
