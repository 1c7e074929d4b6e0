package geoviewer.georef.utilities;

/**
 * The six raw values of a world file, in on-disk order.
 *
 * <p>World files store the placement of the <em>center</em> of the upper-left pixel, not
 * its corner. A record is only an intermediate value: it is turned into a
 * {@link GeoTransform} with {@link GeoTransform#fromWorldFile(WorldFileRecord)} straight
 * after parsing and is not kept by the raster.
 *
 * @param pixelSizeX     line 1 (A): x size of a pixel along a row
 * @param rotationY      line 2 (D): y change per column
 * @param rotationX      line 3 (B): x change per row
 * @param pixelSizeY     line 4 (E): y size of a pixel along a column, usually negative
 * @param upperLeftX     line 5 (C): x of the center of the upper-left pixel
 * @param upperLeftY     line 6 (F): y of the center of the upper-left pixel
 * @since 0.1.0
 */
public record WorldFileRecord(
        double pixelSizeX,
        double rotationY,
        double rotationX,
        double pixelSizeY,
        double upperLeftX,
        double upperLeftY) {

    /**
     * Builds a record from values in file order A, D, B, E, C, F.
     */
    public static WorldFileRecord fromFileOrder(double[] values) {
        if (values == null || values.length != 6) {
            throw new IllegalArgumentException("World file record needs exactly 6 values");
        }
        return new WorldFileRecord(values[0], values[1], values[2], values[3], values[4], values[5]);
    }

    @Override
    public String toString() {
        return String.format("A=%s, D=%s, B=%s, E=%s, C=%s, F=%s",
                pixelSizeX, rotationY, rotationX, pixelSizeY, upperLeftX, upperLeftY);
    }
}
