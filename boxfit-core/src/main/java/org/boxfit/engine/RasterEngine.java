package org.boxfit.engine;

import org.boxfit.model.Raster;
import org.boxfit.model.enums.ResizeFilter;

import java.awt.Color;
import java.io.OutputStream;
import java.nio.file.Path;

/**
 * Pixel-level primitives the resize pipeline is built on.
 * <p>
 * Implementations must never modify a raster passed in; every operation returns a new one.
 * Failures are reported as {@link org.boxfit.exception.BoxfitException} carrying the matching
 * {@link org.boxfit.model.enums.ErrorKind}.
 */
public interface RasterEngine {

    Raster decode(byte[] data);

    Raster decode(Path path);

    /**
     * Rotates clockwise by {@code degrees}, filling uncovered corners with {@code fill}.
     * The result carries no orientation tag.
     */
    Raster rotate(Raster raster, double degrees, Color fill);

    /**
     * @param blur    1.0 for a plain resize, larger values soften the result
     * @param bestfit shrink the requested size so the result keeps the source ratio
     */
    Raster resize(Raster raster, int width, int height, ResizeFilter filter, double blur, boolean bestfit);

    default Raster resize(Raster raster, int width, int height, ResizeFilter filter) {
        return resize(raster, width, height, filter, 1.0, false);
    }

    Raster newCanvas(int width, int height, String color);

    /**
     * Places {@code foreground} over a copy of {@code canvas} with its top-left corner at the offset.
     */
    Raster composite(Raster canvas, Raster foreground, int offsetX, int offsetY);

    void encode(Raster raster, OutputStream out, String format);

    /**
     * Format name of the image stored at {@code path}, as the decoder reports it.
     */
    String detectFormat(Path path);
}
