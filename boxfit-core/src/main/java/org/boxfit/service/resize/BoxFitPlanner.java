package org.boxfit.service.resize;

import org.boxfit.model.dto.Geometry;
import org.springframework.stereotype.Component;

/**
 * Computes the scaled size and centering offset of a source inside a box.
 */
@Component
public class BoxFitPlanner {

    public Geometry plan(int sourceWidth, int sourceHeight, int boxWidth, int boxHeight, boolean upsize) {
        // over 1 is landscape, under 1 is portrait
        double boxRatio = (double) boxWidth / boxHeight;
        double sourceRatio = (double) sourceWidth / sourceHeight;

        if (sourceWidth < boxWidth && sourceHeight < boxHeight && !upsize) {
            return new Geometry(sourceWidth, sourceHeight, (boxWidth - sourceWidth) / 2, (boxHeight - sourceHeight) / 2);
        }

        // box is more portrait than the source: width is the constraint
        // an extreme ratio can truncate the short side to 0, keep at least one pixel
        if (boxRatio < sourceRatio) {
            int targetHeight = Math.max(1, (int) (boxWidth / sourceRatio));
            return new Geometry(boxWidth, targetHeight, 0, (boxHeight - targetHeight) / 2);
        }

        int targetWidth = Math.max(1, (int) (boxHeight * sourceRatio));
        return new Geometry(targetWidth, boxHeight, (boxWidth - targetWidth) / 2, 0);
    }
}
