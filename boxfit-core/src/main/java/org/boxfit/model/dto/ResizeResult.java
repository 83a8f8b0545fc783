package org.boxfit.model.dto;

import org.boxfit.exception.BoxfitException;
import org.boxfit.model.Raster;
import org.boxfit.model.enums.ErrorKind;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of a batch resize: either every box succeeded or the batch failed as a whole.
 */
public final class ResizeResult<K> {

    private final Map<K, Raster> rasters;
    private final BoxfitException failure;

    private ResizeResult(Map<K, Raster> rasters, BoxfitException failure) {
        this.rasters = rasters;
        this.failure = failure;
    }

    public static <K> ResizeResult<K> success(Map<K, Raster> rasters) {
        return new ResizeResult<>(Collections.unmodifiableMap(rasters), null);
    }

    public static <K> ResizeResult<K> failure(BoxfitException failure) {
        return new ResizeResult<>(null, failure);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    /**
     * @throws BoxfitException the original failure if the batch did not succeed
     */
    public Map<K, Raster> getRasters() {
        if (failure != null) {
            throw failure;
        }
        return rasters;
    }

    public Optional<BoxfitException> getFailure() {
        return Optional.ofNullable(failure);
    }

    public Optional<ErrorKind> getErrorKind() {
        return getFailure().map(BoxfitException::getKind);
    }
}
