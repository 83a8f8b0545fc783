package org.boxfit.exception;

import org.boxfit.model.enums.ErrorKind;
import lombok.Getter;

import static org.boxfit.model.enums.ErrorKind.DECODE_FAILURE;
import static org.boxfit.model.enums.ErrorKind.INVALID_ARGUMENT;
import static org.boxfit.model.enums.ErrorKind.PROCESSING_FAILURE;

@Getter
public enum BoxfitError {
    NULL_SOURCE(INVALID_ARGUMENT, "Source raster must not be null"),
    NULL_BOX_SPEC(INVALID_ARGUMENT, "A box spec was null"),
    INVALID_BOX_WIDTH(INVALID_ARGUMENT, "Box width %d was not between 0 and maxWidth %d"),
    INVALID_BOX_HEIGHT(INVALID_ARGUMENT, "Box height %d was not between 0 and maxHeight %d"),
    DUPLICATE_BOX_KEY(INVALID_ARGUMENT, "Box key '%s' was used more than once"),
    INVALID_COLOR(INVALID_ARGUMENT, "Color was blank or not recognized: '%s'"),
    INVALID_MAX_WIDTH(INVALID_ARGUMENT, "maxWidth must be positive but was %d"),
    INVALID_MAX_HEIGHT(INVALID_ARGUMENT, "maxHeight must be positive but was %d"),
    INVALID_BLUR_VALUE(INVALID_ARGUMENT, "blurValue must be a positive number but was %s"),
    INVALID_FORMAT(INVALID_ARGUMENT, "Unsupported image format: '%s'"),
    INVALID_PERMISSIONS(INVALID_ARGUMENT, "Permissions must look like 'rwxr-xr-x' but were '%s'"),
    INVALID_DESTINATION(INVALID_ARGUMENT, "Destination path must not be null"),

    RESIZE_FAILED(PROCESSING_FAILURE, "Resizing to %dx%d failed: %s"),
    ROTATE_FAILED(PROCESSING_FAILURE, "Rotating by %s degrees failed: %s"),
    CANVAS_ALLOCATION_FAILED(PROCESSING_FAILURE, "Allocating a %dx%d canvas failed: %s"),
    COMPOSITE_FAILED(PROCESSING_FAILURE, "Compositing at offset %d,%d failed: %s"),
    ENCODE_FAILED(PROCESSING_FAILURE, "Encoding as %s failed: %s"),
    WRITE_FAILED(PROCESSING_FAILURE, "Writing image to %s failed: %s"),

    DECODE_FAILED(DECODE_FAILURE, "Image data could not be decoded: %s"),
    IMAGE_NOT_FOUND(DECODE_FAILURE, "Image file does not exist: %s");

    private final ErrorKind kind;
    private final String message;

    BoxfitError(ErrorKind kind, String message) {
        this.kind = kind;
        this.message = message;
    }

    public BoxfitException createException(Object... details) {
        return new BoxfitException(this, format(details), null);
    }

    public BoxfitException createException(Throwable cause, Object... details) {
        return new BoxfitException(this, format(details), cause);
    }

    private String format(Object... details) {
        return (details.length > 0) ? String.format(message, details) : message;
    }
}
