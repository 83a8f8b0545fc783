package org.boxfit.model.enums;

/**
 * Broad failure categories a caller can branch on.
 */
public enum ErrorKind {
    /**
     * Bad options or box sizes. Raised before any engine work starts.
     */
    INVALID_ARGUMENT,
    /**
     * A raster engine primitive failed. Not retried.
     */
    PROCESSING_FAILURE,
    /**
     * The source could not be decoded or the referenced image does not exist.
     */
    DECODE_FAILURE
}
