package org.boxfit.model.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class WriteOptions {

    public static final String DEFAULT_FORMAT = "jpeg";
    public static final String DEFAULT_PERMISSIONS = "rwxrwxrwx";

    @Builder.Default
    String format = DEFAULT_FORMAT;

    /**
     * Applied to any parent directory that has to be created.
     */
    @Builder.Default
    String directoryPermissions = DEFAULT_PERMISSIONS;

    @Builder.Default
    String filePermissions = DEFAULT_PERMISSIONS;

    /**
     * Only affects the written file, never the raster passed in.
     */
    @Builder.Default
    boolean stripHeaders = true;

    public static WriteOptions defaults() {
        return WriteOptions.builder().build();
    }
}
