package org.boxfit.config;

import org.boxfit.model.dto.ResizeOptions;
import org.boxfit.model.dto.WriteOptions;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "boxfit")
@Getter
@Setter
public class BoxfitProperties {
    private Resize resize = new Resize();
    private Export export = new Export();

    /**
     * Defaults used by the resize overloads that take no explicit options.
     */
    @Getter
    @Setter
    public static class Resize {
        private String color = ResizeOptions.DEFAULT_COLOR;
        private boolean upsize;
        private boolean bestfit;
        private int maxWidth = ResizeOptions.DEFAULT_MAX_WIDTH;
        private int maxHeight = ResizeOptions.DEFAULT_MAX_HEIGHT;
        private boolean blurBackground;
        private double blurValue = ResizeOptions.DEFAULT_BLUR_VALUE;

        public ResizeOptions toOptions() {
            return ResizeOptions.builder()
                    .color(color)
                    .upsize(upsize)
                    .bestfit(bestfit)
                    .maxWidth(maxWidth)
                    .maxHeight(maxHeight)
                    .blurBackground(blurBackground)
                    .blurValue(blurValue)
                    .build();
        }
    }

    @Getter
    @Setter
    public static class Export {
        private String format = WriteOptions.DEFAULT_FORMAT;
        private String directoryPermissions = WriteOptions.DEFAULT_PERMISSIONS;
        private String filePermissions = WriteOptions.DEFAULT_PERMISSIONS;
        private boolean stripHeaders = true;

        public WriteOptions toOptions() {
            return WriteOptions.builder()
                    .format(format)
                    .directoryPermissions(directoryPermissions)
                    .filePermissions(filePermissions)
                    .stripHeaders(stripHeaders)
                    .build();
        }
    }
}
