package org.boxfit.service.export;

import org.boxfit.config.BoxfitProperties;
import org.boxfit.engine.Java2dRasterEngine;
import org.boxfit.engine.RasterEngine;
import org.boxfit.exception.BoxfitError;
import org.boxfit.exception.BoxfitException;
import org.boxfit.model.Raster;
import org.boxfit.model.dto.BoxSpec;
import org.boxfit.model.dto.ResizeOptions;
import org.boxfit.model.dto.WriteOptions;
import org.boxfit.model.enums.ErrorKind;
import org.boxfit.support.TestImages;
import org.boxfit.support.TestPipelines;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.ImageWriter;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.metadata.IIOMetadataNode;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Color;
import java.awt.image.BufferedImage;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assumptions.assumeThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ThumbnailExportServiceTest {

    @TempDir
    Path tempDir;

    private Java2dRasterEngine engine;
    private BoxfitProperties properties;
    private ThumbnailExportService exportService;

    @BeforeEach
    void setUp() {
        engine = new Java2dRasterEngine();
        properties = new BoxfitProperties();
        exportService = new ThumbnailExportService(engine, TestPipelines.thumbnailService(engine, properties), properties);
    }

    private static WriteOptions png() {
        return WriteOptions.builder().format("png").build();
    }

    @Test
    void write_createsMissingParentDirectories() {
        Path dest = tempDir.resolve("a/b/c/thumb.png");

        exportService.write(TestImages.solid(12, 8, Color.BLUE), dest, png());

        assertThat(dest).isRegularFile();
        Raster written = engine.decode(dest);
        assertThat(written.hasSize(12, 8)).isTrue();
        assertThat(TestImages.color(written, 3, 3)).isEqualTo(Color.BLUE);
    }

    @Test
    void write_blankFormatFallsBackToExtension() {
        Path dest = tempDir.resolve("thumb.PNG");

        exportService.write(TestImages.solid(4, 4, Color.RED), dest, WriteOptions.builder().format("").build());

        assertThat(engine.detectFormat(dest)).isEqualTo("png");
    }

    @Test
    void write_usesConfiguredDefaults() {
        Path dest = tempDir.resolve("thumb.img");

        exportService.write(TestImages.solid(4, 4, Color.RED), dest);

        assertThat(engine.detectFormat(dest)).isEqualTo("jpeg");
    }

    @Test
    void write_appliesPosixPermissions() throws Exception {
        assumeThat(FileSystems.getDefault().supportedFileAttributeViews()).contains("posix");
        Path dest = tempDir.resolve("perms/thumb.png");
        WriteOptions options = png().toBuilder()
                .directoryPermissions("rwxr-x---")
                .filePermissions("rw-r-----")
                .build();

        exportService.write(TestImages.solid(4, 4, Color.RED), dest, options);

        assertThat(Files.getPosixFilePermissions(dest)).isEqualTo(PosixFilePermissions.fromString("rw-r-----"));
        assertThat(Files.getPosixFilePermissions(dest.getParent())).isEqualTo(PosixFilePermissions.fromString("rwxr-x---"));
    }

    @Test
    void write_unknownFormatIsRejectedBeforeTouchingDisk() {
        Path dest = tempDir.resolve("sub/thumb.xyz");

        assertThatThrownBy(() -> exportService.write(TestImages.solid(4, 4, Color.RED), dest, WriteOptions.builder().format("xyz").build()))
                .isInstanceOf(BoxfitException.class)
                .extracting(e -> ((BoxfitException) e).getError())
                .isEqualTo(BoxfitError.INVALID_FORMAT);
        assertThat(tempDir.resolve("sub")).doesNotExist();
    }

    @Test
    void write_malformedPermissionsAreRejected() {
        WriteOptions options = png().toBuilder().filePermissions("everyone").build();

        assertThatThrownBy(() -> exportService.write(TestImages.solid(4, 4, Color.RED), tempDir.resolve("t.png"), options))
                .isInstanceOf(BoxfitException.class)
                .extracting(e -> ((BoxfitException) e).getError())
                .isEqualTo(BoxfitError.INVALID_PERMISSIONS);
    }

    @Test
    void write_nullDestination() {
        assertThatThrownBy(() -> exportService.write(TestImages.solid(4, 4, Color.RED), null, png()))
                .isInstanceOf(BoxfitException.class)
                .extracting(e -> ((BoxfitException) e).getKind())
                .isEqualTo(ErrorKind.INVALID_ARGUMENT);
    }

    @Test
    void stripHeaders_dropsTextChunks() throws Exception {
        Path file = tempDir.resolve("commented.png");
        writePngWithComment(file, "secret-comment");
        assertThat(Files.readString(file, StandardCharsets.ISO_8859_1)).contains("secret-comment");

        exportService.stripHeaders(file);

        assertThat(Files.readString(file, StandardCharsets.ISO_8859_1)).doesNotContain("secret-comment");
        assertThat(engine.detectFormat(file)).isEqualTo("png");
        assertThat(engine.decode(file).hasSize(6, 5)).isTrue();
    }

    @Test
    void stripHeaders_failedEncodeKeepsOriginalFile() throws Exception {
        Path file = tempDir.resolve("original.png");
        writePngWithComment(file, "keep-me");
        byte[] before = Files.readAllBytes(file);

        RasterEngine failingEngine = mock(RasterEngine.class);
        when(failingEngine.detectFormat(any(Path.class))).thenReturn("png");
        when(failingEngine.decode(any(Path.class))).thenReturn(TestImages.solid(6, 5, Color.BLACK));
        doThrow(BoxfitError.ENCODE_FAILED.createException("png", "disk full"))
                .when(failingEngine).encode(any(), any(), anyString());
        ThumbnailExportService service = new ThumbnailExportService(failingEngine,
                TestPipelines.thumbnailService(failingEngine, properties), properties);

        assertThatThrownBy(() -> service.stripHeaders(file))
                .isInstanceOf(BoxfitException.class)
                .extracting(e -> ((BoxfitException) e).getError())
                .isEqualTo(BoxfitError.ENCODE_FAILED);
        assertThat(Files.readAllBytes(file)).isEqualTo(before);
        try (Stream<Path> files = Files.list(tempDir)) {
            assertThat(files).containsExactly(file);
        }
    }

    @Test
    void stripHeaders_keepsFilePermissions() throws Exception {
        assumeThat(FileSystems.getDefault().supportedFileAttributeViews()).contains("posix");
        Path file = tempDir.resolve("perms.png");
        writePngWithComment(file, "comment");
        Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-r-----"));

        exportService.stripHeaders(file);

        assertThat(Files.getPosixFilePermissions(file)).isEqualTo(PosixFilePermissions.fromString("rw-r-----"));
        try (Stream<Path> files = Files.list(tempDir)) {
            assertThat(files).containsExactly(file);
        }
    }

    @Test
    void stripHeaders_missingFile() {
        assertThatThrownBy(() -> exportService.stripHeaders(tempDir.resolve("missing.png")))
                .isInstanceOf(BoxfitException.class)
                .extracting(e -> ((BoxfitException) e).getError())
                .isEqualTo(BoxfitError.IMAGE_NOT_FOUND);
    }

    @Test
    void resizeMultiAndWrite_writesEveryBox() {
        Path large = tempDir.resolve("out/large.png");
        Path small = tempDir.resolve("out/small.png");
        List<BoxSpec<Path>> boxes = List.of(BoxSpec.of(40, 10, large), BoxSpec.of(10, 40, small));

        exportService.resizeMultiAndWrite(TestImages.solid(100, 50, Color.BLACK), boxes, ResizeOptions.defaults(), png());

        assertThat(engine.decode(large).hasSize(40, 10)).isTrue();
        assertThat(engine.decode(small).hasSize(10, 40)).isTrue();
    }

    @Test
    void resizeMultiAndWrite_invalidBoxWritesNothing() {
        Path good = tempDir.resolve("good.png");
        Path bad = tempDir.resolve("bad.png");
        List<BoxSpec<Path>> boxes = List.of(BoxSpec.of(40, 10, good), BoxSpec.of(-1, 40, bad));

        assertThatThrownBy(() -> exportService.resizeMultiAndWrite(TestImages.solid(100, 50, Color.BLACK), boxes,
                ResizeOptions.defaults(), png()))
                .isInstanceOf(BoxfitException.class);
        assertThat(good).doesNotExist();
        assertThat(bad).doesNotExist();
    }

    @Test
    void resizeMultiAndWrite_nullDestinationKey() {
        List<BoxSpec<Path>> boxes = List.of(BoxSpec.of(40, 10, null));

        assertThatThrownBy(() -> exportService.resizeMultiAndWrite(TestImages.solid(100, 50, Color.BLACK), boxes,
                ResizeOptions.defaults(), png()))
                .isInstanceOf(BoxfitException.class)
                .extracting(e -> ((BoxfitException) e).getError())
                .isEqualTo(BoxfitError.INVALID_DESTINATION);
    }

    private static void writePngWithComment(Path file, String comment) throws Exception {
        BufferedImage image = new BufferedImage(6, 5, BufferedImage.TYPE_INT_RGB);
        ImageWriter writer = ImageIO.getImageWritersByFormatName("png").next();
        try (ImageOutputStream out = ImageIO.createImageOutputStream(file.toFile())) {
            writer.setOutput(out);
            IIOMetadata metadata = writer.getDefaultImageMetadata(ImageTypeSpecifier.createFromRenderedImage(image), null);

            IIOMetadataNode entry = new IIOMetadataNode("tEXtEntry");
            entry.setAttribute("keyword", "Comment");
            entry.setAttribute("value", comment);
            IIOMetadataNode text = new IIOMetadataNode("tEXt");
            text.appendChild(entry);
            IIOMetadataNode root = new IIOMetadataNode("javax_imageio_png_1.0");
            root.appendChild(text);
            metadata.mergeTree("javax_imageio_png_1.0", root);

            writer.write(null, new IIOImage(image, null, metadata), null);
        } finally {
            writer.dispose();
        }
    }
}
