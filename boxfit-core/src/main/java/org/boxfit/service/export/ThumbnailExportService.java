package org.boxfit.service.export;

import org.boxfit.config.BoxfitProperties;
import org.boxfit.engine.RasterEngine;
import org.boxfit.exception.BoxfitError;
import org.boxfit.model.Raster;
import org.boxfit.model.dto.BoxSpec;
import org.boxfit.model.dto.ResizeOptions;
import org.boxfit.model.dto.WriteOptions;
import org.boxfit.service.resize.ThumbnailService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Writes rasters to disk: format selection, parent directory creation, file permissions
 * and header stripping.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ThumbnailExportService {

    private final RasterEngine rasterEngine;
    private final ThumbnailService thumbnailService;
    private final BoxfitProperties boxfitProperties;

    public void write(Raster raster, Path destPath) {
        write(raster, destPath, boxfitProperties.getExport().toOptions());
    }

    /**
     * Writes {@code raster} to {@code destPath}. Headers never survive a write since the raster
     * carries pixels only, so {@code stripHeaders} needs no extra pass here.
     */
    public void write(Raster raster, Path destPath, WriteOptions options) {
        if (destPath == null) {
            throw BoxfitError.INVALID_DESTINATION.createException();
        }
        String format = resolveFormat(destPath, options.getFormat());
        Set<PosixFilePermission> directoryPermissions = parsePermissions(options.getDirectoryPermissions());
        Set<PosixFilePermission> filePermissions = parsePermissions(options.getFilePermissions());

        try {
            createParentDirectories(destPath, directoryPermissions);
            try (OutputStream out = Files.newOutputStream(destPath)) {
                rasterEngine.encode(raster, out, format);
            }
            applyPermissions(destPath, filePermissions);
        } catch (IOException e) {
            log.error("Failed to write image to {}: {}", destPath, e.getMessage(), e);
            throw BoxfitError.WRITE_FAILED.createException(e, destPath, e.getMessage());
        }
        log.debug("Wrote {} to {} as {}", raster, destPath, format);
    }

    /**
     * Re-encodes the image at {@code path} in its own format, dropping EXIF and other metadata.
     * The new file replaces the original only once it has been written completely.
     */
    public void stripHeaders(Path path) {
        String format = rasterEngine.detectFormat(path);
        Raster raster = rasterEngine.decode(path);
        Path target = path.toAbsolutePath();
        Path temp = null;
        boolean replaced = false;
        try {
            temp = Files.createTempFile(target.getParent(), "." + target.getFileName(), ".tmp");
            try (OutputStream out = Files.newOutputStream(temp)) {
                rasterEngine.encode(raster, out, format);
            }
            if (supportsPosix(target)) {
                Files.setPosixFilePermissions(temp, Files.getPosixFilePermissions(target));
            }
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            replaced = true;
        } catch (IOException e) {
            log.error("Failed to strip headers from {}: {}", path, e.getMessage(), e);
            throw BoxfitError.WRITE_FAILED.createException(e, path, e.getMessage());
        } finally {
            raster.release();
            if (temp != null && !replaced) {
                FileUtils.deleteQuietly(temp.toFile());
            }
        }
        log.debug("Stripped headers from {}", path);
    }

    /**
     * Resizes {@code source} into every box and writes each result to the path used as its key.
     * Nothing is written unless the whole batch resized successfully.
     */
    public void resizeMultiAndWrite(Raster source, List<BoxSpec<Path>> boxes, ResizeOptions resizeOptions, WriteOptions writeOptions) {
        for (BoxSpec<Path> box : boxes) {
            if (box != null && box.key() == null) {
                throw BoxfitError.INVALID_DESTINATION.createException();
            }
        }
        Map<Path, Raster> results = thumbnailService.resizeMulti(source, boxes, resizeOptions);
        try {
            results.forEach((path, raster) -> write(raster, path, writeOptions));
        } finally {
            results.values().forEach(Raster::release);
        }
        log.info("Wrote {} thumbnail(s) for {}", results.size(), source);
    }

    private String resolveFormat(Path destPath, String requested) {
        String format = StringUtils.isNotBlank(requested)
                ? requested
                : FilenameUtils.getExtension(destPath.getFileName().toString());
        format = format.toLowerCase(Locale.ROOT);
        if (!ImageIO.getImageWritersByFormatName(format).hasNext()) {
            throw BoxfitError.INVALID_FORMAT.createException(format);
        }
        return format;
    }

    private Set<PosixFilePermission> parsePermissions(String permissions) {
        try {
            return PosixFilePermissions.fromString(permissions);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw BoxfitError.INVALID_PERMISSIONS.createException(e, permissions);
        }
    }

    private void createParentDirectories(Path destPath, Set<PosixFilePermission> permissions) throws IOException {
        Path parent = destPath.toAbsolutePath().getParent();
        if (parent == null || Files.isDirectory(parent)) {
            return;
        }
        Deque<Path> missing = new ArrayDeque<>();
        for (Path dir = parent; dir != null && !Files.exists(dir); dir = dir.getParent()) {
            missing.push(dir);
        }
        // created top-down so each new directory gets the mode regardless of umask
        while (!missing.isEmpty()) {
            Path dir = missing.pop();
            Files.createDirectory(dir);
            applyPermissions(dir, permissions);
        }
    }

    private void applyPermissions(Path path, Set<PosixFilePermission> permissions) throws IOException {
        if (!supportsPosix(path)) {
            log.debug("Skipping permissions for {}: file system is not POSIX", path);
            return;
        }
        Files.setPosixFilePermissions(path, permissions);
    }

    private boolean supportsPosix(Path path) {
        return path.getFileSystem().supportedFileAttributeViews().contains("posix");
    }
}
