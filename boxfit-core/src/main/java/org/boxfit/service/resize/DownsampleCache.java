package org.boxfit.service.resize;

import org.boxfit.model.Raster;
import lombok.Getter;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Intermediate rasters produced by exact halving steps, keyed by size.
 * <p>
 * Lives for one batch over one source and is closed when the batch ends. Entries are stored
 * and handed out as copies so no caller ever shares pixels with the cache.
 */
public class DownsampleCache implements AutoCloseable {

    private final Map<String, Raster> entries = new HashMap<>();

    @Getter
    private int hits;

    @Getter
    private int stores;

    public static String key(int width, int height) {
        return width + "x" + height;
    }

    public Optional<Raster> get(int width, int height) {
        Raster cached = entries.get(key(width, height));
        if (cached == null) {
            return Optional.empty();
        }
        hits++;
        return Optional.of(cached.copy());
    }

    public void put(Raster raster) {
        Raster previous = entries.put(key(raster.getWidth(), raster.getHeight()), raster.copy());
        if (previous != null) {
            previous.release();
        }
        stores++;
    }

    boolean contains(int width, int height) {
        return entries.containsKey(key(width, height));
    }

    public int size() {
        return entries.size();
    }

    @Override
    public void close() {
        entries.values().forEach(Raster::release);
        entries.clear();
    }
}
