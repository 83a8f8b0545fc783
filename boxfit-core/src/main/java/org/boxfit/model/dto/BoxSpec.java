package org.boxfit.model.dto;

/**
 * A requested bounding box. The key names the slot the result is returned under.
 */
public record BoxSpec<K>(int width, int height, K key) {

    public static <K> BoxSpec<K> of(int width, int height, K key) {
        return new BoxSpec<>(width, height, key);
    }

    public String sizeLabel() {
        return width + "x" + height;
    }
}
