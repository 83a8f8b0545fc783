package org.boxfit.util;

import lombok.experimental.UtilityClass;
import org.apache.commons.lang3.StringUtils;

import java.awt.Color;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@UtilityClass
public class ColorUtils {

    private static final Color TRANSPARENT = new Color(0, 0, 0, 0);
    private static final Pattern HEX_PATTERN = Pattern.compile("#([0-9a-f]{3}|[0-9a-f]{6}|[0-9a-f]{8})");
    private static final Pattern RGB_PATTERN = Pattern.compile(
            "rgba?\\(\\s*(\\d{1,3})\\s*,\\s*(\\d{1,3})\\s*,\\s*(\\d{1,3})\\s*(?:,\\s*(0|1|0?\\.\\d+|1\\.0+)\\s*)?\\)");

    private static final Map<String, Color> NAMED_COLORS = Map.ofEntries(
            Map.entry("transparent", TRANSPARENT),
            Map.entry("none", TRANSPARENT),
            Map.entry("white", Color.WHITE),
            Map.entry("black", Color.BLACK),
            Map.entry("red", new Color(255, 0, 0)),
            Map.entry("green", new Color(0, 128, 0)),
            Map.entry("lime", new Color(0, 255, 0)),
            Map.entry("blue", new Color(0, 0, 255)),
            Map.entry("yellow", new Color(255, 255, 0)),
            Map.entry("cyan", new Color(0, 255, 255)),
            Map.entry("aqua", new Color(0, 255, 255)),
            Map.entry("magenta", new Color(255, 0, 255)),
            Map.entry("fuchsia", new Color(255, 0, 255)),
            Map.entry("gray", new Color(128, 128, 128)),
            Map.entry("grey", new Color(128, 128, 128)),
            Map.entry("silver", new Color(192, 192, 192)),
            Map.entry("maroon", new Color(128, 0, 0)),
            Map.entry("navy", new Color(0, 0, 128)),
            Map.entry("olive", new Color(128, 128, 0)),
            Map.entry("purple", new Color(128, 0, 128)),
            Map.entry("teal", new Color(0, 128, 128)),
            Map.entry("orange", new Color(255, 165, 0)),
            Map.entry("pink", new Color(255, 192, 203)),
            Map.entry("brown", new Color(165, 42, 42)));

    /**
     * Parses a color name, {@code #rgb}, {@code #rrggbb}, {@code #rrggbbaa},
     * {@code rgb(r,g,b)} or {@code rgba(r,g,b,a)} with alpha between 0 and 1.
     */
    public Optional<Color> parse(String value) {
        if (StringUtils.isBlank(value)) {
            return Optional.empty();
        }
        String normalized = StringUtils.deleteWhitespace(value).toLowerCase(Locale.ROOT);

        Color named = NAMED_COLORS.get(normalized);
        if (named != null) {
            return Optional.of(named);
        }

        Matcher hex = HEX_PATTERN.matcher(normalized);
        if (hex.matches()) {
            return Optional.of(fromHex(hex.group(1)));
        }

        Matcher rgb = RGB_PATTERN.matcher(normalized);
        if (rgb.matches()) {
            return fromRgb(rgb);
        }
        return Optional.empty();
    }

    public boolean isTransparent(Color color) {
        return color.getAlpha() == 0;
    }

    private Color fromHex(String digits) {
        if (digits.length() == 3) {
            StringBuilder expanded = new StringBuilder(6);
            for (char c : digits.toCharArray()) {
                expanded.append(c).append(c);
            }
            digits = expanded.toString();
        }
        int r = Integer.parseInt(digits.substring(0, 2), 16);
        int g = Integer.parseInt(digits.substring(2, 4), 16);
        int b = Integer.parseInt(digits.substring(4, 6), 16);
        int a = digits.length() == 8 ? Integer.parseInt(digits.substring(6, 8), 16) : 255;
        return new Color(r, g, b, a);
    }

    private Optional<Color> fromRgb(Matcher rgb) {
        int r = Integer.parseInt(rgb.group(1));
        int g = Integer.parseInt(rgb.group(2));
        int b = Integer.parseInt(rgb.group(3));
        if (r > 255 || g > 255 || b > 255) {
            return Optional.empty();
        }
        int a = 255;
        if (rgb.group(4) != null) {
            a = (int) Math.round(Double.parseDouble(rgb.group(4)) * 255);
        }
        return Optional.of(new Color(r, g, b, a));
    }
}
