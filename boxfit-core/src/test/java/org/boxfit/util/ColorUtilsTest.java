package org.boxfit.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.awt.Color;

import static org.assertj.core.api.Assertions.assertThat;

class ColorUtilsTest {

    @Test
    void parse_namedColors() {
        assertThat(ColorUtils.parse("white")).contains(Color.WHITE);
        assertThat(ColorUtils.parse("Black")).contains(Color.BLACK);
        assertThat(ColorUtils.parse("green")).contains(new Color(0, 128, 0));
        assertThat(ColorUtils.parse("grey")).contains(ColorUtils.parse("gray").orElseThrow());
    }

    @Test
    void parse_transparentAliases() {
        assertThat(ColorUtils.parse("transparent")).hasValueSatisfying(c -> assertThat(ColorUtils.isTransparent(c)).isTrue());
        assertThat(ColorUtils.parse("none")).hasValueSatisfying(c -> assertThat(ColorUtils.isTransparent(c)).isTrue());
        assertThat(ColorUtils.isTransparent(Color.WHITE)).isFalse();
    }

    @Test
    void parse_hexForms() {
        assertThat(ColorUtils.parse("#f00")).contains(new Color(255, 0, 0));
        assertThat(ColorUtils.parse("#1A2b3C")).contains(new Color(0x1a, 0x2b, 0x3c));
        assertThat(ColorUtils.parse("#11223380")).contains(new Color(0x11, 0x22, 0x33, 0x80));
    }

    @Test
    void parse_rgbFunctions() {
        assertThat(ColorUtils.parse("rgb(10, 20, 30)")).contains(new Color(10, 20, 30));
        assertThat(ColorUtils.parse("rgba(10,20,30,0.5)")).contains(new Color(10, 20, 30, 128));
        assertThat(ColorUtils.parse("rgba(10,20,30,1.0)")).contains(new Color(10, 20, 30));
        assertThat(ColorUtils.parse("rgba(10,20,30,.25)")).contains(new Color(10, 20, 30, 64));
        assertThat(ColorUtils.parse("rgba(10,20,30,0)")).hasValueSatisfying(c -> assertThat(ColorUtils.isTransparent(c)).isTrue());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", " ", "blur", "chartreuse-ish", "#12", "#12345", "rgb(256,0,0)", "rgba(1,2,3,1.5)", "rgba(0,0,0,)", "rgba(0,0,0,.)", "rgb(1,2)"})
    void parse_rejectsUnknownValues(String value) {
        assertThat(ColorUtils.parse(value)).isEmpty();
    }

    @Test
    void parse_null() {
        assertThat(ColorUtils.parse(null)).isEmpty();
    }
}
