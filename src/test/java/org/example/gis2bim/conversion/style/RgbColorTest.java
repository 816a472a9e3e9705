package org.example.gis2bim.conversion.style;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class RgbColorTest {

    @Test
    void parseHex_acceptsOptionalHashAndAlpha() {
        RgbColor opaque = RgbColor.parseHex("ff8000");
        RgbColor translucent = RgbColor.parseHex("#FF800080");

        assertThat(opaque.red()).isEqualTo(1.0);
        assertThat(opaque.green()).isCloseTo(128 / 255.0, within(1e-12));
        assertThat(opaque.blue()).isEqualTo(0.0);
        assertThat(opaque.transparency()).isEqualTo(0.0);
        assertThat(translucent.transparency()).isCloseTo(1.0 - 128 / 255.0, within(1e-12));
        assertThat(translucent.toHex()).isEqualTo("#FF800080");
        assertThat(opaque.toHex()).isEqualTo("#FF8000");
    }

    @Test
    void parseHex_rejectsBadFormat() {
        assertThatThrownBy(() -> RgbColor.parseHex("#FFF")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RgbColor.parseHex("#12345Z")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RgbColor.parseHex(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void constructor_rejectsComponentsOutsideUnitRange() {
        assertThatThrownBy(() -> RgbColor.of(1.01, 0, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RgbColor(0, 0, 0, -0.1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RgbColor.of(Double.NaN, 0, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
