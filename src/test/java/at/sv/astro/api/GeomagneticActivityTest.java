package at.sv.astro.api;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class GeomagneticActivityTest {

    @Test
    void of_thresholds() {
        assertThat(GeomagneticActivity.of(0)).isEqualTo(GeomagneticActivity.QUIET);
        assertThat(GeomagneticActivity.of(2.99)).isEqualTo(GeomagneticActivity.QUIET);
        assertThat(GeomagneticActivity.of(3)).isEqualTo(GeomagneticActivity.UNSETTLED);
        assertThat(GeomagneticActivity.of(4.33)).isEqualTo(GeomagneticActivity.ACTIVE);
        assertThat(GeomagneticActivity.of(5)).isEqualTo(GeomagneticActivity.MINOR_STORM);
        assertThat(GeomagneticActivity.of(6.67)).isEqualTo(GeomagneticActivity.MODERATE_STORM);
        assertThat(GeomagneticActivity.of(7)).isEqualTo(GeomagneticActivity.STRONG_STORM);
        assertThat(GeomagneticActivity.of(8.33)).isEqualTo(GeomagneticActivity.SEVERE_STORM);
        assertThat(GeomagneticActivity.of(9)).isEqualTo(GeomagneticActivity.EXTREME_STORM);
    }

    @Test
    void isStorm_fromG1() {
        assertThat(GeomagneticActivity.ACTIVE.isStorm()).isFalse();
        assertThat(GeomagneticActivity.MINOR_STORM.isStorm()).isTrue();
        assertThat(GeomagneticActivity.of(8.67).getLabel()).isEqualTo("Severe Storm (G4)");
    }
}
