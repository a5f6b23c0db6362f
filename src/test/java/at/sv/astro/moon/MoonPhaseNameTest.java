package at.sv.astro.moon;

import at.sv.astro.time.EventKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MoonPhaseNameTest {

    @Test
    void following_isNextIntermediatePhase() {
        assertThat(MoonPhaseName.following(EventKind.NEW_MOON)).isEqualTo(MoonPhaseName.WAXING_CRESCENT);
        assertThat(MoonPhaseName.following(EventKind.FIRST_QUARTER)).isEqualTo(MoonPhaseName.WAXING_GIBBOUS);
        assertThat(MoonPhaseName.following(EventKind.FULL_MOON)).isEqualTo(MoonPhaseName.WANING_GIBBOUS);
        assertThat(MoonPhaseName.following(EventKind.LAST_QUARTER)).isEqualTo(MoonPhaseName.WANING_CRESCENT);
    }

    @Test
    void preceding_isPreviousIntermediatePhase() {
        assertThat(MoonPhaseName.preceding(EventKind.NEW_MOON)).isEqualTo(MoonPhaseName.WANING_CRESCENT);
        assertThat(MoonPhaseName.preceding(EventKind.FIRST_QUARTER)).isEqualTo(MoonPhaseName.WAXING_CRESCENT);
        assertThat(MoonPhaseName.preceding(EventKind.FULL_MOON)).isEqualTo(MoonPhaseName.WAXING_GIBBOUS);
        assertThat(MoonPhaseName.preceding(EventKind.LAST_QUARTER)).isEqualTo(MoonPhaseName.WANING_GIBBOUS);
    }

    @Test
    void of_nonPhaseKind_exception() {
        assertThatThrownBy(() -> MoonPhaseName.of(EventKind.MOONRISE)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void labels() {
        assertThat(MoonPhaseName.WAXING_GIBBOUS.getLabel()).isEqualTo("Waxing Gibbous");
        assertThat(MoonPhaseName.UNKNOWN.getLabel()).isEqualTo("Unknown");
    }
}
