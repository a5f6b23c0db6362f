package at.sv.astro.moon;

import at.sv.astro.Location;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class ReferenceNewMoonIlluminationTest {

    private static final long DAY_MS = 86_400_000L;

    @Test
    void referenceNewMoon_zero() {
        assertThat(ReferenceNewMoonIllumination.illuminationPercent(1_738_154_100_000L)).isZero();
    }

    @Test
    void halfSynodicMonthLater_full() {
        long halfMonth = 1_738_154_100_000L + (long) (14.76525 * DAY_MS);

        assertThat(ReferenceNewMoonIllumination.illuminationPercent(halfMonth)).isEqualTo(100);
    }

    @Test
    void beforeReference_usesFlooredAge() {
        long oneSynodicMonthEarlier = 1_738_154_100_000L - 2_551_442_976L;

        assertThat(ReferenceNewMoonIllumination.illuminationPercent(oneSynodicMonthEarlier)).isZero();
        assertThat(ReferenceNewMoonIllumination.illuminationPercent(1_738_154_100_000L - (long) (14.76525 * DAY_MS)))
                .isEqualTo(100);
    }

    @Test
    void asIlluminationModel_ignoresLocation() {
        IlluminationModel model = new ReferenceNewMoonIllumination();
        Instant quarter = Instant.ofEpochMilli(1_738_154_100_000L + 2_551_442_976L / 4);

        assertThat(model.illuminationPercent(quarter.atZone(ZoneOffset.UTC), Location.PRAGUE)).isEqualTo(50);
        assertThat(model.illuminationPercent(quarter.atZone(ZoneOffset.UTC), new Location(-33.87, 151.21, "Sydney")))
                .isEqualTo(50);
    }
}
