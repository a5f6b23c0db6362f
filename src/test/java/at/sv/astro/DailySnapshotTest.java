package at.sv.astro;

import at.sv.astro.moon.MoonPhaseName;
import at.sv.astro.time.EventKind;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DailySnapshotTest {

    private static DailySnapshot snapshot(Map<EventKind, String> times) {
        return DailySnapshot.builder()
                            .location(Location.PRAGUE)
                            .date(LocalDate.of(2024, 6, 20))
                            .times(times)
                            .dayLengthMinutes(930)
                            .moonPhase(MoonPhaseName.WAXING_GIBBOUS)
                            .illuminationPercent(97)
                            .build();
    }

    @Test
    void builder_sourceMapChangedAfterwards_snapshotUnchanged() {
        Map<EventKind, String> times = new HashMap<>();
        times.put(EventKind.SUNRISE, "04:52");
        times.put(EventKind.SUNSET, "21:13");
        DailySnapshot snapshot = snapshot(times);

        times.put(EventKind.SUNRISE, "05:00");
        times.put(EventKind.MOONRISE, "19:30");

        assertThat(snapshot.getSunrise()).isEqualTo("04:52");
        assertThat(snapshot.getMoonrise()).isEqualTo(FormatUtil.UNKNOWN_TIME);
        assertThat(snapshot.getTimes()).hasSize(2);
    }

    @Test
    void getTimes_unmodifiable() {
        DailySnapshot snapshot = snapshot(new HashMap<>(Map.of(EventKind.SUNRISE, "04:52")));

        assertThatThrownBy(() -> snapshot.getTimes().put(EventKind.SUNSET, "21:13"))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> snapshot.getTimes().remove(EventKind.SUNRISE))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void getTimes_orderedByKind() {
        DailySnapshot snapshot = snapshot(Map.of(EventKind.SUNSET, "21:13", EventKind.SUNRISE, "04:52"));

        assertThat(snapshot.getTimes().keySet()).containsExactly(EventKind.SUNRISE, EventKind.SUNSET);
    }

    @Test
    void nightLength_complementOfDayLength() {
        DailySnapshot snapshot = snapshot(Map.of());

        assertThat(snapshot.getNightLengthMinutes()).isEqualTo(510);
        assertThat(snapshot.getDayLength()).isEqualTo(FormatUtil.formatMinutes(930));
    }
}
