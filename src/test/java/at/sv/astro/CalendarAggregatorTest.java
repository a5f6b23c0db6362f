package at.sv.astro;

import at.sv.astro.moon.IlluminationModel;
import at.sv.astro.moon.PhaseResolver;
import at.sv.astro.moon.PhaseWindowIllumination;
import at.sv.astro.time.EventKind;
import at.sv.astro.time.StubEventSource;
import at.sv.astro.time.SunCalcEventSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CalendarAggregatorTest {

    private ZoneId zone;
    private StubEventSource eventSource;
    private List<ZonedDateTime> sampledTimes;
    private CalendarAggregator aggregator;

    @BeforeEach
    void setUp() {
        zone = ZoneId.of("Europe/Prague");
        eventSource = new StubEventSource();
        sampledTimes = new ArrayList<>();
        IlluminationModel model = (time, location) -> {
            sampledTimes.add(time);
            return 42;
        };
        aggregator = new CalendarAggregator(eventSource, model, zone);
    }

    private MonthTable aggregate(YearMonth month) {
        return aggregator.aggregate(month, Location.PRAGUE, CancellationToken.create());
    }

    @Test
    void aggregate_leapFebruary_29Days() {
        MonthTable table = aggregate(YearMonth.of(2024, 2));

        assertThat(table.month()).isEqualTo(YearMonth.of(2024, 2));
        assertThat(table.days().keySet()).containsExactlyElementsOf(
                IntStream.rangeClosed(1, 29).boxed().collect(Collectors.toList()));
    }

    @Test
    void aggregate_nonLeapFebruary_28Days() {
        assertThat(aggregate(YearMonth.of(2023, 2)).days()).hasSize(28);
    }

    @Test
    void aggregate_31DayMonth() {
        MonthTable table = aggregate(YearMonth.of(2024, 12));

        assertThat(table.days()).hasSize(31);
        assertThat(table.days().firstKey()).isEqualTo(1);
        assertThat(table.days().lastKey()).isEqualTo(31);
    }

    @Test
    void aggregate_samplesIlluminationAtNoon() {
        aggregate(YearMonth.of(2024, 3));

        assertThat(sampledTimes).hasSize(31);
        assertThat(sampledTimes.get(0)).isEqualTo(ZonedDateTime.of(2024, 3, 1, 12, 0, 0, 0, zone));
        // start of day plus twelve hours, so 13:00 local time on the day clocks go forward
        assertThat(sampledTimes.get(30)).isEqualTo(ZonedDateTime.of(2024, 3, 31, 13, 0, 0, 0, zone));
    }

    @Test
    void aggregate_keepsReducedFieldsPerDay() {
        ZonedDateTime day = ZonedDateTime.of(2024, 6, 20, 0, 0, 0, 0, zone);
        eventSource.add(EventKind.CIVIL_DAWN, day.withHour(4).withMinute(1))
                   .add(EventKind.SUNRISE, day.withHour(4).withMinute(45))
                   .add(EventKind.SUNSET, day.withHour(20).withMinute(15))
                   .add(EventKind.CIVIL_DUSK, day.withHour(21).withMinute(0))
                   .add(EventKind.MOONRISE, day.withHour(21).withMinute(3))
                   .add(EventKind.MOONSET, day.withHour(3).withMinute(58));

        MonthTable table = aggregate(YearMonth.of(2024, 6));

        assertThat(table.getDay(20)).isEqualTo(new CalendarDayData("04:45", "20:15", "04:01", "21:00", "21:03", "03:58", 42));
        assertThat(table.getDay(21)).isEqualTo(new CalendarDayData("--:--", "--:--", "--:--", "--:--", "--:--", "--:--", 42));
    }

    @Test
    void aggregate_cancelled_discardsPartialResult() {
        CancellationToken token = CancellationToken.create();
        IlluminationModel cancellingModel = (time, location) -> {
            if (time.getDayOfMonth() == 10) {
                token.cancel();
            }
            return 0;
        };
        aggregator = new CalendarAggregator(eventSource, cancellingModel, zone);

        assertThatThrownBy(() -> aggregator.aggregate(YearMonth.of(2024, 5), Location.PRAGUE, token))
                .isInstanceOf(CancellationException.class);
        assertThat(eventSource.getSolarLookups()).isEqualTo(10);
    }

    @Test
    void aggregate_realEphemeris_illuminationWithinBounds() {
        SunCalcEventSource source = new SunCalcEventSource();
        aggregator = new CalendarAggregator(source, new PhaseWindowIllumination(new PhaseResolver(source)), zone);

        MonthTable table = aggregate(YearMonth.of(2025, 1));

        assertThat(table.days()).hasSize(31);
        assertThat(table.days().values()).allSatisfy(day -> {
            assertThat(day.illuminationPercent()).isBetween(0, 100);
            assertThat(day.sunrise()).matches("\\d\\d:\\d\\d");
            assertThat(day.civilDusk()).matches("\\d\\d:\\d\\d");
        });
        // 2025-01-29 is a New Moon, 2025-01-13 a Full Moon
        assertThat(table.getDay(29).illuminationPercent()).isLessThanOrEqualTo(2);
        assertThat(table.getDay(14).illuminationPercent()).isGreaterThanOrEqualTo(95);
    }
}
