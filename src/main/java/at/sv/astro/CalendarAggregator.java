package at.sv.astro;

import at.sv.astro.moon.IlluminationModel;
import at.sv.astro.time.EventKind;
import at.sv.astro.time.EventSource;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Computes the reduced per-day data of a whole month. Illumination is sampled at local noon (start of day plus twelve
 * hours), unlike the {@link DailySnapshot}, which uses the start of the day.
 */
@Slf4j
public final class CalendarAggregator {

    static final Duration NOON_OFFSET = Duration.ofHours(12);

    private final EventSource eventSource;
    private final IlluminationModel illuminationModel;
    private final ZoneId zone;

    public CalendarAggregator(EventSource eventSource, IlluminationModel illuminationModel, ZoneId zone) {
        this.eventSource = eventSource;
        this.illuminationModel = illuminationModel;
        this.zone = zone;
    }

    /**
     * @throws java.util.concurrent.CancellationException if the token got cancelled; partial results are discarded
     */
    public MonthTable aggregate(YearMonth month, Location location, CancellationToken token) {
        SortedMap<Integer, CalendarDayData> days = new TreeMap<>();
        for (int day = 1; day <= month.lengthOfMonth(); day++) {
            token.ensureActive();
            days.put(day, calculateDay(month.atDay(day), location));
        }
        log.debug("Aggregated {} days of {} for {}", days.size(), month, location);
        return new MonthTable(month, days);
    }

    CalendarDayData calculateDay(LocalDate date, Location location) {
        ZonedDateTime startOfDay = date.atStartOfDay(zone);
        Duration day = DailyAstroCalculator.lengthOfDay(date, zone);
        DayEvents solar = new DayEvents(eventSource.solarEvents(startOfDay, location.latitude(), location.longitude(), day), zone);
        DayEvents lunar = new DayEvents(eventSource.lunarEvents(startOfDay, location.latitude(), location.longitude(), day), zone);
        ZonedDateTime noon = startOfDay.plus(NOON_OFFSET);
        return new CalendarDayData(
                solar.format(EventKind.SUNRISE),
                solar.format(EventKind.SUNSET),
                solar.format(EventKind.CIVIL_DAWN),
                solar.format(EventKind.CIVIL_DUSK),
                lunar.format(EventKind.MOONRISE),
                lunar.format(EventKind.MOONSET),
                illuminationModel.illuminationPercent(noon, location));
    }
}
