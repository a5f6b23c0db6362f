package at.sv.astro;

import at.sv.astro.moon.PhaseResolution;
import at.sv.astro.moon.PhaseResolver;
import at.sv.astro.time.EventKind;
import at.sv.astro.time.EventSource;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.EnumMap;
import java.util.Map;

/**
 * Turns the solar and lunar events of one local calendar day into a {@link DailySnapshot}.
 */
@Slf4j
public final class DailyAstroCalculator {

    private final EventSource eventSource;
    private final PhaseResolver phaseResolver;
    private final ZoneId zone;

    public DailyAstroCalculator(EventSource eventSource, PhaseResolver phaseResolver, ZoneId zone) {
        this.eventSource = eventSource;
        this.phaseResolver = phaseResolver;
        this.zone = zone;
    }

    /**
     * @throws java.util.concurrent.CancellationException if the token got cancelled in between the event lookups
     */
    public DailySnapshot calculate(LocalDate date, Location location, CancellationToken token) {
        ZonedDateTime startOfDay = date.atStartOfDay(zone);
        Duration day = lengthOfDay(date, zone);
        log.trace("Calculating {} for {} from {}", date, location, startOfDay);

        DayEvents solar = new DayEvents(eventSource.solarEvents(startOfDay, location.latitude(), location.longitude(), day), zone);
        token.ensureActive();
        DayEvents lunar = new DayEvents(eventSource.lunarEvents(startOfDay, location.latitude(), location.longitude(), day), zone);
        token.ensureActive();
        PhaseResolution phase = phaseResolver.resolve(startOfDay, location, lunar.getEvents());
        token.ensureActive();

        Map<EventKind, String> times = new EnumMap<>(EventKind.class);
        for (EventKind kind : EventKind.values()) {
            if (kind.isSolar()) {
                times.put(kind, solar.format(kind));
            } else if (kind.isLunarHorizon()) {
                times.put(kind, lunar.format(kind));
            }
        }
        return DailySnapshot.builder()
                            .location(location)
                            .date(date)
                            .times(times)
                            .dayLengthMinutes(dayLengthMinutes(solar))
                            .moonPhase(phase.phase())
                            .illuminationPercent(phase.illuminationPercent())
                            .build();
    }

    /**
     * @return the whole minutes between sunrise and sunset, or null if either is missing or sunset is not after
     * sunrise
     */
    static Integer dayLengthMinutes(DayEvents solar) {
        ZonedDateTime sunrise = solar.find(EventKind.SUNRISE);
        ZonedDateTime sunset = solar.find(EventKind.SUNSET);
        if (sunrise == null || sunset == null || !sunset.isAfter(sunrise)) {
            return null;
        }
        return (int) Duration.between(sunrise, sunset).toMinutes();
    }

    /**
     * @return the duration from the start of the given local day until the start of the next one (23 or 25 hours on
     * DST transitions)
     */
    static Duration lengthOfDay(LocalDate date, ZoneId zone) {
        return Duration.between(date.atStartOfDay(zone), date.plusDays(1).atStartOfDay(zone));
    }
}
