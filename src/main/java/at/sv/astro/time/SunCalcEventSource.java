package at.sv.astro.time;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.shredzone.commons.suncalc.MoonPhase;
import org.shredzone.commons.suncalc.MoonTimes;
import org.shredzone.commons.suncalc.SunTimes;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * {@link EventSource} backed by commons-suncalc.
 * <p>
 * Golden hour spans the sun altitudes between {@link SunTimes.Twilight#BLUE_HOUR} (-4°) and
 * {@link SunTimes.Twilight#GOLDEN_HOUR} (6°), blue hour the altitudes between {@link SunTimes.Twilight#NIGHT_HOUR}
 * (-8°) and {@link SunTimes.Twilight#BLUE_HOUR}.
 */
public final class SunCalcEventSource implements EventSource {

    private static final List<Crossing> CROSSINGS = List.of(
            new Crossing(SunTimes.Twilight.ASTRONOMICAL, List.of(EventKind.ASTRONOMICAL_DAWN), List.of(EventKind.ASTRONOMICAL_DUSK)),
            new Crossing(SunTimes.Twilight.NAUTICAL, List.of(EventKind.NAUTICAL_DAWN), List.of(EventKind.NAUTICAL_DUSK)),
            new Crossing(SunTimes.Twilight.NIGHT_HOUR, List.of(EventKind.BLUE_HOUR_DAWN_START), List.of(EventKind.BLUE_HOUR_DUSK_END)),
            new Crossing(SunTimes.Twilight.CIVIL, List.of(EventKind.CIVIL_DAWN), List.of(EventKind.CIVIL_DUSK)),
            new Crossing(SunTimes.Twilight.BLUE_HOUR,
                    List.of(EventKind.BLUE_HOUR_DAWN_END, EventKind.GOLDEN_HOUR_DAWN_START),
                    List.of(EventKind.GOLDEN_HOUR_DUSK_END, EventKind.BLUE_HOUR_DUSK_START)),
            new Crossing(SunTimes.Twilight.VISUAL, List.of(EventKind.SUNRISE), List.of(EventKind.SUNSET)),
            new Crossing(SunTimes.Twilight.GOLDEN_HOUR, List.of(EventKind.GOLDEN_HOUR_DAWN_END), List.of(EventKind.GOLDEN_HOUR_DUSK_START))
    );

    private static final List<PhaseMapping> PHASES = List.of(
            new PhaseMapping(MoonPhase.Phase.NEW_MOON, EventKind.NEW_MOON),
            new PhaseMapping(MoonPhase.Phase.FIRST_QUARTER, EventKind.FIRST_QUARTER),
            new PhaseMapping(MoonPhase.Phase.FULL_MOON, EventKind.FULL_MOON),
            new PhaseMapping(MoonPhase.Phase.LAST_QUARTER, EventKind.LAST_QUARTER)
    );

    private final double elevation;
    private final Cache<PhaseKey, Instant> nextPhaseCache;

    public SunCalcEventSource() {
        this(0.0);
    }

    public SunCalcEventSource(double elevation) {
        this.elevation = elevation;
        nextPhaseCache = Caffeine.newBuilder()
                                 .maximumSize(2048)
                                 .build();
    }

    @Override
    public List<AstroEvent> solarEvents(ZonedDateTime start, double latitude, double longitude, Duration window) {
        ZonedDateTime end = start.plus(window);
        List<AstroEvent> events = new ArrayList<>();
        for (Crossing crossing : CROSSINGS) {
            collect(events, crossing.rising(), start, end,
                    cursor -> sunTimesFor(cursor, end, latitude, longitude, crossing.twilight()).getRise());
            collect(events, crossing.setting(), start, end,
                    cursor -> sunTimesFor(cursor, end, latitude, longitude, crossing.twilight()).getSet());
        }
        collect(events, List.of(EventKind.SOLAR_NOON), start, end,
                cursor -> sunTimesFor(cursor, end, latitude, longitude, SunTimes.Twilight.VISUAL).getNoon());
        events.sort(AstroEvent.BY_TIME);
        return events;
    }

    @Override
    public List<AstroEvent> lunarEvents(ZonedDateTime start, double latitude, double longitude, Duration window) {
        ZonedDateTime end = start.plus(window);
        List<AstroEvent> events = new ArrayList<>();
        collect(events, List.of(EventKind.MOONRISE), start, end,
                cursor -> moonTimesFor(cursor, end, latitude, longitude).getRise());
        collect(events, List.of(EventKind.MOONSET), start, end,
                cursor -> moonTimesFor(cursor, end, latitude, longitude).getSet());
        events.addAll(lunarPhaseEvents(start, latitude, longitude, window));
        events.sort(AstroEvent.BY_TIME);
        return events;
    }

    /**
     * Phase events are geocentric, so the location is ignored and lookups are shared across all locations.
     */
    @Override
    public List<AstroEvent> lunarPhaseEvents(ZonedDateTime start, double latitude, double longitude, Duration window) {
        Instant from = start.toInstant();
        Instant end = from.plus(window);
        List<AstroEvent> events = new ArrayList<>();
        for (PhaseMapping mapping : PHASES) {
            long searchDay = epochDay(from);
            while (true) {
                PhaseKey key = new PhaseKey(mapping.phase(), searchDay);
                Instant occurrence = nextPhaseCache.get(key, this::findNextPhase);
                if (!occurrence.isBefore(end)) {
                    break;
                }
                if (!occurrence.isBefore(from)) {
                    events.add(new AstroEvent(mapping.kind(), occurrence.atZone(start.getZone())));
                }
                searchDay = epochDay(occurrence) + 1;
            }
        }
        events.sort(AstroEvent.BY_TIME);
        return events;
    }

    private Instant findNextPhase(PhaseKey key) {
        return MoonPhase.compute()
                        .on(LocalDate.ofEpochDay(key.epochDay()).atStartOfDay(ZoneOffset.UTC))
                        .phase(key.phase())
                        .execute()
                        .getTime()
                        .toInstant();
    }

    private static long epochDay(Instant instant) {
        return instant.atZone(ZoneOffset.UTC).toLocalDate().toEpochDay();
    }

    private static void collect(List<AstroEvent> events, List<EventKind> kinds, ZonedDateTime start, ZonedDateTime end,
                                Function<ZonedDateTime, ZonedDateTime> nextOccurrence) {
        ZonedDateTime cursor = start;
        while (cursor.isBefore(end)) {
            ZonedDateTime time = nextOccurrence.apply(cursor);
            if (time == null || !time.isBefore(end)) {
                return;
            }
            if (time.isBefore(cursor)) {
                // an extremum interpolated slightly before the cursor, already collected
                cursor = cursor.plusHours(1);
                continue;
            }
            ZonedDateTime local = time.withZoneSameInstant(start.getZone());
            kinds.forEach(kind -> events.add(new AstroEvent(kind, local)));
            cursor = time.plusMinutes(1);
        }
    }

    private SunTimes sunTimesFor(ZonedDateTime from, ZonedDateTime end, double latitude, double longitude,
                                 SunTimes.Twilight twilight) {
        return SunTimes.compute()
                       .at(latitude, longitude)
                       .elevation(elevation)
                       .on(from)
                       .twilight(twilight)
                       .limit(Duration.between(from, end))
                       .execute();
    }

    private static MoonTimes moonTimesFor(ZonedDateTime from, ZonedDateTime end, double latitude, double longitude) {
        return MoonTimes.compute()
                        .at(latitude, longitude)
                        .on(from)
                        .limit(Duration.between(from, end))
                        .execute();
    }

    private record Crossing(SunTimes.Twilight twilight, List<EventKind> rising, List<EventKind> setting) {
    }

    private record PhaseMapping(MoonPhase.Phase phase, EventKind kind) {
    }

    private record PhaseKey(MoonPhase.Phase phase, long epochDay) {
    }
}
