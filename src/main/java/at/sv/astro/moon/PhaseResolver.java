package at.sv.astro.moon;

import at.sv.astro.Location;
import at.sv.astro.time.AstroEvent;
import at.sv.astro.time.EventKind;
import at.sv.astro.time.EventSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Determines the moon phase and its illumination from the cardinal phase events surrounding a point in time.
 * <p>
 * Illumination uses a cosine over a constant 29.53-day synodic month, counted from the most recent New Moon in the
 * phase window. Without a New Moon in the window the illumination is reported as 0.
 */
@Slf4j
@RequiredArgsConstructor
public final class PhaseResolver {

    static final Duration LOOKBACK = Duration.ofDays(15);
    static final Duration WINDOW = Duration.ofDays(30);
    static final double SYNODIC_MONTH_DAYS = 29.53;
    private static final double MS_PER_DAY = 86_400_000.0;

    private final EventSource eventSource;

    /**
     * @param dayLunarEvents the lunar events of the day starting at {@code startOfDay}. A cardinal phase among them
     *                       determines the phase name directly.
     */
    public PhaseResolution resolve(ZonedDateTime startOfDay, Location location, List<AstroEvent> dayLunarEvents) {
        List<AstroEvent> window = phaseWindow(startOfDay, location);
        MoonPhaseName phase = dayLunarEvents.stream()
                                            .filter(event -> event.kind().isLunarPhase())
                                            .findFirst()
                                            .map(event -> MoonPhaseName.of(event.kind()))
                                            .orElseGet(() -> intermediatePhase(window, startOfDay));
        return new PhaseResolution(phase, illuminationPercent(window, startOfDay));
    }

    public int illuminationPercent(ZonedDateTime time, Location location) {
        return illuminationPercent(phaseWindow(time, location), time);
    }

    private List<AstroEvent> phaseWindow(ZonedDateTime time, Location location) {
        return eventSource.lunarPhaseEvents(time.minus(LOOKBACK), location.latitude(), location.longitude(), WINDOW);
    }

    static MoonPhaseName intermediatePhase(List<AstroEvent> window, ZonedDateTime time) {
        Optional<AstroEvent> previous = latestAtOrBefore(window, time, EventKind::isLunarPhase);
        if (previous.isPresent()) {
            return MoonPhaseName.following(previous.get().kind());
        }
        return window.stream()
                     .filter(event -> event.kind().isLunarPhase())
                     .filter(event -> event.time().isAfter(time))
                     .min(AstroEvent.BY_TIME)
                     .map(event -> MoonPhaseName.preceding(event.kind()))
                     .orElse(MoonPhaseName.UNKNOWN);
    }

    static int illuminationPercent(List<AstroEvent> window, ZonedDateTime time) {
        Optional<AstroEvent> newMoon = latestAtOrBefore(window, time, kind -> kind == EventKind.NEW_MOON);
        if (newMoon.isEmpty()) {
            log.debug("No New Moon within the phase window before {}, using 0% illumination", time);
            return 0;
        }
        double daysFromNew = (time.toInstant().toEpochMilli() - newMoon.get().time().toInstant().toEpochMilli()) / MS_PER_DAY;
        double angle = daysFromNew / SYNODIC_MONTH_DAYS * 2 * Math.PI;
        return clampPercent(Math.round((1 - Math.cos(angle)) / 2 * 100));
    }

    static int clampPercent(long percent) {
        return (int) Math.max(0, Math.min(100, percent));
    }

    private static Optional<AstroEvent> latestAtOrBefore(List<AstroEvent> events, ZonedDateTime time,
                                                         Predicate<EventKind> kindFilter) {
        return events.stream()
                     .filter(event -> kindFilter.test(event.kind()))
                     .filter(event -> event.isAtOrBefore(time))
                     .max(AstroEvent.BY_TIME);
    }
}
