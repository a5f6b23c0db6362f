package at.sv.astro.time;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * Supplies solar and lunar events of an ephemeris. Implementations must be deterministic for a given input and free
 * of side effects.
 */
public interface EventSource {

    /**
     * @return all solar events (rise/set, noon, twilight, golden and blue hour boundaries) in
     * {@code [start, start + window)}, ordered by time. Events that do not occur within the window are absent.
     */
    List<AstroEvent> solarEvents(ZonedDateTime start, double latitude, double longitude, Duration window);

    /**
     * @return moonrise, moonset and the four cardinal phase events in {@code [start, start + window)}, ordered by time.
     */
    List<AstroEvent> lunarEvents(ZonedDateTime start, double latitude, double longitude, Duration window);

    /**
     * @return only the cardinal phase events in {@code [start, start + window)}, ordered by time.
     */
    default List<AstroEvent> lunarPhaseEvents(ZonedDateTime start, double latitude, double longitude, Duration window) {
        return lunarEvents(start, latitude, longitude, window).stream()
                                                              .filter(event -> event.kind().isLunarPhase())
                                                              .toList();
    }
}
