package at.sv.astro;

import at.sv.astro.time.AstroEvent;
import at.sv.astro.time.EventKind;
import org.jetbrains.annotations.Nullable;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * The first occurrence of each event kind within one day's event sequence.
 */
final class DayEvents {

    private final Map<EventKind, ZonedDateTime> firstOccurrences;
    private final List<AstroEvent> events;
    private final ZoneId zone;

    DayEvents(List<AstroEvent> events, ZoneId zone) {
        this.events = List.copyOf(events);
        this.zone = zone;
        firstOccurrences = new EnumMap<>(EventKind.class);
        for (AstroEvent event : events) {
            firstOccurrences.merge(event.kind(), event.time(), (first, other) -> other.isBefore(first) ? other : first);
        }
    }

    @Nullable
    ZonedDateTime find(EventKind kind) {
        return firstOccurrences.get(kind);
    }

    String format(EventKind kind) {
        return FormatUtil.formatTime(find(kind), zone);
    }

    List<AstroEvent> getEvents() {
        return events;
    }
}
