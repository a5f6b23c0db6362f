package at.sv.astro.time;

import java.time.ZonedDateTime;
import java.util.Comparator;
import java.util.Objects;

public record AstroEvent(EventKind kind, ZonedDateTime time) {

    public static final Comparator<AstroEvent> BY_TIME = Comparator.comparing(AstroEvent::time);

    public AstroEvent {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(time, "time");
    }

    public boolean isAtOrBefore(ZonedDateTime dateTime) {
        return !time.isAfter(dateTime);
    }

    @Override
    public String toString() {
        return kind + "@" + time;
    }
}
