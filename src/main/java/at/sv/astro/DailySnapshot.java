package at.sv.astro;

import at.sv.astro.moon.MoonPhaseName;
import at.sv.astro.time.EventKind;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * The formatted solar and lunar times of one day at one location. Missing events are represented by
 * {@link FormatUtil#UNKNOWN_TIME}.
 */
@Data
public final class DailySnapshot {

    static final int MINUTES_PER_DAY = 1440;

    private final Location location;
    private final LocalDate date;
    private final Map<EventKind, String> times;
    /**
     * Null if the sun does not both rise and set on this day.
     */
    private final Integer dayLengthMinutes;
    private final MoonPhaseName moonPhase;
    private final int illuminationPercent;

    @Builder
    public DailySnapshot(Location location, LocalDate date, Map<EventKind, String> times, Integer dayLengthMinutes,
                         MoonPhaseName moonPhase, int illuminationPercent) {
        this.location = location;
        this.date = date;
        EnumMap<EventKind, String> copy = new EnumMap<>(EventKind.class);
        copy.putAll(times);
        this.times = Collections.unmodifiableMap(copy);
        this.dayLengthMinutes = dayLengthMinutes;
        this.moonPhase = moonPhase;
        this.illuminationPercent = illuminationPercent;
    }

    public String getTime(EventKind kind) {
        return times.getOrDefault(kind, FormatUtil.UNKNOWN_TIME);
    }

    public String getSunrise() {
        return getTime(EventKind.SUNRISE);
    }

    public String getSunset() {
        return getTime(EventKind.SUNSET);
    }

    public String getSolarNoon() {
        return getTime(EventKind.SOLAR_NOON);
    }

    public String getMoonrise() {
        return getTime(EventKind.MOONRISE);
    }

    public String getMoonset() {
        return getTime(EventKind.MOONSET);
    }

    public Integer getNightLengthMinutes() {
        if (dayLengthMinutes == null) {
            return null;
        }
        return MINUTES_PER_DAY - dayLengthMinutes;
    }

    public String getDayLength() {
        return FormatUtil.formatMinutes(dayLengthMinutes);
    }

    public String getNightLength() {
        return FormatUtil.formatMinutes(getNightLengthMinutes());
    }

    public String getMoonPhaseLabel() {
        return moonPhase.getLabel();
    }

    public String getIllumination() {
        return FormatUtil.formatPercent(illuminationPercent);
    }
}
