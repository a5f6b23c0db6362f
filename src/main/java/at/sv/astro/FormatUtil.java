package at.sv.astro;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

public final class FormatUtil {

    public static final String UNKNOWN_TIME = "--:--";
    public static final String UNKNOWN_DURATION = "--";

    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("HH:mm");

    private FormatUtil() {
    }

    /**
     * @return the local wall-clock time in the given zone as {@code HH:mm}, or {@link #UNKNOWN_TIME} if absent
     */
    public static String formatTime(ZonedDateTime time, ZoneId zone) {
        if (time == null) {
            return UNKNOWN_TIME;
        }
        return TIME_FORMATTER.format(time.withZoneSameInstant(zone));
    }

    public static String formatMinutes(Integer minutes) {
        if (minutes == null) {
            return UNKNOWN_DURATION;
        }
        return minutes / 60 + "h " + minutes % 60 + "m";
    }

    public static String formatPercent(int percent) {
        return percent + "%";
    }

    /**
     * @return e.g. {@code 50° 04' 31.80" N}
     */
    public static String formatDms(double decimal, boolean isLatitude) {
        String direction;
        if (isLatitude) {
            direction = decimal >= 0 ? "N" : "S";
        } else {
            direction = decimal >= 0 ? "E" : "W";
        }
        double abs = Math.abs(decimal);
        int degrees = (int) abs;
        double minutesFull = (abs - degrees) * 60;
        int minutes = (int) minutesFull;
        double seconds = (minutesFull - minutes) * 60;
        return String.format(Locale.ROOT, "%d° %02d' %05.2f\" %s", degrees, minutes, seconds, direction);
    }
}
