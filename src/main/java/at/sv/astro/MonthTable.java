package at.sv.astro;

import java.time.YearMonth;
import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The calendar data of one month, keyed by day of month.
 */
public record MonthTable(YearMonth month, SortedMap<Integer, CalendarDayData> days) {

    public MonthTable {
        days = Collections.unmodifiableSortedMap(new TreeMap<>(days));
    }

    public static MonthTable empty(YearMonth month) {
        return new MonthTable(month, new TreeMap<>());
    }

    public CalendarDayData getDay(int dayOfMonth) {
        return days.get(dayOfMonth);
    }

    public boolean isEmpty() {
        return days.isEmpty();
    }
}
