package at.sv.astro;

public record CalendarDayData(String sunrise, String sunset, String civilDawn, String civilDusk,
                              String moonrise, String moonset, int illuminationPercent) {
}
