package at.sv.astro.time;

import java.util.Locale;

public record PolarisReading(double localSiderealTimeDegrees, double hourAngleHours, double clockHours) {

    public String formatLocalSiderealTime() {
        return formatHms(localSiderealTimeDegrees / 15.0, "%02d:%02d:%02d");
    }

    public String formatHourAngle() {
        return formatHms(hourAngleHours, "%02d:%02d:%02d");
    }

    public String formatClock() {
        return formatHms(clockHours, "%d:%02d:%02d");
    }

    private static String formatHms(double hours, String pattern) {
        int h = (int) hours;
        int m = (int) ((hours - h) * 60);
        int s = (int) ((hours - h) * 3600 - m * 60);
        return String.format(Locale.ROOT, pattern, h, m, s);
    }

    @Override
    public String toString() {
        return "LST " + formatLocalSiderealTime() + ", HA " + formatHourAngle() + ", Polaris " + formatClock();
    }
}
