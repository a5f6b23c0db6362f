package at.sv.astro.time;

import java.time.Instant;

/**
 * Local sidereal time and the position of Polaris on the reticle dial of a polar scope.
 * <p>
 * Polaris' right ascension is modelled as a linear drift from its J2000 value, which is accurate enough for a few
 * decades around J2000 but is not a precession model.
 */
public final class PolarisClock {

    /**
     * 2000-01-01T12:00:00Z
     */
    static final long J2000_EPOCH_MS = 946_728_000_000L;
    static final double JULIAN_YEAR_MS = 31_557_600_000.0;
    static final double POLARIS_RA_J2000_DEG = 37.946;
    static final double POLARIS_RA_DRIFT_DEG_PER_YEAR = 0.3337;

    private PolarisClock() {
    }

    public static PolarisReading calculate(double longitude, Instant time) {
        long epochMs = time.toEpochMilli();
        double lst = localSiderealTime(longitude, epochMs);
        double hourAngle = hourAngleHours(lst, polarisRightAscension(epochMs));
        return new PolarisReading(lst, hourAngle, clockHours(hourAngle));
    }

    /**
     * @return the local sidereal time in degrees within [0, 360)
     */
    public static double localSiderealTime(double longitude, long epochMs) {
        double jd = epochMs / 86_400_000.0 + 2_440_587.5;
        double t = (jd - 2_451_545.0) / 36_525.0;
        double gmst = 280.46061837 + 360.98564736629 * (jd - 2_451_545.0)
                      + 0.000387933 * t * t - t * t * t / 38_710_000.0;
        return normalizeDegrees(gmst + longitude);
    }

    public static double polarisRightAscension(long epochMs) {
        double yearsSinceJ2000 = (epochMs - J2000_EPOCH_MS) / JULIAN_YEAR_MS;
        return POLARIS_RA_J2000_DEG + POLARIS_RA_DRIFT_DEG_PER_YEAR * yearsSinceJ2000;
    }

    /**
     * @return the hour angle in hours within [0, 24)
     */
    public static double hourAngleHours(double localSiderealTime, double rightAscension) {
        return normalizeDegrees(localSiderealTime - rightAscension) / 15.0;
    }

    /**
     * Maps the hour angle onto the 12-hour reticle dial: half the hour angle, mirrored, and turned by 6 hours.
     *
     * @return the dial position in hours within [0, 12)
     */
    public static double clockHours(double hourAngleHours) {
        return floorMod(12.0 - hourAngleHours / 2.0 + 6.0, 12.0);
    }

    public static double normalizeDegrees(double degrees) {
        return floorMod(degrees, 360.0);
    }

    static double floorMod(double value, double modulus) {
        double result = ((value % modulus) + modulus) % modulus;
        return result >= modulus ? 0.0 : result;
    }
}
