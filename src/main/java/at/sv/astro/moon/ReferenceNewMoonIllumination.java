package at.sv.astro.moon;

import at.sv.astro.Location;

import java.time.ZonedDateTime;

/**
 * Illumination derived from the moon's age relative to a fixed reference New Moon, without querying any events.
 */
public final class ReferenceNewMoonIllumination implements IlluminationModel {

    /**
     * 2025-01-29T12:35:00Z
     */
    static final long REFERENCE_NEW_MOON_MS = 1_738_154_100_000L;
    static final double SYNODIC_MONTH_MS = 2_551_442_976.0;

    @Override
    public int illuminationPercent(ZonedDateTime time, Location location) {
        return illuminationPercent(time.toInstant().toEpochMilli());
    }

    public static int illuminationPercent(long epochMs) {
        long synodic = (long) SYNODIC_MONTH_MS;
        long age = Math.floorMod(epochMs - REFERENCE_NEW_MOON_MS, synodic);
        double illumination = (1 - Math.cos(age / SYNODIC_MONTH_MS * 2 * Math.PI)) / 2 * 100;
        return PhaseResolver.clampPercent(Math.round(illumination));
    }
}
