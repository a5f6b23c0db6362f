package at.sv.astro.moon;

import at.sv.astro.Location;

import java.time.ZonedDateTime;

/**
 * Approximates the illuminated fraction of the moon's disk.
 */
public interface IlluminationModel {

    /**
     * @return the illumination in percent within [0, 100]
     */
    int illuminationPercent(ZonedDateTime time, Location location);
}
