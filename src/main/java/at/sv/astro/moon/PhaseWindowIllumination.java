package at.sv.astro.moon;

import at.sv.astro.Location;
import lombok.RequiredArgsConstructor;

import java.time.ZonedDateTime;

/**
 * Illumination derived from the most recent New Moon found by the {@link PhaseResolver}.
 */
@RequiredArgsConstructor
public final class PhaseWindowIllumination implements IlluminationModel {

    private final PhaseResolver phaseResolver;

    @Override
    public int illuminationPercent(ZonedDateTime time, Location location) {
        return phaseResolver.illuminationPercent(time, location);
    }
}
