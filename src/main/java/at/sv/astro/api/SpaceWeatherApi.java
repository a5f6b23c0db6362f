package at.sv.astro.api;

import java.util.List;

public interface SpaceWeatherApi {

    /**
     * @return the most recent planetary K-index, or null if the latest entry holds no number
     */
    Double getKpIndex();

    /**
     * @return the sunspot regions of the most recent observation date
     */
    List<SunspotRegion> getSunspotRegions();
}
