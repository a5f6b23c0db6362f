package at.sv.astro.api;

import java.util.List;

public interface GeocodingApi {

    /**
     * @return up to five matches for the given free-form query
     */
    List<LocationResult> search(String query);
}
