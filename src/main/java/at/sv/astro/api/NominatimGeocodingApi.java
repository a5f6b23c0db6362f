package at.sv.astro.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Free-form location search against the OpenStreetMap Nominatim API.
 */
public final class NominatimGeocodingApi implements GeocodingApi {

    public static final String DEFAULT_ORIGIN = "https://nominatim.openstreetmap.org";
    static final int RESULT_LIMIT = 5;

    private final HttpResourceProvider httpResourceProvider;
    private final ObjectMapper mapper;
    private final String origin;

    public NominatimGeocodingApi(String origin, HttpResourceProvider httpResourceProvider) {
        this.origin = origin;
        this.httpResourceProvider = httpResourceProvider;
        mapper = new ObjectMapper();
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public List<LocationResult> search(String query) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        String response = httpResourceProvider.getResource(createUrl(query));
        try {
            List<Place> places = mapper.readValue(response, new TypeReference<List<Place>>() {
            });
            return places.stream()
                         .limit(RESULT_LIMIT)
                         .map(NominatimGeocodingApi::toLocationResult)
                         .toList();
        } catch (JsonProcessingException | NullPointerException | NumberFormatException e) {
            throw new ApiFailure("Failed to parse search response for '" + query + "': " + e.getLocalizedMessage(), e);
        }
    }

    private static LocationResult toLocationResult(Place place) {
        return new LocationResult(place.display_name, LocationResult.shortNameOf(place.display_name),
                Double.parseDouble(place.lat), Double.parseDouble(place.lon));
    }

    private URL createUrl(String query) {
        String encoded = URLEncoder.encode(query, StandardCharsets.UTF_8);
        try {
            return new URI(origin + "/search?q=" + encoded + "&format=json&limit=" + RESULT_LIMIT).toURL();
        } catch (MalformedURLException | URISyntaxException e) {
            throw new IllegalArgumentException("Failed to construct search url", e);
        }
    }

    @Data
    private static final class Place {
        private String display_name;
        private String lat;
        private String lon;
    }
}
