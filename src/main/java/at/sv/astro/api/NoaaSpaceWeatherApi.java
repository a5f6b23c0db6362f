package at.sv.astro.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the planetary K-index and the active solar regions from the NOAA Space Weather Prediction Center.
 */
@Slf4j
public final class NoaaSpaceWeatherApi implements SpaceWeatherApi {

    public static final String DEFAULT_ORIGIN = "https://services.swpc.noaa.gov";

    private final HttpResourceProvider httpResourceProvider;
    private final ObjectMapper mapper;
    private final String origin;

    public NoaaSpaceWeatherApi(String origin, HttpResourceProvider httpResourceProvider) {
        this.origin = origin;
        this.httpResourceProvider = httpResourceProvider;
        mapper = new ObjectMapper();
    }

    /**
     * The response is an array of rows, the first one being the header: {@code [["time_tag","Kp",...],
     * ["2025-01-29 12:00:00.000","2.33",...]]}. The K-index is the second column of the last row.
     */
    @Override
    public Double getKpIndex() {
        JsonNode rows = readArray("/products/noaa-planetary-k-index.json");
        if (rows.isEmpty()) {
            return null;
        }
        JsonNode lastRow = rows.get(rows.size() - 1);
        JsonNode value = lastRow.isObject() ? lastRow.path("Kp") : lastRow.path(1);
        return toDouble(value);
    }

    @Override
    public List<SunspotRegion> getSunspotRegions() {
        JsonNode regions = readArray("/json/solar_regions.json");
        String latestDate = "";
        for (JsonNode region : regions) {
            String observedDate = region.path("observed_date").asText("");
            if (observedDate.compareTo(latestDate) > 0) {
                latestDate = observedDate;
            }
        }
        List<SunspotRegion> result = new ArrayList<>();
        for (JsonNode region : regions) {
            if (!latestDate.equals(region.path("observed_date").asText(""))) {
                continue;
            }
            JsonNode latitude = region.path("latitude");
            JsonNode longitude = region.path("longitude");
            JsonNode area = region.path("area");
            if (!latitude.isNumber() || !longitude.isNumber() || !area.isNumber()) {
                log.trace("Skipping region without position or area: {}", region);
                continue;
            }
            result.add(new SunspotRegion(latitude.asDouble(), longitude.asDouble(), area.asInt()));
        }
        return result;
    }

    private JsonNode readArray(String path) {
        String response = httpResourceProvider.getResource(createUrl(path));
        try {
            JsonNode node = mapper.readTree(response);
            if (!node.isArray()) {
                throw new ApiFailure("Expected a JSON array from '" + path + "' but got: " + abbreviate(response));
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new ApiFailure("Failed to parse response '" + abbreviate(response) + "' of '" + path + "': "
                                 + e.getLocalizedMessage(), e);
        }
    }

    private static Double toDouble(JsonNode value) {
        if (value.isNumber()) {
            return value.asDouble();
        }
        if (value.isTextual()) {
            try {
                return Double.parseDouble(value.asText());
            } catch (NumberFormatException e) {
                log.debug("Not a number: '{}'", value.asText());
            }
        }
        return null;
    }

    private static String abbreviate(String response) {
        return response.length() > 150 ? response.substring(0, 150) + "..." : response;
    }

    private URL createUrl(String path) {
        try {
            return new URI(origin + path).toURL();
        } catch (MalformedURLException | URISyntaxException e) {
            throw new IllegalArgumentException("Failed to construct API url", e);
        }
    }
}
