package at.sv.astro.api;

import at.sv.astro.Location;

import java.util.Arrays;

public record LocationResult(String displayName, String shortName, double latitude, double longitude) {

    /**
     * @return the first two comma separated parts of the display name, e.g. "Prague, Czechia"
     */
    public static String shortNameOf(String displayName) {
        String[] parts = displayName.split(",");
        return String.join(",", Arrays.asList(parts).subList(0, Math.min(2, parts.length))).trim();
    }

    public Location toLocation() {
        return new Location(latitude, longitude, shortName);
    }
}
