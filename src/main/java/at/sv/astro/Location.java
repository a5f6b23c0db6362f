package at.sv.astro;

import java.util.Locale;
import java.util.Objects;

public record Location(double latitude, double longitude, String label) {

    public static final Location PRAGUE = new Location(50.0755, 14.4378, "Prague, CZ");

    public Location {
        if (latitude < -90 || latitude > 90) {
            throw new IllegalArgumentException("Latitude must be between -90 and 90 degrees: " + latitude);
        }
        if (longitude < -180 || longitude > 180) {
            throw new IllegalArgumentException("Longitude must be between -180 and 180 degrees: " + longitude);
        }
        Objects.requireNonNull(label, "label");
    }

    public String formatCoordinates() {
        return String.format(Locale.ROOT, "%+.6f°,  %+.6f°", latitude, longitude);
    }

    @Override
    public String toString() {
        return label + " (" + latitude + ", " + longitude + ")";
    }
}
