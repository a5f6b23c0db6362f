package at.sv.astro.api;

/**
 * Classification of the planetary K-index into the NOAA geomagnetic storm scale.
 */
public enum GeomagneticActivity {
    QUIET("Quiet"),
    UNSETTLED("Unsettled"),
    ACTIVE("Active"),
    MINOR_STORM("Minor Storm (G1)"),
    MODERATE_STORM("Moderate Storm (G2)"),
    STRONG_STORM("Strong Storm (G3)"),
    SEVERE_STORM("Severe Storm (G4)"),
    EXTREME_STORM("Extreme Storm (G5)");

    private final String label;

    GeomagneticActivity(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static GeomagneticActivity of(double kp) {
        if (kp < 3) return QUIET;
        if (kp < 4) return UNSETTLED;
        if (kp < 5) return ACTIVE;
        if (kp < 6) return MINOR_STORM;
        if (kp < 7) return MODERATE_STORM;
        if (kp < 8) return STRONG_STORM;
        if (kp < 9) return SEVERE_STORM;
        return EXTREME_STORM;
    }

    public boolean isStorm() {
        return compareTo(MINOR_STORM) >= 0;
    }
}
