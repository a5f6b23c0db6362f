package at.sv.astro.moon;

import at.sv.astro.time.EventKind;

public enum MoonPhaseName {
    NEW_MOON("New Moon"),
    WAXING_CRESCENT("Waxing Crescent"),
    FIRST_QUARTER("First Quarter"),
    WAXING_GIBBOUS("Waxing Gibbous"),
    FULL_MOON("Full Moon"),
    WANING_GIBBOUS("Waning Gibbous"),
    LAST_QUARTER("Last Quarter"),
    WANING_CRESCENT("Waning Crescent"),
    UNKNOWN("Unknown");

    private final String label;

    MoonPhaseName(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * @return the name of the given cardinal phase event
     */
    public static MoonPhaseName of(EventKind phase) {
        return switch (phase) {
            case NEW_MOON -> NEW_MOON;
            case FIRST_QUARTER -> FIRST_QUARTER;
            case FULL_MOON -> FULL_MOON;
            case LAST_QUARTER -> LAST_QUARTER;
            default -> throw new IllegalArgumentException("Not a lunar phase: " + phase);
        };
    }

    /**
     * @return the intermediate phase following the given cardinal phase
     */
    public static MoonPhaseName following(EventKind phase) {
        return switch (phase) {
            case NEW_MOON -> WAXING_CRESCENT;
            case FIRST_QUARTER -> WAXING_GIBBOUS;
            case FULL_MOON -> WANING_GIBBOUS;
            case LAST_QUARTER -> WANING_CRESCENT;
            default -> throw new IllegalArgumentException("Not a lunar phase: " + phase);
        };
    }

    /**
     * @return the intermediate phase preceding the given cardinal phase
     */
    public static MoonPhaseName preceding(EventKind phase) {
        return switch (phase) {
            case NEW_MOON -> WANING_CRESCENT;
            case FIRST_QUARTER -> WAXING_CRESCENT;
            case FULL_MOON -> WAXING_GIBBOUS;
            case LAST_QUARTER -> WANING_GIBBOUS;
            default -> throw new IllegalArgumentException("Not a lunar phase: " + phase);
        };
    }
}
