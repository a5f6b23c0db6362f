package at.sv.astro.time;

public enum EventKind {
    SUNRISE(Body.SUN),
    SUNSET(Body.SUN),
    SOLAR_NOON(Body.SUN),
    CIVIL_DAWN(Body.SUN),
    NAUTICAL_DAWN(Body.SUN),
    ASTRONOMICAL_DAWN(Body.SUN),
    CIVIL_DUSK(Body.SUN),
    NAUTICAL_DUSK(Body.SUN),
    ASTRONOMICAL_DUSK(Body.SUN),
    GOLDEN_HOUR_DAWN_START(Body.SUN),
    GOLDEN_HOUR_DAWN_END(Body.SUN),
    GOLDEN_HOUR_DUSK_START(Body.SUN),
    GOLDEN_HOUR_DUSK_END(Body.SUN),
    BLUE_HOUR_DAWN_START(Body.SUN),
    BLUE_HOUR_DAWN_END(Body.SUN),
    BLUE_HOUR_DUSK_START(Body.SUN),
    BLUE_HOUR_DUSK_END(Body.SUN),
    MOONRISE(Body.MOON_HORIZON),
    MOONSET(Body.MOON_HORIZON),
    NEW_MOON(Body.MOON_PHASE),
    FIRST_QUARTER(Body.MOON_PHASE),
    FULL_MOON(Body.MOON_PHASE),
    LAST_QUARTER(Body.MOON_PHASE);

    private final Body body;

    EventKind(Body body) {
        this.body = body;
    }

    public boolean isSolar() {
        return body == Body.SUN;
    }

    public boolean isLunarHorizon() {
        return body == Body.MOON_HORIZON;
    }

    public boolean isLunarPhase() {
        return body == Body.MOON_PHASE;
    }

    public boolean isLunar() {
        return isLunarHorizon() || isLunarPhase();
    }

    private enum Body {
        SUN, MOON_HORIZON, MOON_PHASE
    }
}
