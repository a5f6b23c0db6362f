package at.sv.astro.api;

/**
 * An active region on the solar disk in heliographic degrees, with its area in millionths of the solar hemisphere.
 */
public record SunspotRegion(double latitude, double longitude, int areaMicrohemispheres) {
}
