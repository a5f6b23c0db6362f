package at.sv.astro.moon;

public record PhaseResolution(MoonPhaseName phase, int illuminationPercent) {
}
