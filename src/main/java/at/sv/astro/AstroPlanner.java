package at.sv.astro;

import at.sv.astro.api.GeomagneticActivity;
import at.sv.astro.api.HttpResourceProviderImpl;
import at.sv.astro.api.LocationResult;
import at.sv.astro.api.NoaaSpaceWeatherApi;
import at.sv.astro.api.NominatimGeocodingApi;
import at.sv.astro.api.SunspotRegion;
import at.sv.astro.moon.IlluminationModel;
import at.sv.astro.moon.PhaseResolver;
import at.sv.astro.moon.PhaseWindowIllumination;
import at.sv.astro.moon.ReferenceNewMoonIllumination;
import at.sv.astro.time.EventKind;
import at.sv.astro.time.SunCalcEventSource;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintStream;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

@Command(name = "AstroPlanner", version = "0.1.0", mixinStandardHelpOptions = true, sortOptions = false)
public final class AstroPlanner implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(AstroPlanner.class);
    private static final String USER_AGENT = "AstroPlanner/1.0";
    private static final Set<EventKind> HEADLINE_EVENTS = EnumSet.of(EventKind.SUNRISE, EventKind.SOLAR_NOON,
            EventKind.SUNSET, EventKind.MOONRISE, EventKind.MOONSET);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Option(names = "--lat",
            defaultValue = "${env:LAT:-50.0755}",
            description = "The latitude of your location in degrees [-90..90]. Default: ${DEFAULT-VALUE}")
    double latitude;
    @Option(names = "--long",
            defaultValue = "${env:LONG:-14.4378}",
            description = "The longitude of your location in degrees [-180..180]. Default: ${DEFAULT-VALUE}")
    double longitude;
    @Option(names = "--label", paramLabel = "<name>",
            defaultValue = "${env:LOCATION_LABEL:-Prague, CZ}",
            description = "The display name of your location. Default: ${DEFAULT-VALUE}")
    String label;
    @Option(names = "--elevation", paramLabel = "<meters>",
            defaultValue = "${env:ELEVATION:-0.0}",
            description = "The optional elevation (in meters) of your location, " +
                          "used to provide more accurate sunrise and sunset times. Default: ${DEFAULT-VALUE}")
    double elevation;
    @Option(names = "--date", paramLabel = "<yyyy-MM-dd>",
            description = "The day of the daily overview. Default: today")
    String dateString;
    @Option(names = "--month", paramLabel = "<yyyy-MM>",
            description = "The month of the calendar. Default: the current month")
    String monthString;
    @Option(names = "--calendar-illumination", paramLabel = "<model>",
            defaultValue = "${env:CALENDAR_ILLUMINATION:-phase-window}",
            description = "How the calendar computes the moon illumination: 'phase-window' uses the surrounding moon " +
                          "phases, 'reference-epoch' counts synodic months from a fixed New Moon. Default: ${DEFAULT-VALUE}")
    String calendarIllumination;
    @Option(names = "--space-weather",
            description = "Also fetch the current Kp index and the active sunspot regions from NOAA.")
    boolean spaceWeather;
    @Option(names = "--search", paramLabel = "<query>",
            description = "Search for a location by name and use the best match instead of --lat and --long.")
    String searchQuery;

    private final PrintStream out;

    public AstroPlanner() {
        this(System.out);
    }

    AstroPlanner(PrintStream out) {
        this.out = out;
    }

    public static void main(String[] args) {
        int execute = new CommandLine(new AstroPlanner()).execute(args);
        if (execute != 0) {
            System.exit(execute);
        }
    }

    @Override
    public void run() {
        MDC.put("context", "init");
        assertConfigurationParameters();
        ZoneId zone = ZoneId.systemDefault();
        LocalDate date = parseDate();
        YearMonth month = parseMonth();
        SunCalcEventSource eventSource = new SunCalcEventSource(elevation);
        PhaseResolver phaseResolver = new PhaseResolver(eventSource);
        OkHttpClient httpClient = HttpResourceProviderImpl.createHttpClient(USER_AGENT);
        HttpResourceProviderImpl resourceProvider = new HttpResourceProviderImpl(httpClient);
        try (AstroCoordinator coordinator = new AstroCoordinator(
                new DailyAstroCalculator(eventSource, phaseResolver, zone),
                new CalendarAggregator(eventSource, createIlluminationModel(phaseResolver), zone),
                new NoaaSpaceWeatherApi(NoaaSpaceWeatherApi.DEFAULT_ORIGIN, resourceProvider),
                new NominatimGeocodingApi(NominatimGeocodingApi.DEFAULT_ORIGIN, resourceProvider),
                () -> ZonedDateTime.now(zone),
                new Location(latitude, longitude, label))) {
            if (searchQuery != null) {
                searchAndSelect(coordinator);
            }
            await(coordinator.calculateDaily(date));
            await(coordinator.computeCalendar(month));
            if (spaceWeather) {
                await(coordinator.refreshKpIndex());
                await(coordinator.refreshSunspots());
            }
            print(coordinator);
        } finally {
            httpClient.dispatcher().executorService().shutdown();
            httpClient.connectionPool().evictAll();
        }
    }

    private void assertConfigurationParameters() {
        if (latitude < -90 || latitude > 90) {
            fail("--lat must be between -90 and 90 degrees");
        }
        if (longitude < -180 || longitude > 180) {
            fail("--long must be between -180 and 180 degrees");
        }
        if (label == null || label.isBlank()) {
            fail("--label must be non-empty");
        }
        if (!calendarIllumination.equals("phase-window") && !calendarIllumination.equals("reference-epoch")) {
            fail("--calendar-illumination must be either 'phase-window' or 'reference-epoch'");
        }
        if (searchQuery != null && searchQuery.isBlank()) {
            fail("--search must be non-empty");
        }
    }

    private LocalDate parseDate() {
        if (dateString == null) {
            return LocalDate.now();
        }
        try {
            return LocalDate.parse(dateString);
        } catch (DateTimeParseException e) {
            fail("--date must be formatted as yyyy-MM-dd: " + dateString);
            return null;
        }
    }

    private YearMonth parseMonth() {
        if (monthString == null) {
            return YearMonth.now();
        }
        try {
            return YearMonth.parse(monthString);
        } catch (DateTimeParseException e) {
            fail("--month must be formatted as yyyy-MM: " + monthString);
            return null;
        }
    }

    private void fail(String msg) {
        if (spec != null) {
            throw new CommandLine.ParameterException(spec.commandLine(), msg);
        }
        throw new IllegalArgumentException(msg);
    }

    private IlluminationModel createIlluminationModel(PhaseResolver phaseResolver) {
        if (calendarIllumination.equals("reference-epoch")) {
            return new ReferenceNewMoonIllumination();
        }
        return new PhaseWindowIllumination(phaseResolver);
    }

    private void searchAndSelect(AstroCoordinator coordinator) {
        await(coordinator.searchLocation(searchQuery));
        List<LocationResult> results = coordinator.getSearchResults();
        if (results.isEmpty()) {
            LOG.warn("No location found for '{}', keeping {}", searchQuery, coordinator.getLocation());
            return;
        }
        results.forEach(result -> out.println("Found: " + result.displayName()));
        coordinator.updateLocation(results.get(0).toLocation());
        coordinator.clearLocationSearch();
    }

    private static void await(Future<?> future) {
        if (future == null) {
            return;
        }
        try {
            future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for computation", e);
        } catch (ExecutionException e) {
            LOG.error("Computation failed: {}", e.getCause().getLocalizedMessage(), e.getCause());
        }
    }

    private void print(AstroCoordinator coordinator) {
        Location location = coordinator.getLocation();
        out.println(location.label() + "  " + location.formatCoordinates());
        out.println("  " + FormatUtil.formatDms(location.latitude(), true) + "  "
                    + FormatUtil.formatDms(location.longitude(), false));
        printDaily(coordinator.getDailySnapshot());
        out.println();
        out.println("Polaris: " + coordinator.getPolarisReading());
        printCalendar(coordinator.getMonthTable());
        if (spaceWeather) {
            printSpaceWeather(coordinator);
        }
    }

    private void printDaily(DailySnapshot snapshot) {
        if (snapshot == null) {
            out.println("No daily data available");
            return;
        }
        out.println();
        out.println(snapshot.getDate());
        out.println("  Sunrise " + snapshot.getSunrise() + "  Solar noon " + snapshot.getSolarNoon()
                    + "  Sunset " + snapshot.getSunset());
        out.println("  Moonrise " + snapshot.getMoonrise() + "  Moonset " + snapshot.getMoonset());
        for (Map.Entry<EventKind, String> entry : snapshot.getTimes().entrySet()) {
            if (!HEADLINE_EVENTS.contains(entry.getKey())) {
                out.printf(Locale.ROOT, "  %-24s %s%n", entry.getKey(), entry.getValue());
            }
        }
        out.println("  Day length               " + snapshot.getDayLength());
        out.println("  Night length             " + snapshot.getNightLength());
        out.println("  Moon                     " + snapshot.getMoonPhaseLabel() + ", " + snapshot.getIllumination());
    }

    private void printCalendar(MonthTable table) {
        out.println();
        out.println(table.month());
        out.println(" Day  Rise   Set    Dawn   Dusk   M-Rise M-Set  Illum");
        table.days().forEach((day, data) -> out.printf(Locale.ROOT, " %3d  %s  %s  %s  %s  %s  %s  %4d%%%n",
                day, data.sunrise(), data.sunset(), data.civilDawn(), data.civilDusk(),
                data.moonrise(), data.moonset(), data.illuminationPercent()));
    }

    private void printSpaceWeather(AstroCoordinator coordinator) {
        out.println();
        Double kp = coordinator.getKpIndex();
        if (kp == null) {
            out.println("Kp index: unavailable");
        } else {
            out.printf(Locale.ROOT, "Kp index: %.2f (%s)%n", kp, GeomagneticActivity.of(kp).getLabel());
        }
        List<SunspotRegion> regions = coordinator.getSunspotRegions();
        out.println("Sunspot regions: " + regions.size());
        regions.forEach(region -> out.printf(Locale.ROOT, "  lat %+.1f  lon %+.1f  area %d%n",
                region.latitude(), region.longitude(), region.areaMicrohemispheres()));
    }
}
