package at.sv.astro;

import at.sv.astro.api.GeocodingApi;
import at.sv.astro.api.LocationResult;
import at.sv.astro.api.SpaceWeatherApi;
import at.sv.astro.api.SunspotRegion;
import at.sv.astro.time.PolarisClock;
import at.sv.astro.time.PolarisReading;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Owns the current location and the selected calendar month and keeps the published results in sync with them.
 * <p>
 * Every kind of result has its own {@link ComputationStream}: a new request for the same stream cancels the one in
 * flight, while requests for different streams run independently. Inputs are captured when a request is made, so a
 * computation never observes a location change that happened after it was started.
 */
@Slf4j
public final class AstroCoordinator implements AutoCloseable {

    private final DailyAstroCalculator dailyCalculator;
    private final CalendarAggregator calendarAggregator;
    private final SpaceWeatherApi spaceWeatherApi;
    private final GeocodingApi geocodingApi;
    private final Supplier<ZonedDateTime> currentTime;

    private final AtomicReference<Location> location;
    private final AtomicReference<YearMonth> calendarMonth;
    /**
     * Guards reading the inputs together with submitting the computation for them, so the last request also submits
     * last.
     */
    private final Object lock = new Object();

    private final ComputationStream<DailySnapshot> daily;
    private final ComputationStream<MonthTable> calendar;
    private final ComputationStream<Double> kpIndex;
    private final ComputationStream<List<SunspotRegion>> sunspots;
    private final ComputationStream<List<LocationResult>> searchResults;

    public AstroCoordinator(DailyAstroCalculator dailyCalculator, CalendarAggregator calendarAggregator,
                            SpaceWeatherApi spaceWeatherApi, GeocodingApi geocodingApi,
                            Supplier<ZonedDateTime> currentTime, Location initialLocation) {
        this.dailyCalculator = dailyCalculator;
        this.calendarAggregator = calendarAggregator;
        this.spaceWeatherApi = spaceWeatherApi;
        this.geocodingApi = geocodingApi;
        this.currentTime = currentTime;
        location = new AtomicReference<>(initialLocation);
        YearMonth month = YearMonth.from(currentTime.get());
        calendarMonth = new AtomicReference<>(month);
        daily = new ComputationStream<>("daily", null);
        calendar = new ComputationStream<>("calendar", MonthTable.empty(month));
        kpIndex = new ComputationStream<>("kp", null);
        sunspots = new ComputationStream<>("sunspots", List.of());
        searchResults = new ComputationStream<>("search", List.of());
    }

    /**
     * Computes the daily snapshot of today and the calendar of the current month.
     */
    public void start() {
        log.info("Starting for {}", location.get());
        calculateDaily();
        computeCalendar();
    }

    /**
     * Replaces the location and recomputes the daily snapshot of today and the selected calendar month for it. Any
     * computation still running for the previous location is cancelled and will not publish.
     */
    public void updateLocation(Location newLocation) {
        LocalDate today = today();
        synchronized (lock) {
            Location previous = location.getAndSet(newLocation);
            log.info("Location changed from {} to {}", previous, newLocation);
            submitDaily(today, newLocation);
            submitCalendar(calendarMonth.get(), newLocation);
        }
    }

    public Future<?> calculateDaily() {
        return calculateDaily(today());
    }

    public Future<?> calculateDaily(LocalDate date) {
        synchronized (lock) {
            return submitDaily(date, location.get());
        }
    }

    private Future<?> submitDaily(LocalDate date, Location at) {
        return daily.submit(date + " at " + at.label(), token -> dailyCalculator.calculate(date, at, token));
    }

    public Future<?> computeCalendar() {
        synchronized (lock) {
            return submitCalendar(calendarMonth.get(), location.get());
        }
    }

    public Future<?> computeCalendar(YearMonth month) {
        synchronized (lock) {
            calendarMonth.set(month);
            return submitCalendar(month, location.get());
        }
    }

    private Future<?> submitCalendar(YearMonth month, Location at) {
        return calendar.submit(month + " at " + at.label(), token -> calendarAggregator.aggregate(month, at, token));
    }

    public Future<?> previousMonth() {
        synchronized (lock) {
            return navigateTo(calendarMonth.get().minusMonths(1));
        }
    }

    public Future<?> nextMonth() {
        synchronized (lock) {
            return navigateTo(calendarMonth.get().plusMonths(1));
        }
    }

    /**
     * Shows an empty table for the new month until its days are computed.
     */
    private Future<?> navigateTo(YearMonth month) {
        calendarMonth.set(month);
        calendar.replace(MonthTable.empty(month));
        return submitCalendar(month, location.get());
    }

    public PolarisReading getPolarisReading() {
        return PolarisClock.calculate(location.get().longitude(), currentTime.get().toInstant());
    }

    public Future<?> refreshKpIndex() {
        return kpIndex.submit("Kp index", token -> spaceWeatherApi.getKpIndex());
    }

    public Future<?> refreshSunspots() {
        return sunspots.submit("sunspot regions", token -> spaceWeatherApi.getSunspotRegions());
    }

    /**
     * @return the future of the search, or null if the query is blank and nothing was searched
     */
    public Future<?> searchLocation(String query) {
        if (query == null || query.isBlank()) {
            log.debug("Ignoring blank location search");
            return null;
        }
        String trimmed = query.trim();
        return searchResults.submit("search '" + trimmed + "'", token -> geocodingApi.search(trimmed));
    }

    public void clearLocationSearch() {
        searchResults.replace(List.of());
    }

    private LocalDate today() {
        return currentTime.get().toLocalDate();
    }

    public Location getLocation() {
        return location.get();
    }

    public YearMonth getCalendarMonth() {
        return calendarMonth.get();
    }

    public DailySnapshot getDailySnapshot() {
        return daily.getValue();
    }

    public MonthTable getMonthTable() {
        return calendar.getValue();
    }

    public Double getKpIndex() {
        return kpIndex.getValue();
    }

    public List<SunspotRegion> getSunspotRegions() {
        return sunspots.getValue();
    }

    public List<LocationResult> getSearchResults() {
        return searchResults.getValue();
    }

    public boolean isDailyLoading() {
        return daily.isLoading();
    }

    public boolean isCalendarLoading() {
        return calendar.isLoading();
    }

    public boolean isSpaceWeatherLoading() {
        return kpIndex.isLoading() || sunspots.isLoading();
    }

    public boolean isSearching() {
        return searchResults.isLoading();
    }

    public void subscribeDaily(Consumer<? super DailySnapshot> subscriber) {
        daily.subscribe(subscriber);
    }

    public void subscribeCalendar(Consumer<? super MonthTable> subscriber) {
        calendar.subscribe(subscriber);
    }

    long getDailyVersion() {
        return daily.getVersion();
    }

    long getCalendarVersion() {
        return calendar.getVersion();
    }

    @Override
    public void close() {
        daily.close();
        calendar.close();
        kpIndex.close();
        sunspots.close();
        searchResults.close();
    }
}
