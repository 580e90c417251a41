package com.salesanomaly.service;

import com.salesanomaly.client.OpenMeteoWeatherClient;
import com.salesanomaly.client.OpenMeteoWeatherClient.HourlyWeather;
import com.salesanomaly.config.AnalysisConfig;
import com.salesanomaly.dto.ExternalFactorSnapshot;
import com.salesanomaly.dto.HolidayInfo;
import com.salesanomaly.dto.RestaurantLocation;
import com.salesanomaly.dto.WeatherObservation;
import com.salesanomaly.entity.Restaurant;
import com.salesanomaly.exception.PipelineCancelledException;
import com.salesanomaly.exception.RestaurantNotFoundException;
import com.salesanomaly.exception.WeatherProviderUnavailableException;
import com.salesanomaly.repository.RestaurantRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

@Slf4j
@Service
@RequiredArgsConstructor
public class ExternalFactorEnrichmentService {

    private final RestaurantRepository restaurantRepository;
    private final RestaurantLocationService locationService;
    private final HolidayCalendarService holidayCalendar;
    private final WeatherCacheService weatherCache;
    private final OpenMeteoWeatherClient weatherClient;
    private final AnalysisWorkerPool workerPool;
    private final AnalysisConfig config;

    public ExternalFactorSnapshot enrich(Long restaurantId, LocalDate date) {
        Restaurant restaurant = restaurantRepository.findById(restaurantId)
            .orElseThrow(() -> new RestaurantNotFoundException(restaurantId));
        try {
            return enrich(restaurant, date);
        } finally {
            weatherCache.flush();
        }
    }

    /**
     * Enriches every date as its own unit on the worker pool. Units not yet started when
     * {@code cancelled} turns true are skipped; the weather cache is flushed either way and a
     * cancelled batch then fails with {@link PipelineCancelledException}.
     */
    public Map<LocalDate, ExternalFactorSnapshot> enrichBatch(Restaurant restaurant, Collection<LocalDate> dates,
                                                              BooleanSupplier cancelled) {
        AtomicInteger completed = new AtomicInteger();
        List<Supplier<ExternalFactorSnapshot>> units = new ArrayList<>(dates.size());
        for (LocalDate date : dates) {
            units.add(() -> {
                if (cancelled.getAsBoolean()) {
                    return null;
                }
                ExternalFactorSnapshot snapshot = enrich(restaurant, date);
                completed.incrementAndGet();
                return snapshot;
            });
        }

        Map<LocalDate, ExternalFactorSnapshot> snapshots = new TreeMap<>();
        try {
            for (ExternalFactorSnapshot snapshot : workerPool.invokeAll(units)) {
                if (snapshot != null) {
                    snapshots.put(snapshot.getDate(), snapshot);
                }
            }
        } finally {
            weatherCache.flush();
        }

        if (completed.get() < dates.size()) {
            log.warn("Enrichment cancelled | restaurant={} | completed={} | total={}",
                restaurant.getName(), completed.get(), dates.size());
            throw new PipelineCancelledException(restaurant.getId(), completed.get(), dates.size());
        }
        log.info("Enrichment finished | restaurant={} | dates={} | cacheSize={}",
            restaurant.getName(), snapshots.size(), weatherCache.size());
        return snapshots;
    }

    ExternalFactorSnapshot enrich(Restaurant restaurant, LocalDate date) {
        AnalysisConfig.Enrichment defaults = config.getEnrichment();
        Optional<RestaurantLocation> resolved = locationService.resolve(restaurant.getName());
        boolean locationEstimated = resolved.isEmpty();
        RestaurantLocation location = resolved.orElseGet(() -> new RestaurantLocation(
            defaults.getDefaultLatitude(), defaults.getDefaultLongitude(), defaults.getDefaultZone()));
        String zone = location.zone() != null ? location.zone() : defaults.getDefaultZone();

        WeatherObservation weather = null;
        boolean weatherEstimated = false;
        Optional<WeatherObservation> cached = weatherCache.get(location.latitude(), location.longitude(), date);
        if (cached.isPresent()) {
            weather = cached.get();
        } else {
            weather = fetchWeather(location, date);
            if (weather == null) {
                weatherEstimated = true;
                weather = new WeatherObservation(defaults.getDefaultTemperature(), 0.0, defaults.getDefaultWindSpeed());
            } else {
                weatherCache.put(location.latitude(), location.longitude(), date, weather);
            }
        }

        ExternalFactorSnapshot.ExternalFactorSnapshotBuilder snapshot = ExternalFactorSnapshot.builder()
            .date(date)
            .latitude(location.latitude())
            .longitude(location.longitude())
            .temperature(weather.temperature())
            .precipitation(weather.precipitation())
            .windSpeed(weather.windSpeed())
            .zone(zone)
            .locationEstimated(locationEstimated)
            .weatherEstimated(weatherEstimated)
            .holidayImpactWeight(0.0);

        Optional<HolidayInfo> holiday = holidayCalendar.lookup(date);
        holiday.ifPresent(h -> snapshot
            .holidayName(h.name())
            .holidayCategory(h.category())
            .holidayType(h.type())
            .holidayImpactWeight(config.holidayWeight(h.category())));
        return snapshot.build();
    }

    private WeatherObservation fetchWeather(RestaurantLocation location, LocalDate date) {
        try {
            Optional<HourlyWeather> hourly = weatherClient
                .fetchHourly(location.latitude(), location.longitude(), date)
                .blockOptional();
            if (hourly.isEmpty() || !hourly.get().isComplete()) {
                log.warn("Weather provider returned incomplete hourly data, using neutral weather | lat={} | lon={} | date={}",
                    location.latitude(), location.longitude(), date);
                return null;
            }
            return toDaily(hourly.get());
        } catch (WeatherProviderUnavailableException ex) {
            log.warn("Weather provider unavailable, using neutral weather | lat={} | lon={} | date={} | cause={}",
                location.latitude(), location.longitude(), date, ex.getMessage());
            return null;
        }
    }

    /** Daily mean temperature, total precipitation and peak wind speed. */
    WeatherObservation toDaily(HourlyWeather hourly) {
        AnalysisConfig.Enrichment defaults = config.getEnrichment();
        double temperature = hourly.temperature().stream().mapToDouble(Double::doubleValue).average()
            .orElse(defaults.getDefaultTemperature());
        double precipitation = hourly.precipitation().stream().mapToDouble(Double::doubleValue).sum();
        double windSpeed = hourly.windSpeed().stream().mapToDouble(Double::doubleValue).max()
            .orElse(defaults.getDefaultWindSpeed());
        return new WeatherObservation(temperature, precipitation, windSpeed);
    }
}
