package com.salesanomaly.service;

import com.salesanomaly.config.AnalysisConfig;
import com.salesanomaly.dto.WeatherObservation;
import com.salesanomaly.entity.WeatherCacheEntry;
import com.salesanomaly.repository.WeatherCacheRepository;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Historical daily weather keyed by rounded coordinates and date. Observed weather never changes,
 * so entries never expire: they are loaded once at startup, added on provider misses and written
 * back to the store by {@link #flush()}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WeatherCacheService {

    private final WeatherCacheRepository repository;
    private final AnalysisConfig config;

    private final ConcurrentHashMap<String, WeatherCacheEntry> entries = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, WeatherCacheEntry> pending = new ConcurrentHashMap<>();

    @PostConstruct
    void load() {
        List<WeatherCacheEntry> stored = repository.findAll();
        stored.forEach(e -> entries.put(e.getCacheKey(), e));
        log.info("Weather cache loaded | entries={}", stored.size());
    }

    @PreDestroy
    void close() {
        flush();
    }

    public Optional<WeatherObservation> get(double latitude, double longitude, LocalDate date) {
        WeatherCacheEntry entry = entries.get(key(latitude, longitude, date));
        if (entry == null) {
            return Optional.empty();
        }
        return Optional.of(new WeatherObservation(entry.getTemperature(), entry.getPrecipitation(), entry.getWindSpeed()));
    }

    public void put(double latitude, double longitude, LocalDate date, WeatherObservation observation) {
        String key = key(latitude, longitude, date);
        entries.compute(key, (k, existing) -> {
            WeatherCacheEntry entry = WeatherCacheEntry.builder()
                .cacheKey(k)
                .latitude(round(latitude))
                .longitude(round(longitude))
                .observationDate(date)
                .temperature(observation.temperature())
                .precipitation(observation.precipitation())
                .windSpeed(observation.windSpeed())
                .fetchedAt(Instant.now())
                .build();
            pending.put(k, entry);
            return entry;
        });
    }

    /**
     * Persists entries added since the last flush, one row per key. A row that fails to save stays
     * pending for the next flush. Returns the number of rows written.
     */
    public int flush() {
        int written = 0;
        for (String key : List.copyOf(pending.keySet())) {
            WeatherCacheEntry entry = pending.remove(key);
            if (entry == null) {
                continue;
            }
            try {
                repository.save(entry);
                written++;
            } catch (DataAccessException ex) {
                pending.putIfAbsent(key, entry);
                log.error("Weather cache write failed | key={} | error={}", key, ex.getMessage(), ex);
            }
        }
        if (written > 0) {
            log.info("Weather cache flushed | written={} | pending={}", written, pending.size());
        }
        return written;
    }

    public String key(double latitude, double longitude, LocalDate date) {
        int scale = config.getEnrichment().getCoordinatePrecision();
        return String.format(Locale.ROOT, "%." + scale + "f:%." + scale + "f:%s", round(latitude), round(longitude), date);
    }

    public int size() {
        return entries.size();
    }

    public int pendingCount() {
        return pending.size();
    }

    private double round(double coordinate) {
        return BigDecimal.valueOf(coordinate)
            .setScale(config.getEnrichment().getCoordinatePrecision(), RoundingMode.HALF_UP)
            .doubleValue();
    }
}
