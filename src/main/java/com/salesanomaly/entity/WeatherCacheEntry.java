package com.salesanomaly.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(name = "weather_cache")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WeatherCacheEntry {

    @Id
    @Column(name = "cache_key", length = 64, updatable = false, nullable = false)
    private String cacheKey;

    private double latitude;
    private double longitude;

    @Column(name = "observation_date", nullable = false)
    private LocalDate observationDate;

    private double temperature;
    private double precipitation;

    @Column(name = "wind_speed")
    private double windSpeed;

    @Column(name = "fetched_at")
    private Instant fetchedAt;
}
