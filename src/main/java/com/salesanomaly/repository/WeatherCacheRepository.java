package com.salesanomaly.repository;

import com.salesanomaly.entity.WeatherCacheEntry;
import org.springframework.data.jpa.repository.JpaRepository;

public interface WeatherCacheRepository extends JpaRepository<WeatherCacheEntry, String> {
}
