package com.salesanomaly.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.salesanomaly.dto.RestaurantLocation;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Service
@RequiredArgsConstructor
public class RestaurantLocationService {

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;

    @Value("${datasets.locations-path:classpath:datasets/restaurant-locations.json}")
    private String locationsPath;

    private final Map<String, RestaurantLocation> locations = new ConcurrentHashMap<>();

    @PostConstruct
    void load() {
        Resource resource = resourceLoader.getResource(locationsPath);
        if (!resource.exists()) {
            log.warn("Location dataset not found, all restaurants fall back to the default region | path={}", locationsPath);
            return;
        }
        try (InputStream in = resource.getInputStream()) {
            JsonNode root = objectMapper.readTree(in);
            Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode v = field.getValue();
                if (!v.hasNonNull("latitude") || !v.hasNonNull("longitude")) {
                    log.warn("Skipping location without coordinates | restaurant={}", field.getKey());
                    continue;
                }
                locations.put(normalise(field.getKey()), new RestaurantLocation(
                    v.get("latitude").asDouble(),
                    v.get("longitude").asDouble(),
                    v.hasNonNull("zone") ? v.get("zone").asText() : null));
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read location dataset " + locationsPath, ex);
        }
        log.info("Location dataset loaded | path={} | restaurants={}", locationsPath, locations.size());
    }

    public Optional<RestaurantLocation> resolve(String restaurantName) {
        if (restaurantName == null || restaurantName.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(locations.get(normalise(restaurantName)));
    }

    private String normalise(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
