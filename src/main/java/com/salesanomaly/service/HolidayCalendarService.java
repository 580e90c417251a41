package com.salesanomaly.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.salesanomaly.dto.HolidayInfo;
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
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Service
@RequiredArgsConstructor
public class HolidayCalendarService {

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;

    @Value("${datasets.holidays-path:classpath:datasets/holidays.json}")
    private String holidaysPath;

    private final Map<LocalDate, HolidayInfo> holidays = new ConcurrentHashMap<>();

    @PostConstruct
    void load() {
        Resource resource = resourceLoader.getResource(holidaysPath);
        if (!resource.exists()) {
            log.warn("Holiday dataset not found, every day treated as non-holiday | path={}", holidaysPath);
            return;
        }
        try (InputStream in = resource.getInputStream()) {
            JsonNode root = objectMapper.readTree(in);
            Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                parse(field.getKey(), field.getValue());
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read holiday dataset " + holidaysPath, ex);
        }
        log.info("Holiday dataset loaded | path={} | holidays={}", holidaysPath, holidays.size());
    }

    public Optional<HolidayInfo> lookup(LocalDate date) {
        return Optional.ofNullable(holidays.get(date));
    }

    private void parse(String dateText, JsonNode node) {
        LocalDate date;
        try {
            date = LocalDate.parse(dateText);
        } catch (DateTimeParseException ex) {
            log.warn("Skipping holiday with unparseable date | date={}", dateText);
            return;
        }
        String name = node.path("name").asText("Holiday");
        String type = node.hasNonNull("type") ? node.get("type").asText() : node.path("category").asText("observance");
        String category = node.hasNonNull("category") ? node.get("category").asText() : type;
        holidays.put(date, new HolidayInfo(name, category, type));
    }
}
