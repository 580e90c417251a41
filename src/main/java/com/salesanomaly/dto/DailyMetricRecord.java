package com.salesanomaly.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.salesanomaly.entity.Platform;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.Map;
import java.util.Set;

@Value
@Builder(toBuilder = true)
public class DailyMetricRecord {
    Long restaurantId;
    String restaurantName;
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate date;
    Map<Platform, Double> salesByPlatform;
    Map<Platform, Integer> ordersByPlatform;
    Set<Platform> reportingPlatforms;
    Double rating;
    int cancelledOrders;
    OperationalFlags operationalFlags;
    double marketingSpend;
    double marketingAttributedSales;
    Double prepTime;
    Double deliveryTime;

    double totalSales;
    int totalOrders;
    Double averageOrderValue;
    Double cancellationRate;
    Double roas;
}
