package com.salesanomaly.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder(toBuilder = true)
public class ExternalFactorSnapshot {
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate date;
    double latitude;
    double longitude;
    double temperature;
    double precipitation;
    double windSpeed;
    String holidayName;
    String holidayCategory;
    String holidayType;
    double holidayImpactWeight;
    String zone;
    boolean locationEstimated;
    boolean weatherEstimated;

    public boolean isHoliday() {
        return holidayName != null;
    }
}
