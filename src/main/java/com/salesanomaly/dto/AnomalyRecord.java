package com.salesanomaly.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder(toBuilder = true)
public class AnomalyRecord {
    Long restaurantId;
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate date;
    double actualSales;
    Double expectedSales;
    Double baselineMean;
    Double baselineStd;
    Double deviationPercent;
    Severity severity;
    int observations;

    public AnomalyRecord withExpectedSales(double expected) {
        return toBuilder().expectedSales(expected).build();
    }
}
