package com.salesanomaly.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

@Value
@Builder
public class PipelineReport {
    Long restaurantId;
    String restaurantName;
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate fromDate;
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate toDate;
    AttributionMethod method;
    ModelQuality modelQuality;
    int daysScanned;
    List<AttributionResult> results;
    List<String> warnings;
}
