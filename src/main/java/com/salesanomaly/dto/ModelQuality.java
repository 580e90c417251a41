package com.salesanomaly.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class ModelQuality {
    double r2;
    double meanAbsoluteError;
    int trainingRows;
    int validationRows;
    boolean lowConfidence;
    ModelScope scope;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant trainedAt;
}
