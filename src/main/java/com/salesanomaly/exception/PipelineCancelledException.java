package com.salesanomaly.exception;

public class PipelineCancelledException extends SalesAnomalyException {
    public PipelineCancelledException(Long restaurantId, int completedUnits, int totalUnits) {
        super("PIPELINE_CANCELLED",
              "Run for restaurant '" + restaurantId + "' cancelled after " + completedUnits + "/" + totalUnits + " units.");
    }
}
