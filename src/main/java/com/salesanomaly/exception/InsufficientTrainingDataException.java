package com.salesanomaly.exception;

public class InsufficientTrainingDataException extends SalesAnomalyException {
    public InsufficientTrainingDataException(int rows, int required) {
        super("INSUFFICIENT_TRAINING_DATA",
              "Training needs at least " + required + " labeled rows, got " + rows + ".");
    }
}
