package com.salesanomaly.dto;

public record WeatherObservation(double temperature, double precipitation, double windSpeed) {
}
