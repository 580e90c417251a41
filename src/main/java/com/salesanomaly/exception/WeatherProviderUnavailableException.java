package com.salesanomaly.exception;

public class WeatherProviderUnavailableException extends SalesAnomalyException {
    public WeatherProviderUnavailableException(String message) {
        super("WEATHER_PROVIDER_UNAVAILABLE", message);
    }
    public WeatherProviderUnavailableException(Throwable cause) {
        super("WEATHER_PROVIDER_UNAVAILABLE",
              "The weather provider is currently unavailable.",
              cause);
    }
}
