package com.salesanomaly.exception;

public class RestaurantNotFoundException extends SalesAnomalyException {
    public RestaurantNotFoundException(Long restaurantId) {
        super("RESTAURANT_NOT_FOUND", "Restaurant with id '" + restaurantId + "' not found.");
    }
}
