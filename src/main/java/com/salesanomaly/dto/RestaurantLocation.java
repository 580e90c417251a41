package com.salesanomaly.dto;

public record RestaurantLocation(double latitude, double longitude, String zone) {
}
