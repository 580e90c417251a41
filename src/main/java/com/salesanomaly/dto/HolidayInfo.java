package com.salesanomaly.dto;

public record HolidayInfo(String name, String category, String type) {
}
