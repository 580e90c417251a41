package com.salesanomaly.dto;

public enum ModelScope {
    RESTAURANT,
    MARKET
}
