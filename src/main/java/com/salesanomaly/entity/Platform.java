package com.salesanomaly.entity;

public enum Platform {
    GRAB,
    GOJEK
}
