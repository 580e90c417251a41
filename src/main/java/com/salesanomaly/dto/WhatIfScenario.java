package com.salesanomaly.dto;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class WhatIfScenario {
    String name;
    Map<String, Double> overrides;
}
