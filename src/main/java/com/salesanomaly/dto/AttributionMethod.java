package com.salesanomaly.dto;

public enum AttributionMethod {
    SHAPLEY_PERMUTATION,
    RULE_BASED
}
