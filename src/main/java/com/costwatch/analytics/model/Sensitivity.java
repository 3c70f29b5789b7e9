package com.costwatch.analytics.model;

public enum Sensitivity {
    LOW,
    MEDIUM,
    HIGH
}
