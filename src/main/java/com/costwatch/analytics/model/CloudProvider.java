package com.costwatch.analytics.model;

public enum CloudProvider {
    AWS,
    GCP,
    AZURE,
    ALICLOUD,
    ORACLE
}
