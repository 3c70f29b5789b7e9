package com.costwatch.analytics.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DeltaTotals {

    // Yesterday vs. the day before
    PeriodTotal yesterday;

    // Trailing 7 days (excluding yesterday) vs. the 7 days before that
    PeriodTotal last7Days;

    // Month to date vs. the full previous calendar month
    PeriodTotal thisMonth;
}
