package com.costwatch.analytics.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ServiceCostDelta {

    String serviceName;

    double currentCost;

    double previousCost;

    CostDelta delta;
}
