package com.costwatch.analytics.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * One observation of a cost series. Series handed to the detector must be
 * strictly ascending by timestamp.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class DataPoint {

    Instant timestamp;

    double value;

    @Singular("metadataEntry")
    Map<String, String> metadata;

    public static DataPoint of(Instant timestamp, double value) {
        return DataPoint.builder().timestamp(timestamp).value(value).build();
    }
}
