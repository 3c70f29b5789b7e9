package com.costwatch.analytics.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CostTrendTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void serialize_lowercaseToken() throws Exception {
        assertThat(objectMapper.writeValueAsString(CostTrend.INCREASING)).isEqualTo("\"increasing\"");
        assertThat(objectMapper.writeValueAsString(CostTrend.DECREASING)).isEqualTo("\"decreasing\"");
        assertThat(objectMapper.writeValueAsString(CostTrend.STABLE)).isEqualTo("\"stable\"");
    }

    @Test
    void serialize_insideCostDelta() throws Exception {
        CostDelta delta = CostDelta.builder().absolute(5).percentage(5).trend(CostTrend.INCREASING).build();

        assertThat(objectMapper.writeValueAsString(delta)).contains("\"trend\":\"increasing\"");
    }

    @Test
    void deserialize_lowercaseToken() throws Exception {
        assertThat(objectMapper.readValue("\"stable\"", CostTrend.class)).isEqualTo(CostTrend.STABLE);
    }
}
