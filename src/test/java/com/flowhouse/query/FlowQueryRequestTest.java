package com.flowhouse.query;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for FlowQueryRequest
 */
class FlowQueryRequestTest {

    @Test
    void testFromParameters_SplitsReservedParametersFromFilters() {
        Map<String, List<String>> parameters = new LinkedHashMap<>();
        parameters.put("breakdown", List.of("src_asn", "dst_port"));
        parameters.put("time_start", List.of("2024-01-01T10:00"));
        parameters.put("time_end", List.of("2024-01-01T11:00"));
        parameters.put("filter_field_0", List.of("dst_port"));
        parameters.put("dst_port", List.of("80", "443"));
        parameters.put("ip_protocol", List.of("6"));
        parameters.put("src_asn", List.of());

        FlowQueryRequest request = FlowQueryRequest.fromParameters(parameters);

        assertThat(request.getBreakdownFields()).containsExactly("src_asn", "dst_port");
        assertThat(request.getTimeStart()).isEqualTo("2024-01-01T10:00");
        assertThat(request.getTimeEnd()).isEqualTo("2024-01-01T11:00");
        assertThat(request.getFilters()).containsOnlyKeys("dst_port", "ip_protocol");
        assertThat(request.getFilters().keySet()).containsExactly("dst_port", "ip_protocol");
        assertThat(request.getFilters().get("dst_port")).containsExactly("80", "443");
    }

    @Test
    void testFromParameters_MissingBreakdownStaysNull() {
        FlowQueryRequest request = FlowQueryRequest.fromParameters(Map.of("time_start", List.of("2024-01-01T10:00")));

        assertThat(request.getBreakdownFields()).isNull();
        assertThat(request.getTimeEnd()).isNull();
        assertThat(request.getFilters()).isEmpty();
    }
}
