package com.flowhouse.query;

import com.flowhouse.domain.DictionaryBinding;
import com.flowhouse.schema.FieldResolver;
import com.flowhouse.schema.ResolutionException;
import com.flowhouse.schema.SchemaCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for FlowQueryBuilder
 */
@DisplayName("FlowQueryBuilder Tests")
class FlowQueryBuilderTest {

    private static final String START = "2024-01-01T10:00";
    private static final String END = "2024-01-01T11:00";

    private FlowQueryBuilder builder;

    @BeforeEach
    void setUp() {
        SchemaCatalog catalog = SchemaCatalog.forFlows(List.of(
            new DictionaryBinding("src_asn", "asn_names", "toUInt64(%s)", List.of())));
        builder = new FlowQueryBuilder(new FieldResolver(catalog), "flowhouse", "+02:00", 10);
    }

    @Test
    @DisplayName("Should build a single-field breakdown with bound time range")
    void shouldBuildSingleFieldBreakdown() {
        // Given
        FlowQueryRequest request = new FlowQueryRequest(List.of("src_asn"), START, END, Map.of());

        // When
        BuiltQuery query = builder.build(request);

        // Then
        assertThat(query.getSql()).isEqualTo(
            "SELECT timestamp AS t, src_asn AS src_asn, sum(size * samplerate) * 8 / 10 "
                + "FROM flowhouse.flows WHERE t BETWEEN toDateTime(?) AND toDateTime(?) "
                + "GROUP BY t, src_asn ORDER BY t");
        assertThat(query.getParameters()).containsExactly(1704096000L, 1704099600L);
        assertThat(query.getBreakdownFields()).containsExactly("src_asn");
        assertThat(query.hasWarnings()).isFalse();
    }

    @Test
    @DisplayName("Should keep breakdown order in select and group by")
    void shouldKeepBreakdownOrder() {
        FlowQueryRequest request = new FlowQueryRequest(
            List.of("dst_port", "src_ip_pfx", "src_asn__name"), START, END, Map.of());

        BuiltQuery query = builder.build(request);

        assertThat(query.getSql())
            .contains("SELECT timestamp AS t, dst_port AS dst_port, "
                + "concat(IPv6NumToString(src_ip_pfx_addr), '/', toString(src_ip_pfx_len)) AS src_ip_pfx, "
                + "dictGet('asn_names', 'name', toUInt64(src_asn)) AS src_asn__name, "
                + "sum(size * samplerate) * 8 / 10 FROM")
            .endsWith("GROUP BY t, dst_port, src_ip_pfx, src_asn__name ORDER BY t");
        assertThat(query.getBreakdownFields()).containsExactly("dst_port", "src_ip_pfx", "src_asn__name");
    }

    @Test
    @DisplayName("Should bind filter values as parameters")
    void shouldBindFilterValues() {
        Map<String, List<String>> filters = new LinkedHashMap<>();
        filters.put("ip_protocol", List.of("6"));
        filters.put("dst_port", List.of("80", "443"));
        filters.put("src_asn__name", List.of("EXAMPLE-AS"));
        FlowQueryRequest request = new FlowQueryRequest(List.of("src_asn"), START, END, filters);

        BuiltQuery query = builder.build(request);

        assertThat(query.getSql()).contains(
            "WHERE t BETWEEN toDateTime(?) AND toDateTime(?) "
                + "AND ip_protocol = ? "
                + "AND dst_port IN (?, ?) "
                + "AND dictGet('asn_names', 'name', toUInt64(src_asn)) = ? GROUP BY");
        assertThat(query.getParameters())
            .containsExactly(1704096000L, 1704099600L, "6", "80", "443", "EXAMPLE-AS");
        assertThat(query.getSql()).doesNotContain("EXAMPLE-AS");
    }

    @Test
    @DisplayName("Should never interpolate filter values into the statement")
    void shouldNotInterpolateHostileFilterValues() {
        FlowQueryRequest request = new FlowQueryRequest(
            List.of("src_asn"), START, END, Map.of("src_ip_addr", List.of("'; DROP TABLE flows; --")));

        BuiltQuery query = builder.build(request);

        assertThat(query.getSql()).doesNotContain("DROP").contains("src_ip_addr = ?");
        assertThat(query.getParameters()).contains("'; DROP TABLE flows; --");
    }

    @Test
    @DisplayName("Should drop unresolvable breakdown fields from select and group by")
    void shouldDropUnresolvableBreakdownFields() {
        FlowQueryRequest request = new FlowQueryRequest(
            List.of("src_asn", "dst_port__service", "bogus"), START, END, Map.of());

        BuiltQuery query = builder.build(request);

        assertThat(query.getSql()).doesNotContain("dst_port").doesNotContain("bogus");
        assertThat(query.getSql()).contains("GROUP BY t, src_asn ORDER BY t");
        assertThat(query.getBreakdownFields()).containsExactly("src_asn");
        assertThat(query.getWarnings()).extracting(ResolutionWarning::getField)
            .containsExactly("dst_port__service", "bogus");
        assertThat(query.getWarnings()).extracting(ResolutionWarning::getReason)
            .containsExactly(ResolutionException.Reason.MISSING_DICTIONARY, ResolutionException.Reason.UNKNOWN_FIELD);
        assertThat(query.getWarnings()).extracting(ResolutionWarning::getRole)
            .containsOnly(ResolutionWarning.Role.BREAKDOWN);
    }

    @Test
    @DisplayName("Should drop unresolvable filters with their values")
    void shouldDropUnresolvableFilters() {
        Map<String, List<String>> filters = new LinkedHashMap<>();
        filters.put("dst_asn__name", List.of("x"));
        filters.put("dst_port", List.of("53"));
        FlowQueryRequest request = new FlowQueryRequest(List.of("src_asn"), START, END, filters);

        BuiltQuery query = builder.build(request);

        assertThat(query.getSql()).doesNotContain("dst_asn").contains("AND dst_port = ?");
        assertThat(query.getParameters()).containsExactly(1704096000L, 1704099600L, "53");
        assertThat(query.getWarnings()).singleElement().satisfies(warning -> {
            assertThat(warning.getField()).isEqualTo("dst_asn__name");
            assertThat(warning.getRole()).isEqualTo(ResolutionWarning.Role.FILTER);
        });
    }

    @Test
    @DisplayName("Should still query with only the bucket when every breakdown field is dropped")
    void shouldBuildWhenAllBreakdownFieldsDropped() {
        FlowQueryRequest request = new FlowQueryRequest(List.of("bogus"), START, END, Map.of());

        BuiltQuery query = builder.build(request);

        assertThat(query.getSql()).startsWith("SELECT timestamp AS t, sum(size * samplerate) * 8 / 10 FROM");
        assertThat(query.getSql()).endsWith("GROUP BY t ORDER BY t");
        assertThat(query.getBreakdownFields()).isEmpty();
    }

    @Test
    @DisplayName("Should reject a request without breakdown")
    void shouldRejectMissingBreakdown() {
        assertThatThrownBy(() -> builder.build(new FlowQueryRequest(null, START, END, Map.of())))
            .isInstanceOf(QueryValidationException.class)
            .extracting(e -> ((QueryValidationException) e).getReason())
            .isEqualTo(QueryValidationException.Reason.MISSING_BREAKDOWN);

        assertThatThrownBy(() -> builder.build(new FlowQueryRequest(List.of(), START, END, Map.of())))
            .isInstanceOf(QueryValidationException.class)
            .extracting(e -> ((QueryValidationException) e).getReason())
            .isEqualTo(QueryValidationException.Reason.MISSING_BREAKDOWN);
    }

    @Test
    @DisplayName("Should reject missing or malformed time bounds")
    void shouldRejectBadTimeBounds() {
        assertThatThrownBy(() -> builder.build(new FlowQueryRequest(List.of("src_asn"), null, END, Map.of())))
            .extracting(e -> ((QueryValidationException) e).getReason())
            .isEqualTo(QueryValidationException.Reason.MISSING_START_TIME);

        assertThatThrownBy(() -> builder.build(new FlowQueryRequest(List.of("src_asn"), START, null, Map.of())))
            .extracting(e -> ((QueryValidationException) e).getReason())
            .isEqualTo(QueryValidationException.Reason.MISSING_END_TIME);

        assertThatThrownBy(() -> builder.build(new FlowQueryRequest(List.of("src_asn"), "yesterday", END, Map.of())))
            .extracting(e -> ((QueryValidationException) e).getReason())
            .isEqualTo(QueryValidationException.Reason.TIME_PARSE);

        assertThatThrownBy(() -> builder.build(new FlowQueryRequest(List.of("src_asn"), END, START, Map.of())))
            .extracting(e -> ((QueryValidationException) e).getReason())
            .isEqualTo(QueryValidationException.Reason.INVERTED_TIME_RANGE);
    }

    @Test
    @DisplayName("Should reject calendar dates that do not exist")
    void shouldRejectNonexistentDates() {
        FlowQueryRequest request = new FlowQueryRequest(
            List.of("src_asn"), "2024-02-30T10:00", "2024-02-31T11:00", Map.of());

        assertThatThrownBy(() -> builder.build(request))
            .isInstanceOf(QueryValidationException.class)
            .extracting(e -> ((QueryValidationException) e).getReason())
            .isEqualTo(QueryValidationException.Reason.TIME_PARSE);

        assertThatThrownBy(() -> builder.toEpochSeconds("2023-02-29T10:00"))
            .isInstanceOf(QueryValidationException.class);
        assertThatThrownBy(() -> builder.toEpochSeconds("2024-01-01T24:00"))
            .isInstanceOf(QueryValidationException.class);
        assertThat(builder.toEpochSeconds("2024-02-29T00:00")).isEqualTo(1709157600L);
    }

    @Test
    @DisplayName("Should interpret form times at the configured offset")
    void shouldApplyTimeOffset() {
        FlowQueryBuilder utcBuilder = new FlowQueryBuilder(
            new FieldResolver(SchemaCatalog.forFlows(List.of())), "flowhouse", "+00:00", 60);

        assertThat(utcBuilder.toEpochSeconds("2024-01-01T10:00")).isEqualTo(1704103200L);
        assertThat(builder.toEpochSeconds("2024-01-01T10:00")).isEqualTo(1704096000L);
    }

    @Test
    @DisplayName("Should use the configured bucket length and database")
    void shouldUseConfiguredBucketAndDatabase() {
        FlowQueryBuilder custom = new FlowQueryBuilder(
            new FieldResolver(SchemaCatalog.forFlows(List.of())), "netflow", "+02:00", 60);

        BuiltQuery query = custom.build(new FlowQueryRequest(List.of("agent"), START, END, Map.of()));

        assertThat(query.getSql()).contains("sum(size * samplerate) * 8 / 60 FROM netflow.flows");
    }

    @Test
    @DisplayName("Should refuse an invalid database name")
    void shouldRejectInvalidDatabase() {
        FieldResolver resolver = new FieldResolver(SchemaCatalog.forFlows(List.of()));

        assertThatThrownBy(() -> new FlowQueryBuilder(resolver, "flows; DROP", "+02:00", 10))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new FlowQueryBuilder(resolver, "flowhouse", "+02:00", 0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
