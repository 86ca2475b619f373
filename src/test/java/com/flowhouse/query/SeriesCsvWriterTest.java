package com.flowhouse.query;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for SeriesCsvWriter
 */
@DisplayName("SeriesCsvWriter Tests")
class SeriesCsvWriterTest {

    private final SeriesCsvWriter writer = new SeriesCsvWriter("+00:00");

    private String csv(FlowSeries series) {
        return new String(writer.toCsv(series), StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Should fill absent cells with zero")
    void shouldZeroFillMissingCells() {
        FlowSeries series = new FlowSeries();
        series.add(100, "Src.AS=65001", 10);
        series.add(110, "Src.AS=65002", 20);

        assertThat(csv(series)).isEqualTo(
            "t,Src.AS=65001,Src.AS=65002\n"
                + "1970/01/01 00:01:40,10,0\n"
                + "1970/01/01 00:01:50,0,20\n");
    }

    @Test
    @DisplayName("Should write the same bytes regardless of insertion order")
    void shouldBeDeterministic() {
        FlowSeries first = new FlowSeries();
        first.add(110, "b", 2);
        first.add(100, "a", 1);
        first.add(100, "b", 3);

        FlowSeries second = new FlowSeries();
        second.add(100, "b", 3);
        second.add(100, "a", 1);
        second.add(110, "b", 2);

        assertThat(writer.toCsv(first)).isEqualTo(writer.toCsv(second));
        assertThat(csv(first)).startsWith("t,a,b\n1970/01/01 00:01:40,1,3\n");
    }

    @Test
    @DisplayName("Should write only the header for an empty series")
    void shouldWriteHeaderForEmptySeries() {
        assertThat(csv(new FlowSeries())).isEqualTo("t\n");
    }

    @Test
    @DisplayName("Should format timestamps at the configured offset")
    void shouldApplyOffset() {
        FlowSeries series = new FlowSeries();
        series.add(1704096000L, "k", 1);

        assertThat(new String(new SeriesCsvWriter("+02:00").toCsv(series), StandardCharsets.UTF_8))
            .isEqualTo("t,k\n2024/01/01 10:00:00,1\n");
    }

    @Test
    @DisplayName("Should write values as unsigned and quote keys containing commas")
    void shouldWriteUnsignedValuesAndQuoteKeys() {
        FlowSeries series = new FlowSeries();
        series.add(100, "Src.AS.Name=Example, Inc.", -1L);

        assertThat(csv(series)).isEqualTo(
            "t,\"Src.AS.Name=Example, Inc.\"\n"
                + "1970/01/01 00:01:40,18446744073709551615\n");
    }
}
