package com.flowhouse.query;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.SortedSet;

/**
 * Writes a {@link FlowSeries} as CSV.
 *
 * Layout: a header {@code t,<key>,<key>,...} with keys in lexicographic order, then
 * one line per timestamp in ascending order. Missing (timestamp, key) cells are
 * written as {@code 0}. Timestamps are rendered as {@code yyyy/MM/dd HH:mm:ss} at
 * the configured offset. Output depends only on the series content.
 */
@Component
public class SeriesCsvWriter {

    static final String TIME_HEADER = "t";

    private final DateTimeFormatter timestampFormatter;

    public SeriesCsvWriter(@Value("${flowhouse.query.time-offset:+02:00}") String timeOffset) {
        this.timestampFormatter = DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss")
            .withZone(ZoneOffset.of(timeOffset));
    }

    public byte[] toCsv(FlowSeries series) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8)) {
            write(series, writer);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to write CSV", e);
        }
        return out.toByteArray();
    }

    public void write(FlowSeries series, Writer writer) throws IOException {
        SortedSet<String> keys = series.getKeys();

        writer.write(TIME_HEADER);
        for (String key : keys) {
            writer.write(',');
            writer.write(escape(key));
        }
        writer.write('\n');

        for (long timestamp : series.getTimestamps()) {
            writer.write(timestampFormatter.format(Instant.ofEpochSecond(timestamp)));
            for (String key : keys) {
                writer.write(',');
                writer.write(Long.toUnsignedString(series.getValue(timestamp, key)));
            }
            writer.write('\n');
        }
        writer.flush();
    }

    private static String escape(String field) {
        if (field.indexOf(',') < 0 && field.indexOf('"') < 0 && field.indexOf('\n') < 0 && field.indexOf('\r') < 0) {
            return field;
        }
        return '"' + field.replace("\"", "\"\"") + '"';
    }
}
