package com.flowhouse.query;

import org.springframework.jdbc.core.ResultSetExtractor;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Folds the rows of a flow aggregate query into a {@link FlowSeries}.
 *
 * Column layout: the first column is the bucket timestamp, the last one the
 * throughput aggregate, and every column in between a breakdown value. Each row
 * contributes one point whose key joins {@code label=value} pairs with {@code ;}
 * in column order, e.g. {@code Src.AS=65001;Dst.Port=443}.
 */
public class FlowSeriesExtractor implements ResultSetExtractor<FlowSeries> {

    static final String KEY_SEPARATOR = ";";

    private final ColumnLabeler labeler;

    public FlowSeriesExtractor(ColumnLabeler labeler) {
        this.labeler = labeler;
    }

    @Override
    public FlowSeries extractData(ResultSet rs) throws SQLException {
        ResultSetMetaData metaData = rs.getMetaData();
        int columnCount = metaData.getColumnCount();
        if (columnCount < 2) {
            throw new QueryExecutionException(
                "Expected bucket and value columns, got " + columnCount + " column(s)");
        }

        // Decode plan for the breakdown columns, fixed before the first row
        List<String> labels = new ArrayList<>();
        List<ColumnKind> kinds = new ArrayList<>();
        for (int i = 2; i < columnCount; i++) {
            String column = metaData.getColumnLabel(i);
            kinds.add(ColumnKind.fromTypeName(column, metaData.getColumnTypeName(i)));
            labels.add(labeler.label(column));
        }

        FlowSeries series = new FlowSeries();
        while (rs.next()) {
            List<String> components = new ArrayList<>(labels.size());
            for (int j = 0; j < labels.size(); j++) {
                Object value = rs.getObject(j + 2);
                components.add(labels.get(j) + "=" + kinds.get(j).render(value));
            }

            long timestamp = toEpochSeconds(rs.getObject(1));
            long value = toUnsignedLong(rs.getObject(columnCount));
            series.add(timestamp, String.join(KEY_SEPARATOR, components), value);
        }

        return series;
    }

    static long toEpochSeconds(Object bucket) {
        if (bucket instanceof Timestamp) {
            return ((Timestamp) bucket).toInstant().getEpochSecond();
        }
        if (bucket instanceof Instant) {
            return ((Instant) bucket).getEpochSecond();
        }
        if (bucket instanceof OffsetDateTime) {
            return ((OffsetDateTime) bucket).toEpochSecond();
        }
        if (bucket instanceof ZonedDateTime) {
            return ((ZonedDateTime) bucket).toEpochSecond();
        }
        if (bucket instanceof LocalDateTime) {
            // The data source is configured to hand out DateTime values in UTC
            return ((LocalDateTime) bucket).toEpochSecond(ZoneOffset.UTC);
        }
        if (bucket instanceof Number) {
            return ((Number) bucket).longValue();
        }
        throw new QueryExecutionException("Unsupported bucket timestamp value: " + bucket);
    }

    /**
     * Widen the aggregate to an unsigned 64-bit count, dropping any fraction
     */
    static long toUnsignedLong(Object value) {
        if (value == null) {
            return 0L;
        }
        if (value instanceof BigInteger) {
            return ((BigInteger) value).longValue();
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).toBigInteger().longValue();
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || d <= 0) {
                return 0L;
            }
            return BigDecimal.valueOf(d).toBigInteger().longValue();
        }
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        throw new QueryExecutionException("Unsupported aggregate value: " + value);
    }
}
