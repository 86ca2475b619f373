package com.flowhouse.query;

import com.flowhouse.schema.FieldName;
import com.flowhouse.schema.FieldResolver;
import com.flowhouse.schema.ResolutionException;
import com.flowhouse.schema.SchemaCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Builds the ClickHouse aggregate statement for a breakdown query.
 *
 * The generated statement has the shape
 * <pre>
 * SELECT timestamp AS t, &lt;expr&gt; AS &lt;field&gt;, ..., sum(size * samplerate) * 8 / &lt;bucket&gt;
 * FROM &lt;database&gt;.flows
 * WHERE t BETWEEN toDateTime(?) AND toDateTime(?) AND &lt;filters&gt;
 * GROUP BY t, &lt;field&gt;, ...
 * ORDER BY t
 * </pre>
 *
 * The throughput aggregate is always the last selected column and the bucket
 * timestamp always the first; the result pivot relies on both positions.
 * Filter values are always bound parameters. Breakdown fields and filters that
 * cannot be resolved are dropped and reported as {@link ResolutionWarning}s.
 */
@Component
public class FlowQueryBuilder {

    private static final Logger logger = LoggerFactory.getLogger(FlowQueryBuilder.class);

    public static final String BUCKET_ALIAS = "t";

    private static final DateTimeFormatter TIME_FIELD_FORMATTER = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm")
        .withResolverStyle(ResolverStyle.STRICT);

    private final FieldResolver fieldResolver;
    private final String database;
    private final ZoneOffset timeOffset;
    private final int bucketSeconds;

    public FlowQueryBuilder(
            FieldResolver fieldResolver,
            @Value("${flowhouse.clickhouse.database:flowhouse}") String database,
            @Value("${flowhouse.query.time-offset:+02:00}") String timeOffset,
            @Value("${flowhouse.query.bucket-seconds:10}") int bucketSeconds) {
        if (!FieldName.isIdentifier(database)) {
            throw new IllegalArgumentException("Invalid database name: " + database);
        }
        if (bucketSeconds <= 0) {
            throw new IllegalArgumentException("Bucket interval must be positive: " + bucketSeconds);
        }
        this.fieldResolver = fieldResolver;
        this.database = database;
        this.timeOffset = ZoneOffset.of(timeOffset);
        this.bucketSeconds = bucketSeconds;
    }

    /**
     * Build the aggregate statement for a request.
     *
     * @param request the breakdown query
     * @return the statement, its parameters and any dropped fields
     * @throws QueryValidationException if breakdown or time bounds are missing or malformed
     */
    public BuiltQuery build(FlowQueryRequest request) {
        TimeRange timeRange = validate(request);

        List<String> select = new ArrayList<>();
        List<String> groupBy = new ArrayList<>();
        List<String> breakdown = new ArrayList<>();
        List<ResolutionWarning> warnings = new ArrayList<>();

        select.add(SchemaCatalog.TIMESTAMP_COLUMN + " AS " + BUCKET_ALIAS);
        groupBy.add(BUCKET_ALIAS);

        for (String fieldName : request.getBreakdownFields()) {
            try {
                String expression = fieldResolver.resolve(fieldName);
                select.add(expression + " AS " + fieldName);
                groupBy.add(fieldName);
                breakdown.add(fieldName);
            } catch (ResolutionException e) {
                logger.warn("Unable to resolve breakdown field. Ignoring selection: {}", e.getMessage());
                warnings.add(ResolutionWarning.of(e, ResolutionWarning.Role.BREAKDOWN));
            }
        }
        select.add(throughputAggregate());

        List<String> conditions = new ArrayList<>();
        List<Object> parameters = new ArrayList<>();
        conditions.add(BUCKET_ALIAS + " BETWEEN toDateTime(?) AND toDateTime(?)");
        parameters.add(timeRange.getStart());
        parameters.add(timeRange.getEnd());

        for (Map.Entry<String, List<String>> filter : request.getFilters().entrySet()) {
            String expression;
            try {
                expression = fieldResolver.resolve(filter.getKey());
            } catch (ResolutionException e) {
                logger.warn("Unable to resolve filter field. Ignoring condition: {}", e.getMessage());
                warnings.add(ResolutionWarning.of(e, ResolutionWarning.Role.FILTER));
                continue;
            }

            List<String> values = filter.getValue();
            if (values.size() == 1) {
                conditions.add(expression + " = ?");
            } else {
                conditions.add(expression + " IN (" + String.join(", ", Collections.nCopies(values.size(), "?")) + ")");
            }
            parameters.addAll(values);
        }

        String sql = String.format("SELECT %s FROM %s.%s WHERE %s GROUP BY %s ORDER BY %s",
            String.join(", ", select),
            database,
            SchemaCatalog.FLOWS_TABLE,
            String.join(" AND ", conditions),
            String.join(", ", groupBy),
            BUCKET_ALIAS);

        logger.debug("Built flow query: {} with parameters {}", sql, parameters);
        return new BuiltQuery(sql, parameters, breakdown, warnings);
    }

    /**
     * Sum of sampled bytes as bits per second over one bucket
     */
    private String throughputAggregate() {
        return "sum(size * samplerate) * 8 / " + bucketSeconds;
    }

    private TimeRange validate(FlowQueryRequest request) {
        if (request.getBreakdownFields() == null || request.getBreakdownFields().isEmpty()) {
            throw new QueryValidationException(QueryValidationException.Reason.MISSING_BREAKDOWN, "No breakdown set");
        }
        if (request.getTimeStart() == null) {
            throw new QueryValidationException(QueryValidationException.Reason.MISSING_START_TIME, "No start time given");
        }
        if (request.getTimeEnd() == null) {
            throw new QueryValidationException(QueryValidationException.Reason.MISSING_END_TIME, "No end time given");
        }

        long start = toEpochSeconds(request.getTimeStart());
        long end = toEpochSeconds(request.getTimeEnd());
        if (start > end) {
            throw new QueryValidationException(QueryValidationException.Reason.INVERTED_TIME_RANGE,
                String.format("Start time %s is after end time %s", request.getTimeStart(), request.getTimeEnd()));
        }
        return new TimeRange(start, end);
    }

    /**
     * Convert a form timestamp ({@code yyyy-MM-ddTHH:mm}, local wall clock) to epoch seconds
     */
    long toEpochSeconds(String value) {
        try {
            return LocalDateTime.parse(value, TIME_FIELD_FORMATTER).toEpochSecond(timeOffset);
        } catch (DateTimeParseException e) {
            throw new QueryValidationException(QueryValidationException.Reason.TIME_PARSE,
                String.format("Unable to parse time %s", value), e);
        }
    }
}
