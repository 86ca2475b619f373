package com.flowhouse.query;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Metrics collector for flow query operations
 * Tracks executions, failures, timeouts, latency, result sizes and fields
 * dropped during query building
 */
@Component
public class QueryMetrics {

    @Autowired
    MeterRegistry meterRegistry;

    private Counter queriesExecuted;
    private Counter queriesFailed;
    private Counter queriesTimedOut;
    private Counter queriesRejected;
    private Counter droppedBreakdownFields;
    private Counter droppedFilters;
    private Timer queryExecutionLatency;
    private DistributionSummary resultSize;

    @PostConstruct
    public void init() {
        queriesExecuted = Counter.builder("flowhouse.query.executed")
            .description("Total number of flow queries executed")
            .register(meterRegistry);

        queriesFailed = Counter.builder("flowhouse.query.failed")
            .description("Total number of flow queries that failed")
            .register(meterRegistry);

        queriesTimedOut = Counter.builder("flowhouse.query.timedout")
            .description("Total number of flow queries that timed out")
            .register(meterRegistry);

        queriesRejected = Counter.builder("flowhouse.query.rejected")
            .description("Total number of flow query requests failing validation")
            .register(meterRegistry);

        droppedBreakdownFields = Counter.builder("flowhouse.query.fields.dropped")
            .description("Fields left out of a query because they could not be resolved")
            .tag("role", "breakdown")
            .register(meterRegistry);

        droppedFilters = Counter.builder("flowhouse.query.fields.dropped")
            .description("Fields left out of a query because they could not be resolved")
            .tag("role", "filter")
            .register(meterRegistry);

        queryExecutionLatency = Timer.builder("flowhouse.query.execution.latency")
            .description("Latency of flow query execution including result pivoting")
            .publishPercentiles(0.5, 0.95, 0.99)
            .publishPercentileHistogram()
            .minimumExpectedValue(Duration.ofMillis(10))
            .maximumExpectedValue(Duration.ofSeconds(30))
            .register(meterRegistry);

        resultSize = DistributionSummary.builder("flowhouse.query.result.size")
            .description("Distribution of series sizes (number of data points)")
            .baseUnit("points")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(meterRegistry);
    }

    public void recordQueryExecuted() {
        queriesExecuted.increment();
    }

    public void recordQueryFailed() {
        queriesFailed.increment();
    }

    public void recordQueryTimedOut() {
        queriesTimedOut.increment();
    }

    public void recordQueryRejected() {
        queriesRejected.increment();
    }

    public void recordDroppedField(ResolutionWarning.Role role) {
        if (role == ResolutionWarning.Role.BREAKDOWN) {
            droppedBreakdownFields.increment();
        } else {
            droppedFilters.increment();
        }
    }

    public Timer.Sample startQueryTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordQueryLatency(Timer.Sample sample) {
        sample.stop(queryExecutionLatency);
    }

    public void recordResultSize(long size) {
        resultSize.record(size);
    }

    // Getter methods for testing
    public Counter getQueriesExecuted() {
        return queriesExecuted;
    }

    public Counter getQueriesFailed() {
        return queriesFailed;
    }

    public Counter getQueriesTimedOut() {
        return queriesTimedOut;
    }

    public Counter getQueriesRejected() {
        return queriesRejected;
    }

    public Counter getDroppedBreakdownFields() {
        return droppedBreakdownFields;
    }

    public Counter getDroppedFilters() {
        return droppedFilters;
    }

    public Timer getQueryExecutionLatency() {
        return queryExecutionLatency;
    }

    public DistributionSummary getResultSize() {
        return resultSize;
    }
}
