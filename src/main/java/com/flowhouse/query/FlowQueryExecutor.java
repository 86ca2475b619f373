package com.flowhouse.query;

import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.PreparedStatementSetter;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs flow aggregate queries against ClickHouse and pivots the rows into a
 * {@link FlowSeries}.
 *
 * Execution:
 * - The blocking JDBC call runs on Reactor's bounded elastic scheduler
 * - A query running longer than the configured timeout fails the request
 * - Cancelling the subscription (client gone, timeout) cancels the running statement
 * - No retries; any failure surfaces as a {@link QueryExecutionException}
 */
@Service
public class FlowQueryExecutor {

    private static final Logger log = LoggerFactory.getLogger(FlowQueryExecutor.class);

    private final JdbcTemplate clickHouseTemplate;
    private final ColumnLabeler labeler;
    private final QueryMetrics metrics;
    private final Duration timeout;

    public FlowQueryExecutor(
            @Qualifier("clickHouseJdbcTemplate") JdbcTemplate clickHouseTemplate,
            ColumnLabeler labeler,
            QueryMetrics metrics,
            @Value("${flowhouse.query.timeout:30s}") Duration timeout) {
        this.clickHouseTemplate = clickHouseTemplate;
        this.labeler = labeler;
        this.metrics = metrics;
        this.timeout = timeout;
    }

    /**
     * Execute a built query.
     *
     * @param query statement and parameters from {@link FlowQueryBuilder}
     * @return a Mono emitting the pivoted series, or failing with {@link QueryExecutionException}
     */
    public Mono<FlowSeries> execute(BuiltQuery query) {
        InFlightQuery inFlight = new InFlightQuery();

        return Mono.fromCallable(() -> runQuery(query, inFlight))
            .subscribeOn(Schedulers.boundedElastic())
            .doOnCancel(inFlight::cancel)
            .timeout(timeout)
            .doOnSuccess(series -> {
                if (series != null) {
                    metrics.recordQueryExecuted();
                    metrics.recordResultSize(series.size());
                    log.debug("Flow query returned {} points over {} timestamps",
                        series.size(), series.getTimestamps().size());
                }
            })
            .onErrorMap(TimeoutException.class, e -> {
                metrics.recordQueryTimedOut();
                return new QueryExecutionException(
                    String.format("Query timed out after %ds", timeout.getSeconds()), query.getSql(), e);
            })
            .doOnError(error -> {
                metrics.recordQueryFailed();
                log.error("Flow query failed: {}", error.getMessage(), error);
            });
    }

    /**
     * Run the statement on the calling thread.
     *
     * @return the series, or null when the query was cancelled before or while running
     */
    FlowSeries runQuery(BuiltQuery query, InFlightQuery inFlight) {
        if (inFlight.isCancelled()) {
            log.debug("Flow query cancelled before execution");
            return null;
        }

        log.info("Query: {} {}", query.getSql(), query.getParameters());
        Timer.Sample sample = metrics.startQueryTimer();

        PreparedStatementSetter binder = ps -> {
            List<Object> parameters = query.getParameters();
            for (int i = 0; i < parameters.size(); i++) {
                ps.setObject(i + 1, parameters.get(i));
            }
            inFlight.attach(ps);
        };

        try {
            return clickHouseTemplate.query(query.getSql(), binder, new FlowSeriesExtractor(labeler));
        } catch (DataAccessException e) {
            if (inFlight.isCancelled()) {
                // Nobody is subscribed any more
                log.debug("Cancelled flow query ended with: {}", e.getMessage());
                return null;
            }
            throw new QueryExecutionException("Query failed", query.getSql(), e);
        } finally {
            inFlight.detach();
            metrics.recordQueryLatency(sample);
        }
    }

    /**
     * Cancellation state of one query execution.
     *
     * Cancel may arrive before the statement exists, while it runs, or after it
     * finished. A statement attached after cancellation is refused.
     */
    static final class InFlightQuery {

        private final AtomicReference<Statement> statement = new AtomicReference<>();
        private volatile boolean cancelled;

        void cancel() {
            cancelled = true;
            Statement running = statement.get();
            if (running == null) {
                return;
            }
            try {
                running.cancel();
                log.info("Cancelled running flow query");
            } catch (SQLException e) {
                log.warn("Unable to cancel running flow query: {}", e.getMessage());
            }
        }

        void attach(Statement running) throws SQLException {
            statement.set(running);
            if (cancelled) {
                throw new SQLException("Flow query cancelled before execution");
            }
        }

        void detach() {
            statement.set(null);
        }

        boolean isCancelled() {
            return cancelled;
        }
    }
}
