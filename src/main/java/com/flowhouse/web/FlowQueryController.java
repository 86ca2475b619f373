package com.flowhouse.web;

import com.flowhouse.query.BuiltQuery;
import com.flowhouse.query.FlowQueryBuilder;
import com.flowhouse.query.FlowQueryExecutor;
import com.flowhouse.query.FlowQueryRequest;
import com.flowhouse.query.QueryMetrics;
import com.flowhouse.query.QueryValidationException;
import com.flowhouse.query.ResolutionWarning;
import com.flowhouse.query.SeriesCsvWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.stream.Collectors;

/**
 * Breakdown query endpoint
 * GET /query?breakdown=src_asn&amp;time_start=2024-01-01T10:00&amp;time_end=2024-01-01T11:00&amp;dst_port=443
 *
 * Responds with the throughput series as CSV. A request without any parameters is
 * the form's initial load and gets an empty 200 response.
 */
@RestController
public class FlowQueryController {
    private static final Logger log = LoggerFactory.getLogger(FlowQueryController.class);

    static final MediaType TEXT_CSV = new MediaType("text", "csv", StandardCharsets.UTF_8);
    static final String DROPPED_FIELDS_HEADER = "X-Flowhouse-Dropped-Fields";

    private final FlowQueryBuilder queryBuilder;
    private final FlowQueryExecutor queryExecutor;
    private final SeriesCsvWriter csvWriter;
    private final QueryMetrics metrics;

    public FlowQueryController(
            FlowQueryBuilder queryBuilder,
            FlowQueryExecutor queryExecutor,
            SeriesCsvWriter csvWriter,
            QueryMetrics metrics) {
        this.queryBuilder = queryBuilder;
        this.queryExecutor = queryExecutor;
        this.csvWriter = csvWriter;
        this.metrics = metrics;
    }

    @GetMapping("/query")
    public Mono<ResponseEntity<byte[]>> query(@RequestParam MultiValueMap<String, String> parameters) {
        if (parameters.isEmpty()) {
            return Mono.just(ResponseEntity.ok().build());
        }

        BuiltQuery query;
        try {
            query = queryBuilder.build(FlowQueryRequest.fromParameters(parameters));
        } catch (QueryValidationException e) {
            metrics.recordQueryRejected();
            throw e;
        }
        query.getWarnings().forEach(warning -> metrics.recordDroppedField(warning.getRole()));

        return queryExecutor.execute(query)
            .map(series -> {
                ResponseEntity.BodyBuilder response = ResponseEntity.ok().contentType(TEXT_CSV);
                if (query.hasWarnings()) {
                    response.header(DROPPED_FIELDS_HEADER, query.getWarnings().stream()
                        .map(ResolutionWarning::getField)
                        .collect(Collectors.joining(",")));
                }
                byte[] body = csvWriter.toCsv(series);
                log.debug("Returning {} bytes of CSV for {} series", body.length, series.getKeys().size());
                return response.body(body);
            });
    }
}
