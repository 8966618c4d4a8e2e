package com.loglens.api;

import com.loglens.domain.SiemReport;
import com.loglens.pipeline.BatchReport;
import com.loglens.pipeline.LogAnalysisService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Analysis endpoint
 * POST /api/v1/analysis with {"source": "...", "records": [...]}
 * Returns the report of the submitted batch
 */
@RestController
@RequestMapping("/api/v1")
public class AnalysisController {
    private static final Logger log = LoggerFactory.getLogger(AnalysisController.class);
    
    private static final String DEFAULT_SOURCE = "api-batch";
    
    private final LogAnalysisService analysisService;
    private final Counter requestsReceived;
    private final Counter requestsRejected;
    
    public AnalysisController(LogAnalysisService analysisService, MeterRegistry meterRegistry) {
        this.analysisService = analysisService;
        this.requestsReceived = Counter.builder("loglens.api.requests.received")
            .description("Total analysis requests received")
            .register(meterRegistry);
        this.requestsRejected = Counter.builder("loglens.api.requests.rejected")
            .description("Total analysis requests rejected")
            .register(meterRegistry);
    }
    
    @PostMapping(value = "/analysis", consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<SiemReport> analyze(@RequestBody Mono<AnalysisRequest> body) {
        requestsReceived.increment();
        return body
            .switchIfEmpty(Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, "Missing request body")))
            .flatMap(request -> {
                if (request.getRecords() == null || request.getRecords().isEmpty()) {
                    requestsRejected.increment();
                    return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, "No records to analyse"));
                }
                String source = request.getSource() != null && !request.getSource().isBlank()
                    ? request.getSource() : DEFAULT_SOURCE;
                log.debug("Received analysis request for {} with {} records", source, request.getRecords().size());
                return Mono.<BatchReport>fromCallable(
                        () -> analysisService.analyzeRecords(source, request.getRecords()))
                    .subscribeOn(Schedulers.boundedElastic())
                    .map(BatchReport::getReport);
            })
            .doOnError(error -> log.error("Analysis request failed: {}", error.getMessage()));
    }
}
