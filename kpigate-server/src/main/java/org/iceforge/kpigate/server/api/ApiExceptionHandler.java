package org.iceforge.kpigate.server.api;

import org.iceforge.kpigate.request.KpiRequestException;
import org.iceforge.kpigate.server.execution.ContractViolationException;
import org.iceforge.kpigate.server.execution.StatementExecutionException;
import org.iceforge.kpigate.server.execution.StatementSubmissionException;
import org.iceforge.kpigate.server.service.StatementServiceNotConfiguredException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps every failure to exactly one JSON error envelope.
 *
 * <ul>
 *   <li>validation: 400, no remote call was made</li>
 *   <li>submission: upstream status mirrored, with the generated SQL</li>
 *   <li>FAILED / CANCELED / TIMED_OUT: 502 with the state</li>
 *   <li>contract violation or anything unexpected: 500, message only</li>
 * </ul>
 */
@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    private static final String INTERNAL_ERROR = "Internal Server Error";

    @ExceptionHandler(KpiRequestException.class)
    public ResponseEntity<KpiApiModels.ErrorResponse> badRequest(KpiRequestException e) {
        return ResponseEntity.badRequest().body(KpiApiModels.ErrorResponse.of(e.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<KpiApiModels.ErrorResponse> unreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest().body(KpiApiModels.ErrorResponse.of("Invalid request body"));
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<KpiApiModels.ErrorResponse> methodNotAllowed(HttpRequestMethodNotSupportedException e) {
        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED).body(KpiApiModels.ErrorResponse.of("Method not allowed"));
    }

    @ExceptionHandler(StatementSubmissionException.class)
    public ResponseEntity<KpiApiModels.ErrorResponse> submissionFailed(StatementSubmissionException e) {
        log.warn("Statement submit rejected status={} msg={}", e.upstreamStatus(), e.remoteMessage());
        return ResponseEntity.status(e.upstreamStatus()).body(new KpiApiModels.ErrorResponse(
                false, "Databricks submit failed", e.remoteMessage(), e.sql(), null, null));
    }

    @ExceptionHandler(StatementExecutionException.class)
    public ResponseEntity<KpiApiModels.ErrorResponse> executionFailed(StatementExecutionException e) {
        log.warn("Statement {} ended in {}", e.statementId(), e.state());
        String error = e.timedOut() ? "Query timed out" : "Query failed";
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(new KpiApiModels.ErrorResponse(
                false, error, e.remoteMessage(), null, e.state().name(), null));
    }

    @ExceptionHandler(StatementServiceNotConfiguredException.class)
    public ResponseEntity<KpiApiModels.ErrorResponse> notConfigured(StatementServiceNotConfiguredException e) {
        log.error(e.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(KpiApiModels.ErrorResponse.of(e.getMessage()));
    }

    @ExceptionHandler(ContractViolationException.class)
    public ResponseEntity<KpiApiModels.ErrorResponse> contractViolation(ContractViolationException e) {
        log.error("Statement service contract violation: {}", e.getMessage());
        return internal(e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<KpiApiModels.ErrorResponse> unexpected(Exception e) {
        log.error("Unhandled API failure", e);
        return internal(e.getMessage());
    }

    private static ResponseEntity<KpiApiModels.ErrorResponse> internal(String details) {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(
                new KpiApiModels.ErrorResponse(false, INTERNAL_ERROR, null, null, null, details));
    }
}
