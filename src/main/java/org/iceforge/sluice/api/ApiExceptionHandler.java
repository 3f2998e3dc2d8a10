package org.iceforge.sluice.api;

import org.iceforge.sluice.cache.CacheDirector;
import org.iceforge.sluice.governance.ExportDisabledException;
import org.iceforge.sluice.governance.FacetDisabledException;
import org.iceforge.sluice.governance.GovernanceException;
import org.iceforge.sluice.governance.SqlDisabledException;
import org.iceforge.sluice.jdbc.DatabaseNotFoundException;
import org.iceforge.sluice.query.QueryExecutionException;
import org.iceforge.sluice.query.TableNotFoundException;
import org.iceforge.sluice.query.TimeLimitExceededException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps governance errors to client-facing responses. Policy rejections are permission
 * errors, time limits and bad SQL are client errors; only the unexpected is a 500.
 */
@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(TimeLimitExceededException.class)
    public ResponseEntity<ApiModels.ErrorResponse> timeLimit(TimeLimitExceededException ex) {
        return error(HttpStatus.BAD_REQUEST, "TIME_LIMIT_EXCEEDED", "SQL Interrupted", ex.getMessage());
    }

    @ExceptionHandler(QueryExecutionException.class)
    public ResponseEntity<ApiModels.ErrorResponse> queryError(QueryExecutionException ex) {
        return error(HttpStatus.BAD_REQUEST, "QUERY_ERROR", "Invalid SQL", ex.getMessage());
    }

    @ExceptionHandler(SqlDisabledException.class)
    public ResponseEntity<ApiModels.ErrorResponse> sqlDisabled(SqlDisabledException ex) {
        return error(HttpStatus.FORBIDDEN, "SQL_DISABLED", "SQL disabled", ex.getMessage());
    }

    @ExceptionHandler(FacetDisabledException.class)
    public ResponseEntity<ApiModels.ErrorResponse> facetDisabled(FacetDisabledException ex) {
        return error(HttpStatus.FORBIDDEN, "FACET_DISABLED", "Facets disabled", ex.getMessage());
    }

    @ExceptionHandler(ExportDisabledException.class)
    public ResponseEntity<ApiModels.ErrorResponse> exportDisabled(ExportDisabledException ex) {
        return error(HttpStatus.FORBIDDEN, "EXPORT_DISABLED", "Export disabled", ex.getMessage());
    }

    @ExceptionHandler({DatabaseNotFoundException.class, TableNotFoundException.class})
    public ResponseEntity<ApiModels.ErrorResponse> notFound(RuntimeException ex) {
        return error(HttpStatus.NOT_FOUND, "NOT_FOUND", "Not found", ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiModels.ErrorResponse> badRequest(IllegalArgumentException ex) {
        return error(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", "Invalid request", ex.getMessage());
    }

    @ExceptionHandler(GovernanceException.class)
    public ResponseEntity<ApiModels.ErrorResponse> governance(GovernanceException ex) {
        log.warn("Governance failure: {}", ex.toString());
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "GOVERNANCE_ERROR", "Error", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiModels.ErrorResponse> unexpected(Exception ex) {
        log.error("Unhandled exception", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_SERVER_ERROR", "Error",
                "An unexpected error occurred");
    }

    private static ResponseEntity<ApiModels.ErrorResponse> error(HttpStatus status, String code, String title, String message) {
        return ResponseEntity.status(status)
                .header("Referrer-Policy", CacheDirector.REFERRER_POLICY)
                .body(new ApiModels.ErrorResponse(code, title, message, status.value()));
    }
}
