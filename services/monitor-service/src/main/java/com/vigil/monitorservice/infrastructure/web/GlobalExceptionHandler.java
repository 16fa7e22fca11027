package com.vigil.monitorservice.infrastructure.web;

import com.vigil.monitorservice.api.UnknownServiceException;
import java.net.URI;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} responses.
 *
 * <pre>
 * {
 *   "type": "https://vigil.dev/errors/not-found",
 *   "title": "Not Found",
 *   "status": 404,
 *   "detail": "Unknown service: billing-api",
 *   "timestamp": "2026-03-01T10:30:00Z",
 *   "serviceId": "billing-api"
 * }
 * </pre>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(UnknownServiceException.class)
    public ProblemDetail handleUnknownService(UnknownServiceException ex) {
        log.debug("Unknown service requested: {}", ex.serviceId());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, ex.getMessage());
        problem.setTitle("Not Found");
        problem.setType(URI.create("https://vigil.dev/errors/not-found"));
        problem.setProperty("serviceId", ex.serviceId());
        enrich(problem);
        return problem;
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
        problem.setTitle("Bad Request");
        problem.setType(URI.create("https://vigil.dev/errors/bad-request"));
        enrich(problem);
        return problem;
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            // framework errors (unknown route, unsupported method) carry their own status
            log.debug("Request rejected: {}", ex.getMessage());
            ProblemDetail problem = errorResponse.getBody();
            enrich(problem);
            return problem;
        }
        log.error("Internal server error", ex);
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(
                HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred");
        problem.setTitle("Internal Server Error");
        problem.setType(URI.create("https://vigil.dev/errors/internal"));
        enrich(problem);
        return problem;
    }

    private void enrich(ProblemDetail problem) {
        problem.setProperty("timestamp", Instant.now().toString());
    }
}
