package com.querylab.search.api;

import com.querylab.search.api.dto.ErrorResponse;
import com.querylab.search.backend.SearchBackendUnavailableException;
import com.querylab.search.experiment.ExperimentConflictException;
import com.querylab.search.experiment.ExperimentNotFoundException;
import com.querylab.search.experiment.ExperimentStateException;
import com.querylab.search.experiment.ExperimentValidationException;
import com.querylab.search.service.InvalidSearchRequestException;
import com.querylab.search.synonym.InvalidExportPathException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({HttpMessageNotReadableException.class, HttpMediaTypeNotSupportedException.class})
    public ResponseEntity<ErrorResponse> handleInvalidBody(Exception ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "bad_request", "Invalid request body", request);
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleInvalidParameter(Exception ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage(), request);
    }

    @ExceptionHandler({
        InvalidSearchRequestException.class,
        ExperimentValidationException.class,
        InvalidExportPathException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(RuntimeException ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage(), request);
    }

    @ExceptionHandler(ExperimentNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ExperimentNotFoundException ex, HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, "not_found", ex.getMessage(), request);
    }

    @ExceptionHandler(ExperimentConflictException.class)
    public ResponseEntity<ErrorResponse> handleConflict(ExperimentConflictException ex, HttpServletRequest request) {
        return respond(HttpStatus.CONFLICT, "conflict", ex.getMessage(), request);
    }

    @ExceptionHandler(ExperimentStateException.class)
    public ResponseEntity<ErrorResponse> handleState(ExperimentStateException ex, HttpServletRequest request) {
        return respond(HttpStatus.CONFLICT, "invalid_state", ex.getMessage(), request);
    }

    @ExceptionHandler(SearchBackendUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleBackend(SearchBackendUnavailableException ex, HttpServletRequest request) {
        log.warn("search backend unavailable path={}: {}", request.getRequestURI(), ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "backend_unavailable", "Search backend is unavailable", request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error(
            "unexpected_exception method={} path={}",
            request == null ? null : request.getMethod(),
            request == null ? null : request.getRequestURI(),
            ex
        );
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "Unexpected error", request);
    }

    private ResponseEntity<ErrorResponse> respond(
        HttpStatus status,
        String code,
        String message,
        HttpServletRequest request
    ) {
        return ResponseEntity.status(status).body(RequestIds.error(code, message, request));
    }
}
