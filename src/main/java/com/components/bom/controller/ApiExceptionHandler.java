package com.components.bom.controller;

import com.components.bom.exception.BomSchemaException;
import com.components.bom.exception.CatalogUnavailableException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;
import java.util.NoSuchElementException;

/**
 * Maps service exceptions to RFC 7807 problem details.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(BomSchemaException.class)
    public ProblemDetail handleSchema(final BomSchemaException ex, final HttpServletRequest request) {
        log.warn("Unusable BOM on {}: {}", request.getRequestURI(), ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Invalid BOM", ex.getMessage(), request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(final IllegalArgumentException ex, final HttpServletRequest request) {
        log.warn("Bad request on {}: {}", request.getRequestURI(), ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage(), request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadable(final HttpMessageNotReadableException ex, final HttpServletRequest request) {
        log.warn("Unreadable request body on {}: {}", request.getRequestURI(), ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "Malformed request body.", request);
    }

    @ExceptionHandler(NoSuchElementException.class)
    public ProblemDetail handleNotFound(final NoSuchElementException ex, final HttpServletRequest request) {
        return problem(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(), request);
    }

    @ExceptionHandler(CatalogUnavailableException.class)
    public ProblemDetail handleCatalogUnavailable(final CatalogUnavailableException ex,
                                                  final HttpServletRequest request) {
        log.warn("Lookup refused on {}: {}", request.getRequestURI(), ex.getMessage());
        return problem(HttpStatus.SERVICE_UNAVAILABLE, "Catalog Unavailable", ex.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(final MethodArgumentNotValidException ex, final HttpServletRequest request) {
        log.warn("Validation failed on {}: {}", request.getRequestURI(), ex.getMessage());
        ProblemDetail detail = problem(HttpStatus.BAD_REQUEST, "Validation failed", null, request);
        List<String> errors = ex.getBindingResult().getFieldErrors().stream()
                .map(ApiExceptionHandler::formatFieldError)
                .toList();
        detail.setProperty("errors", errors);
        return detail;
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleUnhandled(final Exception ex, final HttpServletRequest request) {
        log.error("Unexpected error on {}", request.getRequestURI(), ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "Unexpected error", request);
    }

    private static ProblemDetail problem(final HttpStatus status,
                                         final String title,
                                         final String message,
                                         final HttpServletRequest request) {
        ProblemDetail detail = ProblemDetail.forStatus(status);
        detail.setTitle(title);
        if (message != null) {
            detail.setDetail(message);
        }
        detail.setProperty("path", request.getRequestURI());
        return detail;
    }

    private static String formatFieldError(final FieldError error) {
        return error.getField() + ": " + error.getDefaultMessage();
    }
}
