package com.insighthub.report.interfaces.api.error;

import com.insighthub.report.application.exception.UseCaseValidationException;
import com.insighthub.report.domain.exception.BlockTooLargeException;
import com.insighthub.report.domain.exception.DomainException;
import com.insighthub.report.domain.exception.InvalidConfigurationException;
import com.insighthub.report.infrastructure.exception.InfrastructureException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Centralized API-layer exception handler that maps domain/application/infrastructure failures to HTTP responses.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Maps {@link BlockTooLargeException} to a 422 response that names the offending block.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(BlockTooLargeException.class)
    public ResponseEntity<ErrorResponse> handleBlockTooLarge(BlockTooLargeException ex, HttpServletRequest request) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("sectionIndex", ex.getSectionIndex());
        details.put("sectionTitle", ex.getSectionTitle());
        details.put("blockIndex", ex.getBlockIndex());
        details.put("blockHeight", ex.getBlockHeight());
        details.put("usableHeight", ex.getUsableHeight());
        ErrorResponse response = ErrorResponse.of(HttpStatus.UNPROCESSABLE_ENTITY.value(), "BLOCK_TOO_LARGE",
                ex.getMessage(), request.getRequestURI(), details);
        return json(HttpStatus.UNPROCESSABLE_ENTITY, response);
    }

    /**
     * Maps {@link InvalidConfigurationException} to a 400 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(InvalidConfigurationException.class)
    public ResponseEntity<ErrorResponse> handleInvalidConfiguration(InvalidConfigurationException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.BAD_REQUEST, "INVALID_CONFIGURATION");
    }

    /**
     * Maps generic domain validation exceptions to a 400 response.
     *
     * @param ex      thrown domain exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(DomainException.class)
    public ResponseEntity<ErrorResponse> handleDomain(DomainException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.BAD_REQUEST, "DOMAIN_ERROR");
    }

    /**
     * Maps generic use-case validation exceptions to a 400 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(UseCaseValidationException.class)
    public ResponseEntity<ErrorResponse> handleUseCaseValidation(UseCaseValidationException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.BAD_REQUEST, "USE_CASE_VALIDATION_ERROR");
    }

    /**
     * Maps unreadable JSON bodies to a 400 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.BAD_REQUEST, "MALFORMED_REQUEST");
    }

    /**
     * Maps infrastructure exceptions to a 500 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(InfrastructureException.class)
    public ResponseEntity<ErrorResponse> handleInfrastructure(InfrastructureException ex, HttpServletRequest request) {
        log.error("Report rendering failed for {}", request.getRequestURI(), ex);
        return buildResponse(ex, request, HttpStatus.INTERNAL_SERVER_ERROR, "INFRASTRUCTURE_ERROR");
    }

    /**
     * Fallback for unexpected exceptions.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex, HttpServletRequest request) {
        log.error("Unexpected failure for {}", request.getRequestURI(), ex);
        return buildResponse(ex, request, HttpStatus.INTERNAL_SERVER_ERROR, "UNEXPECTED_ERROR");
    }

    /**
     * Central helper that creates a consistent {@link ErrorResponse} envelope.
     *
     * @param error     exception that triggered the handler
     * @param request   incoming HTTP request
     * @param status    HTTP status code to return
     * @param errorCode application-specific error code
     * @return response entity containing the serialized error
     */
    private ResponseEntity<ErrorResponse> buildResponse(Throwable error,
                                                       HttpServletRequest request,
                                                       HttpStatus status,
                                                       String errorCode) {
        ErrorResponse response = ErrorResponse.of(status.value(), errorCode, error.getMessage(), request.getRequestURI());
        return json(status, response);
    }

    // the report endpoint produces PDF, errors are always JSON
    private ResponseEntity<ErrorResponse> json(HttpStatus status, ErrorResponse response) {
        return ResponseEntity.status(status).contentType(MediaType.APPLICATION_JSON).body(response);
    }
}
