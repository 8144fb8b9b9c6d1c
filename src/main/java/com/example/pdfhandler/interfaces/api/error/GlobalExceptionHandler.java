package com.example.pdfhandler.interfaces.api.error;

import com.example.pdfhandler.application.exception.ApplicationException;
import com.example.pdfhandler.application.exception.BatchJobNotFoundException;
import com.example.pdfhandler.application.exception.BatchQueueFullException;
import com.example.pdfhandler.application.exception.UseCaseValidationException;
import com.example.pdfhandler.domain.exception.DomainException;
import com.example.pdfhandler.domain.exception.PdfNotFoundException;
import com.example.pdfhandler.infrastructure.exception.InfrastructureException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Centralized API-layer exception handler that maps domain/application/infrastructure failures to HTTP responses.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Maps {@link PdfNotFoundException} to a 404 response that names the missing file.
     *
     * @param ex       thrown exception
     * @param request  incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(PdfNotFoundException.class)
    public ResponseEntity<ErrorResponse> handlePdfNotFound(PdfNotFoundException ex, HttpServletRequest request) {
        ErrorResponse body = ErrorResponse.of(HttpStatus.NOT_FOUND.value(), "PDF_NOT_FOUND", ex.getMessage(), request.getRequestURI())
                .withDetails(Map.of("file", ex.getPath().toString()));
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body);
    }

    /**
     * Maps unknown job ids to a 404 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(BatchJobNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleJobNotFound(BatchJobNotFoundException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.NOT_FOUND, "JOB_NOT_FOUND");
    }

    /**
     * Maps invalid batch arguments (ranges, part counts, naming patterns) to a 400 response.
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
     * Maps request validation exceptions to a 400 response.
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
     * Maps unreadable JSON bodies (including unknown split modes) to a 400 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
        ErrorResponse body = ErrorResponse.of(HttpStatus.BAD_REQUEST.value(), "MALFORMED_REQUEST",
                "Request body could not be read.", request.getRequestURI());
        return ResponseEntity.badRequest().body(body);
    }

    /**
     * Maps a full batch queue to a 503 response; the client may retry later.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(BatchQueueFullException.class)
    public ResponseEntity<ErrorResponse> handleQueueFull(BatchQueueFullException ex, HttpServletRequest request) {
        log.warn("Rejected batch on {}: {}", request.getRequestURI(), ex.getMessage());
        return buildResponse(ex, request, HttpStatus.SERVICE_UNAVAILABLE, "QUEUE_FULL");
    }

    /**
     * Maps other application-layer exceptions to a 422 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(ApplicationException.class)
    public ResponseEntity<ErrorResponse> handleApplication(ApplicationException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.UNPROCESSABLE_ENTITY, "APPLICATION_ERROR");
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
        log.error("Infrastructure failure on {}", request.getRequestURI(), ex);
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
        log.error("Unexpected failure on {}", request.getRequestURI(), ex);
        return buildResponse(ex, request, HttpStatus.INTERNAL_SERVER_ERROR, "UNEXPECTED_ERROR");
    }

    /**
     * Central helper that creates a consistent {@link ErrorResponse} envelope.
     *
     * @param error    exception that triggered the handler
     * @param request  incoming HTTP request
     * @param status   HTTP status code to return
     * @param errorCode application-specific error code
     * @return response entity containing the serialized error
     */
    private ResponseEntity<ErrorResponse> buildResponse(Throwable error,
                                                       HttpServletRequest request,
                                                       HttpStatus status,
                                                       String errorCode) {
        ErrorResponse response = ErrorResponse.of(status.value(), errorCode, error.getMessage(), request.getRequestURI());
        return ResponseEntity.status(status).body(response);
    }
}
