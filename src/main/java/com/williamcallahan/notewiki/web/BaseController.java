package com.williamcallahan.notewiki.web;

import com.williamcallahan.notewiki.domain.errors.ApiResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Base controller class providing common error handling patterns.
 */
public abstract class BaseController {

    protected final ExceptionResponseBuilder exceptionBuilder;

    /**
     * Creates a base controller wired to the shared exception response builder.
     */
    protected BaseController(ExceptionResponseBuilder exceptionBuilder) {
        this.exceptionBuilder = exceptionBuilder;
    }

    /**
     * Handles service exceptions with standardized error responses, choosing the status from the
     * exception type.
     *
     * @param e The exception that occurred
     * @param operation Description of the operation that failed
     * @return Standardized error response
     */
    protected ResponseEntity<ApiResponse> handleServiceException(Exception e, String operation) {
        HttpStatus status = exceptionBuilder.statusFor(e);
        if (status == HttpStatus.BAD_REQUEST) {
            return exceptionBuilder.buildErrorResponse(status, e.getMessage());
        }
        return exceptionBuilder.buildErrorResponse(status, "Failed to " + operation, e);
    }

    /**
     * Handles validation exceptions with bad request responses.
     *
     * @param validationException The validation exception
     * @return Bad request error response
     */
    protected ResponseEntity<ApiResponse> handleValidationException(IllegalArgumentException validationException) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, validationException.getMessage());
    }

    /**
     * Creates a standardized success response.
     *
     * @param message Success message
     * @return Success response
     */
    protected ResponseEntity<ApiResponse> createSuccessResponse(String message) {
        return exceptionBuilder.buildSuccessResponse(message);
    }
}
