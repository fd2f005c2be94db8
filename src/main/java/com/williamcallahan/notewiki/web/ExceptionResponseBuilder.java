package com.williamcallahan.notewiki.web;

import com.williamcallahan.notewiki.domain.errors.ApiErrorResponse;
import com.williamcallahan.notewiki.domain.errors.ApiResponse;
import com.williamcallahan.notewiki.domain.errors.ApiSuccessResponse;
import com.williamcallahan.notewiki.service.RenderTimeoutException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

/**
 * Centralized utility for building consistent error responses across controllers.
 */
@Component
public class ExceptionResponseBuilder {

    /**
     * Builds a standardized error response with status and message.
     *
     * @param status The HTTP status code
     * @param message The error message
     * @return ResponseEntity with error details
     */
    public ResponseEntity<ApiResponse> buildErrorResponse(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(ApiErrorResponse.error(message));
    }

    /**
     * Builds a standardized error response with status, message, and exception details.
     *
     * @param status The HTTP status code
     * @param message The error message
     * @param exception The exception that occurred
     * @return ResponseEntity with error details
     */
    public ResponseEntity<ApiResponse> buildErrorResponse(HttpStatus status, String message, Exception exception) {
        return ResponseEntity.status(status).body(ApiErrorResponse.error(message, describeException(exception)));
    }

    /**
     * Builds a standardized success response with a simple message.
     *
     * @param message The success message
     * @return ResponseEntity with success details
     */
    public ResponseEntity<ApiResponse> buildSuccessResponse(String message) {
        return ResponseEntity.ok(ApiSuccessResponse.success(message));
    }

    /**
     * Maps a rendering failure to its HTTP status: invalid input is the caller's fault, an overrun
     * time budget is a gateway timeout, anything else is a server error.
     *
     * @param exception the failure
     * @return matching HTTP status
     */
    public HttpStatus statusFor(Exception exception) {
        if (exception instanceof IllegalArgumentException) {
            return HttpStatus.BAD_REQUEST;
        }
        if (exception instanceof RenderTimeoutException) {
            return HttpStatus.GATEWAY_TIMEOUT;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    /**
     * Describes an exception and its root cause for diagnostics.
     *
     * @param exception exception to describe
     * @return formatted exception details or null when no exception is provided
     */
    public String describeException(Exception exception) {
        if (exception == null) {
            return null;
        }
        StringBuilder details = new StringBuilder(exception.getClass().getSimpleName());
        if (exception.getMessage() != null) {
            details.append(": ").append(exception.getMessage());
        }
        Throwable rootCause = exception;
        while (rootCause.getCause() != null && rootCause.getCause() != rootCause) {
            rootCause = rootCause.getCause();
        }
        if (rootCause != exception) {
            details.append(" (cause=").append(rootCause.getClass().getSimpleName());
            if (rootCause.getMessage() != null) {
                details.append(": ").append(rootCause.getMessage());
            }
            details.append(")");
        }
        return details.toString();
    }
}
