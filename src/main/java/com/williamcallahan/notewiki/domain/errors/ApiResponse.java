package com.williamcallahan.notewiki.domain.errors;

/**
 * JSON body returned by the render and corpus endpoints whenever they answer with a status
 * rather than with rendered HTML: a failed render or corpus upload, or an acknowledged cache
 * clear. Clients branch on {@link #status()} before reading anything else.
 */
public sealed interface ApiResponse permits ApiErrorResponse, ApiSuccessResponse {

    String ERROR = "error";
    String SUCCESS = "success";

    /**
     * Either {@value #ERROR} or {@value #SUCCESS}.
     */
    String status();
}
