package com.williamcallahan.notewiki.domain.errors;

import java.util.Objects;

/**
 * Acknowledgement for maintenance calls that change server state without producing a page,
 * such as clearing the rendered-note cache.
 *
 * @param status always {@value ApiResponse#SUCCESS}
 * @param message what was done
 */
public record ApiSuccessResponse(String status, String message) implements ApiResponse {

    public ApiSuccessResponse {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(message, "message");
    }

    public static ApiSuccessResponse success(String message) {
        return new ApiSuccessResponse(SUCCESS, message);
    }
}
