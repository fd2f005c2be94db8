package com.williamcallahan.notewiki.domain.errors;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Body of a failed render or corpus request. Oversized or empty sources answer 400 with the
 * validation message alone; a render that overran its time limit answers 504 and any other
 * pipeline failure 500, both with the failing exception summarised in {@code details}.
 *
 * @param status always {@value ApiResponse#ERROR}
 * @param message what the client asked for and why it failed
 * @param details exception type and message, left out of the JSON for validation failures
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiErrorResponse(String status, String message, String details) implements ApiResponse {

    public ApiErrorResponse {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(message, "message");
    }

    /**
     * A rejected request whose message says everything the client needs.
     */
    public static ApiErrorResponse error(String message) {
        return error(message, null);
    }

    public static ApiErrorResponse error(String message, String details) {
        return new ApiErrorResponse(ERROR, message, details);
    }
}
