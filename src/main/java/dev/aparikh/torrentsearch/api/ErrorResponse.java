package dev.aparikh.torrentsearch.api;

import io.swagger.v3.oas.annotations.media.Schema;
import org.springframework.http.HttpStatus;

import java.time.Instant;

/**
 * Error body returned by the torrent search endpoints.
 */
@Schema(description = "Torrent search error")
public record ErrorResponse(
        @Schema(description = "Human readable reason", example = "You've exceeded the maximum number of pages. "
                + "Please make your search query less broad.")
        String message,

        @Schema(description = "Machine readable error code", example = "NOT_FOUND",
                allowableValues = {"VALIDATION_ERROR", "INVALID_ARGUMENT", "NOT_FOUND",
                        "BACKEND_UNAVAILABLE", "INTERNAL_ERROR"})
        String code,

        @Schema(description = "HTTP status of the response", example = "404")
        int status,

        @Schema(description = "When the search failed", example = "2025-01-01T10:00:00Z")
        Instant timestamp
) {
    public static ErrorResponse of(HttpStatus status, String message, String code) {
        return new ErrorResponse(message, code, status.value(), Instant.now());
    }
}
