package io.newsdigest.pipeline.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

public record ErrorResponse(@JsonProperty("error") Body error) {

    public record Body(
            @JsonProperty("message") String message,
            @JsonProperty("error_code") String errorCode,
            @JsonProperty("status_code") int statusCode,
            @JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("details") Map<String, Object> details
    ) {}

    public static ErrorResponse of(String message, String errorCode, int statusCode, Map<String, Object> details) {
        return new ErrorResponse(new Body(message, errorCode, statusCode, Instant.now(),
                details == null ? Map.of() : details));
    }
}
