package io.newsdigest.pipeline.api;

import io.newsdigest.pipeline.api.dto.ErrorResponse;
import io.newsdigest.pipeline.api.exception.PipelineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(PipelineException.class)
    public ResponseEntity<ErrorResponse> handlePipeline(PipelineException e) {
        HttpStatus status = statusOf(e.getErrorCode());

        if (status.is5xxServerError()) {
            logger.error("{}: {}", e.getErrorCode(), e.getMessage(), e);
        } else {
            logger.debug("{}: {}", e.getErrorCode(), e.getMessage());
        }

        return respond(status, e.getMessage(), e.getErrorCode(), e.getDetails());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException e) {
        Map<String, Object> fields = new LinkedHashMap<>();
        e.getBindingResult().getFieldErrors()
                .forEach(error -> fields.put(error.getField(), String.valueOf(error.getDefaultMessage())));

        return respond(HttpStatus.BAD_REQUEST, "Request validation failed", "VALIDATION_ERROR", fields);
    }

    @ExceptionHandler({
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class,
            HttpMessageNotReadableException.class,
            IllegalArgumentException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        return respond(HttpStatus.BAD_REQUEST, e.getMessage(), "VALIDATION_ERROR", Map.of());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        logger.error("Unhandled error: {}", e.getMessage(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", "INTERNAL_ERROR", Map.of());
    }

    static HttpStatus statusOf(String errorCode) {
        return switch (errorCode) {
            case "VALIDATION_ERROR" -> HttpStatus.BAD_REQUEST;
            case "ARTICLE_NOT_FOUND", "FEED_NOT_FOUND", "TAG_NOT_FOUND", "READING_LIST_ENTRY_NOT_FOUND",
                    "ANALYSIS_ARTICLE_NOT_FOUND", "RUN_NOT_FOUND" -> HttpStatus.NOT_FOUND;
            case "ANALYSIS_GENERATION_FAILED", "LLM_ERROR", "EMBEDDING_ERROR" -> HttpStatus.BAD_GATEWAY;
            case "DATABASE_ERROR" -> HttpStatus.SERVICE_UNAVAILABLE;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String message, String code,
                                                  Map<String, Object> details) {
        return ResponseEntity.status(status).body(ErrorResponse.of(message, code, status.value(), details));
    }
}
