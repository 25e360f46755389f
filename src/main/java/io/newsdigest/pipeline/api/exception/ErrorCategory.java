package io.newsdigest.pipeline.api.exception;

public enum ErrorCategory {
    TIMEOUT(FetchErrorClass.TIMEOUT),               // Connection/read timeout, or feed deadline exceeded
    CONNECTION_REFUSED(FetchErrorClass.NETWORK),    // Connection refused
    DNS_ERROR(FetchErrorClass.NETWORK),             // Unknown host
    NETWORK_ERROR(FetchErrorClass.NETWORK),         // Other network issues
    IO_ERROR(FetchErrorClass.NETWORK),              // I/O problems
    INVALID_URL(FetchErrorClass.NETWORK),           // Malformed URL
    NOT_FOUND(FetchErrorClass.HTTP_STATUS),         // 404 error
    ACCESS_FORBIDDEN(FetchErrorClass.HTTP_STATUS),  // 403 error
    AUTH_REQUIRED(FetchErrorClass.HTTP_STATUS),     // 401 error
    SERVER_ERROR(FetchErrorClass.HTTP_STATUS),      // 500 error
    SERVER_UNAVAILABLE(FetchErrorClass.HTTP_STATUS),// 502, 503, 504
    HTTP_ERROR(FetchErrorClass.HTTP_STATUS),        // Other non-2xx statuses
    RATE_LIMITED(FetchErrorClass.HTTP_STATUS),      // 429 Too Many Requests
    PARSE_ERROR(FetchErrorClass.PARSE),             // XML/RSS/Atom parsing issues
    UNKNOWN(FetchErrorClass.NETWORK);               // Unexpected errors

    private final FetchErrorClass errorClass;

    ErrorCategory(FetchErrorClass errorClass) {
        this.errorClass = errorClass;
    }

    public FetchErrorClass errorClass() {
        return errorClass;
    }

    public boolean isTransient() {
        return switch (this) {
            case TIMEOUT, CONNECTION_REFUSED, NETWORK_ERROR, SERVER_UNAVAILABLE, RATE_LIMITED -> true;
            default -> false;
        };
    }
}
