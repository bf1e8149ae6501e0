package com.portfolio.mirror.common.exception;

import com.portfolio.mirror.common.Result;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Instant;

public final class Http {
    private Http() {
    }

    public static <T> ResponseEntity<?> from(Result<T> r) {
        return from(r, HttpStatus.OK);
    }

    public static <T> ResponseEntity<?> from(Result<T> r, HttpStatus successStatus) {
        if (r == null) return ResponseEntity.internalServerError().body("Result is null");

        if (r.isSuccess()) {
            return ResponseEntity.status(successStatus).body(r.getData());
        }
        String errorCode = r.getErrorCode();
        if (errorCode == null) {
            return ResponseEntity.badRequest().body(new ErrorResponse(null, r.getError(), r.getTimestamp()));
        }
        return ResponseEntity.status(statusFor(errorCode))
                .body(new ErrorResponse(errorCode, r.getError(), r.getTimestamp()));
    }

    static HttpStatus statusFor(String errorCode) {
        return switch (errorCode) {
            case "ERR-AUTH-010", "ERR-AUTH-011", "ERR-AUTH-012", UpstreamAuthException.RECONNECT_ERROR_CODE ->
                    HttpStatus.UNAUTHORIZED;
            case "ERR-AUTH-002" -> HttpStatus.FORBIDDEN;
            case "ERR-DB-001", "ERR-MKT-404" -> HttpStatus.NOT_FOUND;
            case "ERR-DB-002", "ERR-SYS-001" -> HttpStatus.INTERNAL_SERVER_ERROR;
            case "ERR-UPSTREAM-001" -> HttpStatus.SERVICE_UNAVAILABLE;
            case "ERR-UPSTREAM-002" -> HttpStatus.BAD_GATEWAY;
            case "ERR-RATE-001" -> HttpStatus.TOO_MANY_REQUESTS;
            case "ERR-VAL-001", "ERR-VAL-003", "ERR-VAL-010",
                 "ERR-REQ-001", "ERR-REQ-003" -> HttpStatus.BAD_REQUEST;
            default -> HttpStatus.BAD_REQUEST;
        };
    }

    /**
     * Error body returned to clients.
     */
    private record ErrorResponse(String code, String message, Instant timestamp) {
    }
}
