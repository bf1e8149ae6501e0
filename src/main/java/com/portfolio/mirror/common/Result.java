package com.portfolio.mirror.common;

import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Objects;
import java.util.function.Function;

/**
 * Response envelope used by the controllers. Successful results carry {@code data};
 * failed ones carry an error code understood by {@link com.portfolio.mirror.common.exception.Http}.
 */
@Getter
@ToString
public final class Result<T> {

    private final boolean success;
    private final T data;
    private final String error;
    private final String errorCode;
    private final Instant timestamp;

    private Result(boolean success, T data, String error, String errorCode) {
        this.success = success;
        this.data = data;
        this.error = error;
        this.errorCode = errorCode;
        this.timestamp = Instant.now();
    }

    // ---------- factories ----------
    public static <T> Result<T> ok(T data) {
        return new Result<>(true, data, null, null);
    }

    public static <T> Result<T> ok() {
        return new Result<>(true, null, null, null);
    }

    public static <T> Result<T> fail(String code, String message) {
        return new Result<>(false, null, message, code);
    }

    public static <T> Result<T> fail(Throwable t) {
        String msg = (t == null)
                ? "Unknown error"
                : (t.getMessage() == null ? t.toString() : t.getMessage());
        return new Result<>(false, null, msg, null);
    }

    public boolean isOk() {
        return success;
    }

    /**
     * Maps the payload when OK; propagates failure otherwise.
     */
    public <R> Result<R> map(Function<? super T, ? extends R> mapper) {
        Objects.requireNonNull(mapper, "mapper");
        if (!success) return Result.fail(errorCode, error);
        return Result.ok(mapper.apply(data));
    }
}
