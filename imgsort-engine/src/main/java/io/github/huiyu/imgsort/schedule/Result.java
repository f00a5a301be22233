package io.github.huiyu.imgsort.schedule;

import io.github.huiyu.imgsort.exception.ErrorKind;

/**
 * Outcome of a unit of asynchronous work. Failures travel as values, never as thrown
 * objects, across worker boundaries.
 */
public final class Result<T> {

    public enum Status {
        OK, FAILED, CANCELLED
    }

    private static final Result<?> CANCELLED = new Result<>(Status.CANCELLED, null, null, "cancelled");

    private final Status status;
    private final T value;
    private final ErrorKind kind;
    private final String message;

    private Result(Status status, T value, ErrorKind kind, String message) {
        this.status = status;
        this.value = value;
        this.kind = kind;
        this.message = message;
    }

    public static <T> Result<T> ok(T value) {
        return new Result<>(Status.OK, value, null, null);
    }

    /**
     * A success that still carries an informational kind, e.g. an image served without
     * being cached.
     */
    public static <T> Result<T> ok(T value, ErrorKind kind, String message) {
        return new Result<>(Status.OK, value, kind, message);
    }

    public static <T> Result<T> failed(ErrorKind kind, String message) {
        return new Result<>(Status.FAILED, null, kind, message);
    }

    @SuppressWarnings("unchecked")
    public static <T> Result<T> cancelled() {
        return (Result<T>) CANCELLED;
    }

    public Status getStatus() {
        return status;
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }

    public boolean isCancelled() {
        return status == Status.CANCELLED;
    }

    public T getValue() {
        return value;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "Result{" +
                "status=" + status +
                (kind != null ? ", kind=" + kind : "") +
                (message != null ? ", message='" + message + '\'' : "") +
                '}';
    }
}
