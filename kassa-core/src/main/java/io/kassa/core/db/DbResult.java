package io.kassa.core.db;

import java.util.Objects;

public record DbResult<T>(QueryStatus status, T value) {

    public DbResult {
        Objects.requireNonNull(status, "status must not be null");
    }

    public static <T> DbResult<T> found(T value) {
        return new DbResult<>(QueryStatus.ONE_RESULT, Objects.requireNonNull(value, "value must not be null"));
    }

    public static <T> DbResult<T> notFound() {
        return new DbResult<>(QueryStatus.NO_RESULTS, null);
    }

    public static <T> DbResult<T> error(QueryStatus status) {
        if (!status.isError()) {
            throw new IllegalArgumentException("not an error status: " + status);
        }
        return new DbResult<>(status, null);
    }

    public boolean isFound() {
        return status == QueryStatus.ONE_RESULT;
    }
}
