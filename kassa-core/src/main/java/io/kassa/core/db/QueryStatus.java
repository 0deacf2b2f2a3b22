package io.kassa.core.db;

/**
 * Outcome of a store operation. Errors are negative, results count rows.
 */
public enum QueryStatus {
    HARD_ERROR(-2),
    SOFT_ERROR(-1),
    NO_RESULTS(0),
    ONE_RESULT(1);

    private final int code;

    QueryStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public boolean isError() {
        return code < 0;
    }
}
