package me.internalizable.socialflood.concurrency;

/**
 * Result of one task in a fan-out batch: a value or the error that task raised.
 */
public record FetchOutcome<T>(T value, Throwable error) {

    public static <T> FetchOutcome<T> success(T value) {
        return new FetchOutcome<>(value, null);
    }

    public static <T> FetchOutcome<T> failure(Throwable error) {
        if (error == null) {
            throw new IllegalArgumentException("A failed outcome needs an error");
        }
        return new FetchOutcome<>(null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
