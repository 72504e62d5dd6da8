package io.neocli.errors;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a fallible operation: either {@code success} with data or a failure carrying an {@link AppError}.
 */
public record Result<T>(
        boolean success,
        T data,
        AppError error
) {
    public Result {
        if (!success) {
            Objects.requireNonNull(error, "error");
        }
    }

    public static <T> Result<T> success(T data) {
        return new Result<>(true, data, null);
    }

    public static Result<Void> ok() {
        return new Result<>(true, null, null);
    }

    public static <T> Result<T> failure(AppError error) {
        return new Result<>(false, null, error);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
        return success ? success(mapper.apply(data)) : failure(error);
    }

    public T orElseThrow() {
        if (!success) {
            throw error;
        }
        return data;
    }
}
