package com.e2eq.skos.core;

import com.e2eq.skos.exceptions.CleaningException;

import java.util.function.Function;

/**
 * Outcome of a pipeline phase: either a value or the failure that aborted the run.
 *
 * @param <T> value produced by the phase
 */
public interface PhaseResult<T> {

    record Success<T>(T value) implements PhaseResult<T> {}

    record Failure<T>(String phase, String message, Throwable cause) implements PhaseResult<T> {}

    static <T> PhaseResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> PhaseResult<T> failure(String phase, Throwable cause) {
        String message = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        return new Failure<>(phase, message, cause);
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    default boolean isFailure() {
        return this instanceof Failure;
    }

    default <U> PhaseResult<U> map(Function<? super T, ? extends U> mapper) {
        if (this instanceof Success<T> success) {
            return success(mapper.apply(success.value()));
        }
        Failure<T> failure = (Failure<T>) this;
        return new Failure<>(failure.phase(), failure.message(), failure.cause());
    }

    /**
     * @return the value of a successful phase
     * @throws CleaningException carrying the failed phase otherwise
     */
    default T orElseThrow() {
        if (this instanceof Success<T> success) {
            return success.value();
        }
        Failure<T> failure = (Failure<T>) this;
        throw new CleaningException(failure.phase(), failure.message(), failure.cause());
    }
}
