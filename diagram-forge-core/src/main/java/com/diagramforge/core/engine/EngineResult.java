package com.diagramforge.core.engine;

import java.util.function.Function;

/**
 * Either a value or an {@link EngineError}.
 *
 * @param value result value, {@code null} on failure
 * @param error failure, {@code null} on success
 * @param <T> value type
 */
public record EngineResult<T>(T value, EngineError error) {

    public EngineResult {
        if ((value == null) == (error == null)) {
            throw new IllegalArgumentException("Exactly one of value and error must be set");
        }
    }

    public static <T> EngineResult<T> success(T value) {
        return new EngineResult<>(value, null);
    }

    public static <T> EngineResult<T> failure(EngineError error) {
        return new EngineResult<>(null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public <R> EngineResult<R> map(Function<? super T, ? extends R> mapper) {
        return isSuccess() ? success(mapper.apply(value)) : failure(error);
    }
}
