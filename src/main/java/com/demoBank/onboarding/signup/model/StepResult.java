package com.demoBank.onboarding.signup.model;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a step transition: either a value or a {@link SignupError}.
 *
 * @param <T> success payload type
 */
public final class StepResult<T> {

    private final T value;
    private final SignupError error;

    private StepResult(T value, SignupError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> StepResult<T> ok(T value) {
        return new StepResult<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> StepResult<T> fail(SignupError error) {
        return new StepResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public static <T> StepResult<T> fail(SignupErrorCode code) {
        return fail(SignupError.of(code));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public T getValue() {
        if (error != null) {
            throw new IllegalStateException("No value on failed result: " + error.getCode());
        }
        return value;
    }

    public SignupError getError() {
        if (error == null) {
            throw new IllegalStateException("No error on successful result");
        }
        return error;
    }

    public <U> StepResult<U> map(Function<? super T, ? extends U> mapper) {
        return isSuccess() ? ok(mapper.apply(value)) : fail(error);
    }

    @Override
    public String toString() {
        return isSuccess() ? "StepResult[ok=" + value + "]" : "StepResult[error=" + error.getCode() + "]";
    }
}
