package com.artifactguard.core.model;

import java.util.Objects;
import java.util.function.Function;

/**
 * 컴포넌트 경계에서 쓰는 성공/실패 반환값. 예외 대신 실패 종류를 시그니처에 드러낸다.
 */
public final class StepResult<T> {
    private final T value;
    private final FailureKind failure;
    private final String message;

    private StepResult(T value, FailureKind failure, String message) {
        this.value = value;
        this.failure = failure;
        this.message = message;
    }

    public static <T> StepResult<T> ok(T value) {
        return new StepResult<>(Objects.requireNonNull(value, "value"), null, "");
    }

    public static <T> StepResult<T> fail(FailureKind kind, String message) {
        return new StepResult<>(null, Objects.requireNonNull(kind, "kind"), message == null ? "" : message);
    }

    public boolean isOk() { return failure == null; }

    public boolean isFailure() { return failure != null; }

    /** 성공일 때만 호출 */
    public T get() {
        if (failure != null) throw new IllegalStateException("failed step: " + failure + " - " + message);
        return value;
    }

    public FailureKind failure() { return failure; }

    public String message() { return message; }

    public <R> StepResult<R> map(Function<? super T, ? extends R> fn) {
        if (failure != null) return fail(failure, message);
        return ok(fn.apply(value));
    }

    @Override
    public String toString() {
        return isOk() ? "ok(" + value + ")" : "fail(" + failure + ": " + message + ")";
    }
}
