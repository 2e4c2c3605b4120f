package com.kernelworx.fundraiserservice.pipeline;

import com.kernelworx.common.exception.FundraiserException;

import java.util.Objects;

/**
 * Result of one pipeline step.
 * <ul>
 *   <li>CONTINUE: the value becomes the previous result for the next step</li>
 *   <li>SKIP: nothing happened, the previous result is kept</li>
 *   <li>ABORT: the pipeline stops and the error reaches the caller unchanged</li>
 * </ul>
 */
public final class StepOutcome {

    public enum Type {
        CONTINUE,
        SKIP,
        ABORT
    }

    private static final StepOutcome SKIP = new StepOutcome(Type.SKIP, null, null);

    private final Type type;
    private final Object value;
    private final FundraiserException error;

    private StepOutcome(Type type, Object value, FundraiserException error) {
        this.type = type;
        this.value = value;
        this.error = error;
    }

    public static StepOutcome continueWith(Object value) {
        return new StepOutcome(Type.CONTINUE, value, null);
    }

    public static StepOutcome skip() {
        return SKIP;
    }

    public static StepOutcome abort(FundraiserException error) {
        return new StepOutcome(Type.ABORT, null, Objects.requireNonNull(error, "error"));
    }

    public Type getType() {
        return type;
    }

    public Object getValue() {
        return value;
    }

    public FundraiserException getError() {
        return error;
    }

    @Override
    public String toString() {
        return type == Type.ABORT ? "ABORT(" + error.getKind() + ")" : type.name();
    }
}
