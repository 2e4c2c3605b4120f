package com.kernelworx.fundraiserservice.pipeline;

import com.kernelworx.fundraiserservice.security.CallerIdentity;
import lombok.Getter;

/**
 * What a step sees: the operation arguments, the caller, the typed state the
 * pipeline accumulates, and the value of the last step that continued.
 *
 * @param <A> argument type
 * @param <S> per-pipeline state type
 */
@Getter
public class PipelineContext<A, S> {

    private final String operation;
    private final A arguments;
    private final CallerIdentity caller;
    private final S state;
    private Object previousResult;

    public PipelineContext(String operation, A arguments, CallerIdentity caller, S state) {
        this.operation = operation;
        this.arguments = arguments;
        this.caller = caller;
        this.state = state;
    }

    void setPreviousResult(Object previousResult) {
        this.previousResult = previousResult;
    }
}
