package com.kernelworx.fundraiserservice.pipeline;

import com.kernelworx.common.exception.FundraiserException;

import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * One store operation (or check) in a pipeline.
 *
 * @param <A> argument type
 * @param <S> state type the step reads and writes
 */
public interface PipelineStep<A, S> {

    String name();

    StepOutcome execute(PipelineContext<A, S> context);

    /**
     * Called when {@link #execute} raised a domain error, or a store error
     * already translated into one. The default aborts with it.
     */
    default StepOutcome recover(FundraiserException error, PipelineContext<A, S> context) {
        return StepOutcome.abort(error);
    }

    static <A, S> PipelineStep<A, S> of(String name, Function<PipelineContext<A, S>, StepOutcome> body) {
        return of(name, body, (error, context) -> StepOutcome.abort(error));
    }

    static <A, S> PipelineStep<A, S> of(String name,
                                        Function<PipelineContext<A, S>, StepOutcome> body,
                                        BiFunction<FundraiserException, PipelineContext<A, S>, StepOutcome> recovery) {
        return new PipelineStep<>() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public StepOutcome execute(PipelineContext<A, S> context) {
                return body.apply(context);
            }

            @Override
            public StepOutcome recover(FundraiserException error, PipelineContext<A, S> context) {
                return recovery.apply(error, context);
            }
        };
    }
}
