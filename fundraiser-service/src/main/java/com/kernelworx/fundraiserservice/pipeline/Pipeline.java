package com.kernelworx.fundraiserservice.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * A named, ordered list of steps plus the function that shapes the response
 * from the final context. Immutable once built, so pipelines are declared once
 * per service and reused for every call.
 *
 * @param <A> argument type
 * @param <S> state type
 * @param <R> response type
 */
public final class Pipeline<A, S, R> {

    private final String name;
    private final List<PipelineStep<A, S>> steps;
    private final Function<PipelineContext<A, S>, R> response;

    private Pipeline(String name, List<PipelineStep<A, S>> steps, Function<PipelineContext<A, S>, R> response) {
        this.name = name;
        this.steps = List.copyOf(steps);
        this.response = response;
    }

    public static <A, S, R> Builder<A, S, R> named(String name) {
        return new Builder<>(name);
    }

    public String getName() {
        return name;
    }

    public List<PipelineStep<A, S>> getSteps() {
        return steps;
    }

    public Function<PipelineContext<A, S>, R> getResponse() {
        return response;
    }

    public static final class Builder<A, S, R> {

        private final String name;
        private final List<PipelineStep<A, S>> steps = new ArrayList<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder<A, S, R> step(PipelineStep<A, S> step) {
            steps.add(Objects.requireNonNull(step, "step"));
            return this;
        }

        public Builder<A, S, R> step(String stepName, Function<PipelineContext<A, S>, StepOutcome> body) {
            return step(PipelineStep.of(stepName, body));
        }

        public Pipeline<A, S, R> respond(Function<PipelineContext<A, S>, R> response) {
            return new Pipeline<>(name, steps, Objects.requireNonNull(response, "response"));
        }
    }
}
