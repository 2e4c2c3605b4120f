package com.kernelworx.fundraiserservice.pipeline;

import com.kernelworx.common.exception.ErrorKind;
import com.kernelworx.common.exception.FundraiserException;
import com.kernelworx.fundraiserservice.security.CallerIdentity;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Runs a {@link Pipeline} step by step.
 * <p>
 * Errors raised by a step go to that step's {@code recover} first, store
 * errors translated beforehand. An ABORT outcome ends the run and its error is
 * thrown verbatim. Runs in the caller's transaction.
 */
@Component
@RequiredArgsConstructor
public class PipelineExecutor {

    private static final Logger log = LoggerFactory.getLogger(PipelineExecutor.class);

    private final StoreErrorTranslator storeErrorTranslator;

    public <A, S, R> R execute(Pipeline<A, S, R> pipeline, CallerIdentity caller, A arguments, S state) {
        PipelineContext<A, S> context = new PipelineContext<>(pipeline.getName(), arguments, caller, state);
        log.debug("Pipeline {} started for caller {}", pipeline.getName(), caller.getAccountId());

        for (PipelineStep<A, S> step : pipeline.getSteps()) {
            StepOutcome outcome = runStep(step, context);
            switch (outcome.getType()) {
                case CONTINUE -> context.setPreviousResult(outcome.getValue());
                case SKIP -> log.debug("Pipeline {} step {} skipped", pipeline.getName(), step.name());
                case ABORT -> {
                    FundraiserException error = outcome.getError();
                    if (error.getKind() == ErrorKind.INTERNAL_ERROR) {
                        log.error("Pipeline {} aborted at step {}: {}", pipeline.getName(), step.name(), error.getMessage());
                    } else {
                        log.warn("Pipeline {} aborted at step {} with {}: {}",
                                pipeline.getName(), step.name(), error.getKind(), error.getMessage());
                    }
                    throw error;
                }
            }
        }

        R response = pipeline.getResponse().apply(context);
        log.debug("Pipeline {} finished", pipeline.getName());
        return response;
    }

    private <A, S> StepOutcome runStep(PipelineStep<A, S> step, PipelineContext<A, S> context) {
        try {
            return step.execute(context);
        } catch (FundraiserException ex) {
            return step.recover(ex, context);
        } catch (DataAccessException ex) {
            return step.recover(storeErrorTranslator.translate(ex, context.getOperation() + "." + step.name()), context);
        }
    }
}
