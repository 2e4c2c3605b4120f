package com.kernelworx.fundraiserservice.access;

import com.kernelworx.common.exception.AccessDeniedException;
import com.kernelworx.fundraiserservice.model.Permission;
import com.kernelworx.fundraiserservice.model.SellerProfile;
import com.kernelworx.fundraiserservice.pipeline.CallShape;
import com.kernelworx.fundraiserservice.pipeline.PipelineContext;
import com.kernelworx.fundraiserservice.pipeline.PipelineStep;
import com.kernelworx.fundraiserservice.pipeline.StepOutcome;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.function.Function;

/**
 * The access resolver packaged as pipeline steps.
 * <p>
 * Profile operations run {@link #verifyProfileAccess} then
 * {@link #checkSharePermissions}; the second one skips when ownership was
 * already established. Owner-only operations run {@link #requireOwner}.
 * A denial aborts a mutation with Forbidden and marks a query as denied, so
 * the following {@link #authorized} steps skip and the query answers empty.
 */
@Component
@RequiredArgsConstructor
public class AccessSteps {

    private static final Logger log = LoggerFactory.getLogger(AccessSteps.class);

    static final String DENIED_MESSAGE = "You are not authorized to perform this operation";

    private final AccessResolver accessResolver;

    public <A, S extends ProfileScopedState> PipelineStep<A, S> verifyProfileAccess(CallShape shape) {
        return PipelineStep.of("verifyProfileAccess", context -> {
            S state = context.getState();
            if (state.isTargetMissing() || state.isDenied()) {
                return StepOutcome.skip();
            }
            Optional<SellerProfile> profile = accessResolver.findProfile(state.getProfileId());
            if (profile.isEmpty()) {
                return deny(context, shape, "profile missing");
            }
            state.setProfile(profile.get());
            if (accessResolver.isOwner(context.getCaller().getAccountId(), profile.get())) {
                state.setAccess(AccessDecision.owner());
            }
            return StepOutcome.continueWith(profile.get());
        });
    }

    public <A, S extends ProfileScopedState> PipelineStep<A, S> checkSharePermissions(Permission required,
                                                                                       CallShape shape) {
        return PipelineStep.of("checkSharePermissions", context -> {
            S state = context.getState();
            if (state.isTargetMissing() || state.isResolved()) {
                return StepOutcome.skip();
            }
            AccessDecision decision = accessResolver.resolveShare(
                    context.getCaller().getAccountId(), state.getProfileId(), required);
            if (!decision.isAuthorized()) {
                return deny(context, shape, "no " + required + " share");
            }
            state.setAccess(decision);
            return StepOutcome.continueWith(decision);
        });
    }

    public <A, S extends ProfileScopedState> PipelineStep<A, S> requireOwner(CallShape shape) {
        return PipelineStep.of("verifyProfileOwner", context -> {
            S state = context.getState();
            if (state.isTargetMissing()) {
                return StepOutcome.skip();
            }
            Optional<SellerProfile> profile = accessResolver.findProfile(state.getProfileId());
            if (profile.isEmpty()) {
                return deny(context, shape, "profile missing");
            }
            if (!accessResolver.isOwner(context.getCaller().getAccountId(), profile.get())) {
                return deny(context, shape, "not the owner");
            }
            state.setProfile(profile.get());
            state.setAccess(AccessDecision.owner());
            return StepOutcome.continueWith(profile.get());
        });
    }

    /**
     * A step that only runs once access was granted and the target exists.
     */
    public static <A, S extends ProfileScopedState> PipelineStep<A, S> authorized(
            String name, Function<PipelineContext<A, S>, StepOutcome> body) {
        return PipelineStep.of(name, context -> {
            S state = context.getState();
            if (state.isTargetMissing() || !state.isAuthorized()) {
                return StepOutcome.skip();
            }
            return body.apply(context);
        });
    }

    private <A, S extends ProfileScopedState> StepOutcome deny(PipelineContext<A, S> context,
                                                               CallShape shape,
                                                               String reason) {
        S state = context.getState();
        state.setAccess(AccessDecision.denied());
        log.warn("Access denied: Account {} attempted {} on profile {} ({})",
                context.getCaller().getAccountId(), context.getOperation(), state.getProfileId(), reason);
        if (shape == CallShape.MUTATION) {
            return StepOutcome.abort(new AccessDeniedException(DENIED_MESSAGE));
        }
        return StepOutcome.skip();
    }
}
