package com.kernelworx.fundraiserservice.service;

import com.kernelworx.common.exception.BadRequestException;
import com.kernelworx.common.exception.ConflictException;
import com.kernelworx.common.exception.ErrorKind;
import com.kernelworx.common.exception.ResourceNotFoundException;
import com.kernelworx.fundraiserservice.access.AccessSteps;
import com.kernelworx.fundraiserservice.access.ProfileScopedState;
import com.kernelworx.fundraiserservice.config.FundraiserProperties;
import com.kernelworx.fundraiserservice.dto.InviteRequest;
import com.kernelworx.fundraiserservice.dto.InviteResponse;
import com.kernelworx.fundraiserservice.dto.RedeemInviteRequest;
import com.kernelworx.fundraiserservice.dto.ShareRequest;
import com.kernelworx.fundraiserservice.dto.ShareResponse;
import com.kernelworx.fundraiserservice.ids.CanonicalId;
import com.kernelworx.fundraiserservice.ids.IdCanonicalizer;
import com.kernelworx.fundraiserservice.ids.IdKind;
import com.kernelworx.fundraiserservice.mapper.SharingMapper;
import com.kernelworx.fundraiserservice.model.Account;
import com.kernelworx.fundraiserservice.model.Invite;
import com.kernelworx.fundraiserservice.model.Permission;
import com.kernelworx.fundraiserservice.model.Share;
import com.kernelworx.fundraiserservice.pipeline.CallShape;
import com.kernelworx.fundraiserservice.pipeline.Pipeline;
import com.kernelworx.fundraiserservice.pipeline.PipelineExecutor;
import com.kernelworx.fundraiserservice.pipeline.PipelineStep;
import com.kernelworx.fundraiserservice.pipeline.StepOutcome;
import com.kernelworx.fundraiserservice.repository.AccountRepository;
import com.kernelworx.fundraiserservice.repository.InviteRepository;
import com.kernelworx.fundraiserservice.repository.ShareRepository;
import com.kernelworx.fundraiserservice.security.CallerIdentity;
import com.kernelworx.fundraiserservice.store.ConditionalWriter;
import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

@Service
public class SharingServiceImpl implements SharingService {

    private static final Logger log = LoggerFactory.getLogger(SharingServiceImpl.class);

    private static final String CODE_ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    static final String CODE_COLLISION_MESSAGE = "Invite code collision, please retry";
    static final String INVITE_USED_MESSAGE = "Invite has already been used";

    private final ShareRepository shareRepository;
    private final InviteRepository inviteRepository;
    private final AccountRepository accountRepository;
    private final SharingMapper sharingMapper;
    private final ConditionalWriter conditionalWriter;
    private final FundraiserProperties properties;
    private final PipelineExecutor pipelineExecutor;
    private final SecureRandom random = new SecureRandom();

    private final Pipeline<InviteRequest, SharingState, InviteResponse> createInvitePipeline;
    private final Pipeline<String, SharingState, ShareResponse> redeemInvitePipeline;
    private final Pipeline<Void, SharingState, List<InviteResponse>> listInvitesPipeline;
    private final Pipeline<String, SharingState, Void> deleteInvitePipeline;
    private final Pipeline<ShareRequest, SharingState, ShareResponse> shareDirectPipeline;
    private final Pipeline<CanonicalId, SharingState, Void> revokeSharePipeline;
    private final Pipeline<Void, SharingState, List<ShareResponse>> listSharesPipeline;

    public SharingServiceImpl(ShareRepository shareRepository,
                              InviteRepository inviteRepository,
                              AccountRepository accountRepository,
                              SharingMapper sharingMapper,
                              ConditionalWriter conditionalWriter,
                              FundraiserProperties properties,
                              AccessSteps accessSteps,
                              PipelineExecutor pipelineExecutor) {
        this.shareRepository = shareRepository;
        this.inviteRepository = inviteRepository;
        this.accountRepository = accountRepository;
        this.sharingMapper = sharingMapper;
        this.conditionalWriter = conditionalWriter;
        this.properties = properties;
        this.pipelineExecutor = pipelineExecutor;

        this.createInvitePipeline = Pipeline.<InviteRequest, SharingState, InviteResponse>named("createProfileInvite")
                .step(accessSteps.requireOwner(CallShape.MUTATION))
                .step(PipelineStep.of("createInvite", context -> {
                            Invite invite = newInvite(context.getState(), context.getArguments(), context.getCaller());
                            Invite saved = conditionalWriter.insertIfAbsent(inviteRepository, invite);
                            context.getState().setInvite(saved);
                            return StepOutcome.continueWith(saved);
                        },
                        (error, context) -> StepOutcome.abort(error.getKind() == ErrorKind.CONFLICT
                                ? new ConflictException(CODE_COLLISION_MESSAGE, error)
                                : error)))
                .respond(context -> sharingMapper.toInviteResponse(context.getState().getInvite()));

        this.redeemInvitePipeline = Pipeline.<String, SharingState, ShareResponse>named("redeemProfileInvite")
                .step("lookupInvite", context -> {
                    Invite invite = inviteRepository.findById(context.getArguments())
                            .orElseThrow(() -> new ResourceNotFoundException("Invalid invite code"));
                    if (invite.isUsed()) {
                        throw new ConflictException(INVITE_USED_MESSAGE);
                    }
                    if (invite.isExpired(Instant.now())) {
                        throw new ConflictException("Invite has expired");
                    }
                    if (context.getCaller().getAccountId().matches(invite.getOwnerAccountId())) {
                        throw new BadRequestException("You cannot redeem an invite to your own profile");
                    }
                    context.getState().setInvite(invite);
                    context.getState().setProfileId(IdCanonicalizer.canonicalize(IdKind.PROFILE, invite.getProfileId()));
                    return StepOutcome.continueWith(invite);
                })
                .step("checkExistingShare", context -> shareRepository
                        .findConsistent(context.getState().getInvite().getProfileId(),
                                context.getCaller().getAccountId().getValue())
                        .map(existing -> {
                            context.getState().setShare(existing);
                            return StepOutcome.continueWith(existing);
                        })
                        .orElse(StepOutcome.skip()))
                .step("upsertShare", context -> {
                    Invite invite = context.getState().getInvite();
                    Share share = upsertShare(context.getState().getShare(), invite.getProfileId(),
                            context.getCaller().getAccountId().getValue(), invite.getOwnerAccountId(),
                            context.getCaller().getAccountId().getValue(), invite.getPermissions());
                    context.getState().setShare(share);
                    return StepOutcome.continueWith(share);
                })
                .step("markInviteUsed", context -> {
                    int rows = inviteRepository.markUsed(context.getArguments(),
                            context.getCaller().getAccountId().getValue(), Instant.now());
                    conditionalWriter.requireUpdated(rows, INVITE_USED_MESSAGE);
                    return StepOutcome.continueWith(rows);
                })
                .respond(context -> sharingMapper.toShareResponse(context.getState().getShare()));

        this.listInvitesPipeline = Pipeline.<Void, SharingState, List<InviteResponse>>named("listInvitesByProfile")
                .step(accessSteps.verifyProfileAccess(CallShape.QUERY))
                .step(accessSteps.checkSharePermissions(Permission.WRITE, CallShape.QUERY))
                .step(AccessSteps.authorized("listInvites", context -> {
                    context.getState().setInvites(inviteRepository
                            .findByProfileIdOrderByCreatedAtDesc(context.getState().getProfileId().getValue()));
                    return StepOutcome.continueWith(context.getState().getInvites());
                }))
                .respond(context -> context.getState().getInvites().stream()
                        .map(sharingMapper::toInviteResponse)
                        .toList());

        this.deleteInvitePipeline = Pipeline.<String, SharingState, Void>named("deleteProfileInvite")
                .step(accessSteps.requireOwner(CallShape.MUTATION))
                .step(AccessSteps.authorized("deleteInvite", context -> {
                    int rows = inviteRepository.deleteInvite(context.getArguments(),
                            context.getState().getProfileId().getValue());
                    return rows == 0 ? StepOutcome.skip() : StepOutcome.continueWith(rows);
                }))
                .respond(context -> null);

        this.shareDirectPipeline = Pipeline.<ShareRequest, SharingState, ShareResponse>named("shareProfileDirect")
                .step(accessSteps.requireOwner(CallShape.MUTATION))
                .step(AccessSteps.authorized("lookupAccountByEmail", context -> {
                    String email = context.getArguments().getTargetAccountEmail().trim();
                    Account target = accountRepository.findByEmailIgnoreCase(email)
                            .orElseThrow(() -> new ResourceNotFoundException("No account found with email " + email));
                    if (target.getAccountId().equals(context.getState().getProfile().getOwnerAccountId())) {
                        throw new BadRequestException("Cannot share a profile with its owner");
                    }
                    context.getState().setTargetAccountId(target.getAccountId());
                    return StepOutcome.continueWith(target);
                }))
                .step(AccessSteps.authorized("checkExistingShare", context -> shareRepository
                        .findConsistent(context.getState().getProfileId().getValue(), context.getState().getTargetAccountId())
                        .map(existing -> {
                            context.getState().setShare(existing);
                            return StepOutcome.continueWith(existing);
                        })
                        .orElse(StepOutcome.skip())))
                .step(AccessSteps.authorized("upsertShare", context -> {
                    SharingState state = context.getState();
                    Share share = upsertShare(state.getShare(), state.getProfileId().getValue(), state.getTargetAccountId(),
                            state.getProfile().getOwnerAccountId(), context.getCaller().getAccountId().getValue(),
                            context.getArguments().getPermissions());
                    state.setShare(share);
                    return StepOutcome.continueWith(share);
                }))
                .respond(context -> sharingMapper.toShareResponse(context.getState().getShare()));

        this.revokeSharePipeline = Pipeline.<CanonicalId, SharingState, Void>named("revokeShare")
                .step(accessSteps.requireOwner(CallShape.MUTATION))
                .step(AccessSteps.authorized("deleteShare", context -> {
                    int rows = shareRepository.deleteShare(context.getState().getProfileId().getValue(),
                            context.getArguments().getValue());
                    return rows == 0 ? StepOutcome.skip() : StepOutcome.continueWith(rows);
                }))
                .respond(context -> null);

        this.listSharesPipeline = Pipeline.<Void, SharingState, List<ShareResponse>>named("listSharesByProfile")
                .step(accessSteps.verifyProfileAccess(CallShape.QUERY))
                .step(accessSteps.checkSharePermissions(Permission.WRITE, CallShape.QUERY))
                .step(AccessSteps.authorized("listShares", context -> {
                    context.getState().setShares(shareRepository
                            .findByProfileId(context.getState().getProfileId().getValue()));
                    return StepOutcome.continueWith(context.getState().getShares());
                }))
                .respond(context -> context.getState().getShares().stream()
                        .map(sharingMapper::toShareResponse)
                        .toList());
    }

    @Override
    @Transactional
    public InviteResponse createProfileInvite(String profileId, InviteRequest request, CallerIdentity caller) {
        InviteResponse response = pipelineExecutor.execute(createInvitePipeline, caller, request, SharingState.of(profileId));
        log.info("Invite created: profile={}, permissions={}, expiresAt={}, by={}",
                response.getProfileId(), response.getPermissions(), response.getExpiresAt(), caller.getAccountId());
        return response;
    }

    @Override
    @Transactional
    public ShareResponse redeemProfileInvite(RedeemInviteRequest request, CallerIdentity caller) {
        String code = request.getInviteCode().trim().toUpperCase(Locale.ROOT);
        ShareResponse response = pipelineExecutor.execute(redeemInvitePipeline, caller, code, new SharingState());
        log.info("Invite redeemed: profile={}, account={}, permissions={}",
                response.getProfileId(), caller.getAccountId(), response.getPermissions());
        return response;
    }

    @Override
    @Transactional(readOnly = true)
    public List<InviteResponse> listInvitesByProfile(String profileId, CallerIdentity caller) {
        return pipelineExecutor.execute(listInvitesPipeline, caller, null, SharingState.of(profileId));
    }

    @Override
    @Transactional
    public void deleteProfileInvite(String profileId, String inviteCode, CallerIdentity caller) {
        String code = inviteCode == null ? "" : inviteCode.trim().toUpperCase(Locale.ROOT);
        pipelineExecutor.execute(deleteInvitePipeline, caller, code, SharingState.of(profileId));
        log.info("Invite deleted: profile={}, code={}, by={}", profileId, code, caller.getAccountId());
    }

    @Override
    @Transactional
    public ShareResponse shareProfileDirect(String profileId, ShareRequest request, CallerIdentity caller) {
        ShareResponse response = pipelineExecutor.execute(shareDirectPipeline, caller, request, SharingState.of(profileId));
        log.info("Profile shared: profile={}, target={}, permissions={}",
                response.getProfileId(), response.getTargetAccountId(), response.getPermissions());
        return response;
    }

    @Override
    @Transactional
    public void revokeShare(String profileId, String targetAccountId, CallerIdentity caller) {
        CanonicalId target = IdCanonicalizer.tryCanonicalize(IdKind.TARGET_ACCOUNT, targetAccountId)
                .orElseThrow(() -> new BadRequestException("Target account id is required"));
        pipelineExecutor.execute(revokeSharePipeline, caller, target, SharingState.of(profileId));
        log.info("Share revoked: profile={}, target={}, by={}", profileId, target, caller.getAccountId());
    }

    @Override
    @Transactional(readOnly = true)
    public List<ShareResponse> listSharesByProfile(String profileId, CallerIdentity caller) {
        return pipelineExecutor.execute(listSharesPipeline, caller, null, SharingState.of(profileId));
    }

    private Invite newInvite(SharingState state, InviteRequest request, CallerIdentity caller) {
        int days = request.getExpiresInDays() != null
                ? request.getExpiresInDays()
                : properties.getInvites().getExpiryDays();
        Instant now = Instant.now();

        Invite invite = new Invite();
        invite.setInviteCode(generateCode());
        invite.setProfileId(state.getProfileId().getValue());
        invite.setOwnerAccountId(state.getProfile().getOwnerAccountId());
        invite.setPermissions(EnumSet.copyOf(request.getPermissions()));
        invite.setCreatedBy(caller.getAccountId().getValue());
        invite.setCreatedAt(now);
        invite.setExpiresAt(now.plus(Duration.ofDays(days)));
        return invite;
    }

    private Share upsertShare(Share existing, String profileId, String targetAccountId, String ownerAccountId,
                              String createdBy, Set<Permission> permissions) {
        Share share = existing;
        if (share == null) {
            share = new Share();
            share.setProfileId(profileId);
            share.setTargetAccountId(targetAccountId);
        }
        share.setOwnerAccountId(ownerAccountId);
        share.setCreatedByAccountId(createdBy);
        share.setPermissions(EnumSet.copyOf(permissions));
        return shareRepository.save(share);
    }

    String generateCode() {
        int length = properties.getInvites().getCodeLength();
        StringBuilder code = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            code.append(CODE_ALPHABET.charAt(random.nextInt(CODE_ALPHABET.length())));
        }
        return code.toString();
    }

    @Getter
    @Setter
    static final class SharingState extends ProfileScopedState {

        private Invite invite;
        private Share share;
        private String targetAccountId;
        private List<Invite> invites = List.of();
        private List<Share> shares = List.of();

        static SharingState of(String rawProfileId) {
            SharingState state = new SharingState();
            state.setProfileId(IdCanonicalizer.tryCanonicalize(IdKind.PROFILE, rawProfileId).orElse(null));
            return state;
        }
    }
}
