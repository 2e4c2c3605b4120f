package com.kernelworx.fundraiserservice.service;

import com.kernelworx.common.exception.BadRequestException;
import com.kernelworx.fundraiserservice.access.AccessDecision;
import com.kernelworx.fundraiserservice.access.AccessSteps;
import com.kernelworx.fundraiserservice.access.ProfileScopedState;
import com.kernelworx.fundraiserservice.dto.ProfileRequest;
import com.kernelworx.fundraiserservice.dto.ProfileResponse;
import com.kernelworx.fundraiserservice.dto.TransferOwnershipRequest;
import com.kernelworx.fundraiserservice.ids.CanonicalId;
import com.kernelworx.fundraiserservice.ids.IdCanonicalizer;
import com.kernelworx.fundraiserservice.ids.IdKind;
import com.kernelworx.fundraiserservice.mapper.ProfileMapper;
import com.kernelworx.fundraiserservice.model.Campaign;
import com.kernelworx.fundraiserservice.model.Permission;
import com.kernelworx.fundraiserservice.model.SellerProfile;
import com.kernelworx.fundraiserservice.model.Share;
import com.kernelworx.fundraiserservice.pipeline.CallShape;
import com.kernelworx.fundraiserservice.pipeline.Pipeline;
import com.kernelworx.fundraiserservice.pipeline.PipelineExecutor;
import com.kernelworx.fundraiserservice.pipeline.PipelineStep;
import com.kernelworx.fundraiserservice.pipeline.StepOutcome;
import com.kernelworx.fundraiserservice.repository.CampaignRepository;
import com.kernelworx.fundraiserservice.repository.InviteRepository;
import com.kernelworx.fundraiserservice.repository.OrderRepository;
import com.kernelworx.fundraiserservice.repository.SellerProfileRepository;
import com.kernelworx.fundraiserservice.repository.ShareRepository;
import com.kernelworx.fundraiserservice.security.CallerIdentity;
import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class ProfileServiceImpl implements ProfileService {

    private static final Logger log = LoggerFactory.getLogger(ProfileServiceImpl.class);

    private final SellerProfileRepository profileRepository;
    private final ShareRepository shareRepository;
    private final InviteRepository inviteRepository;
    private final CampaignRepository campaignRepository;
    private final OrderRepository orderRepository;
    private final ProfileMapper profileMapper;
    private final PipelineExecutor pipelineExecutor;

    private final Pipeline<Void, ProfileState, Optional<ProfileResponse>> getProfilePipeline;
    private final Pipeline<ProfileRequest, ProfileState, ProfileResponse> updateProfilePipeline;
    private final Pipeline<Void, ProfileState, Void> deleteProfilePipeline;
    private final Pipeline<CanonicalId, ProfileState, ProfileResponse> transferOwnershipPipeline;

    public ProfileServiceImpl(SellerProfileRepository profileRepository,
                              ShareRepository shareRepository,
                              InviteRepository inviteRepository,
                              CampaignRepository campaignRepository,
                              OrderRepository orderRepository,
                              ProfileMapper profileMapper,
                              AccessSteps accessSteps,
                              PipelineExecutor pipelineExecutor) {
        this.profileRepository = profileRepository;
        this.shareRepository = shareRepository;
        this.inviteRepository = inviteRepository;
        this.campaignRepository = campaignRepository;
        this.orderRepository = orderRepository;
        this.profileMapper = profileMapper;
        this.pipelineExecutor = pipelineExecutor;

        this.getProfilePipeline = Pipeline.<Void, ProfileState, Optional<ProfileResponse>>named("getProfile")
                .step(accessSteps.verifyProfileAccess(CallShape.QUERY))
                .step(accessSteps.checkSharePermissions(Permission.READ, CallShape.QUERY))
                .respond(context -> context.getState().isAuthorized()
                        ? Optional.of(toResponse(context.getState()))
                        : Optional.empty());

        this.updateProfilePipeline = Pipeline.<ProfileRequest, ProfileState, ProfileResponse>named("updateSellerProfile")
                .step(accessSteps.verifyProfileAccess(CallShape.MUTATION))
                .step(accessSteps.checkSharePermissions(Permission.WRITE, CallShape.MUTATION))
                .step(AccessSteps.authorized("updateProfile", context -> {
                    SellerProfile profile = context.getState().getProfile();
                    profileMapper.updateProfileFromRequest(context.getArguments(), profile);
                    return StepOutcome.continueWith(profileRepository.save(profile));
                }))
                .respond(context -> toResponse(context.getState()));

        this.deleteProfilePipeline = Pipeline.<Void, ProfileState, Void>named("deleteSellerProfile")
                .step(PipelineStep.of("lookupProfileForDelete", context -> {
                    ProfileState state = context.getState();
                    if (state.getProfileId() == null || !profileRepository.existsById(state.getProfileId().getValue())) {
                        state.setTargetMissing(true);
                        return StepOutcome.skip();
                    }
                    return StepOutcome.continueWith(state.getProfileId());
                }))
                .step(accessSteps.requireOwner(CallShape.MUTATION))
                .step(AccessSteps.authorized("deleteInvites", context -> StepOutcome.continueWith(
                        inviteRepository.deleteAllForProfile(context.getState().getProfileId().getValue()))))
                .step(AccessSteps.authorized("deleteShares", context -> StepOutcome.continueWith(
                        shareRepository.deleteAllForProfile(context.getState().getProfileId().getValue()))))
                .step(AccessSteps.authorized("deleteCampaignsAndOrders", context -> {
                    List<Campaign> campaigns = campaignRepository
                            .findByProfileIdOrderByStartDateDesc(context.getState().getProfileId().getValue());
                    for (Campaign campaign : campaigns) {
                        orderRepository.deleteAll(orderRepository.findByCampaignIdOrderByCreatedAtAsc(campaign.getCampaignId()));
                    }
                    campaignRepository.deleteAll(campaigns);
                    return StepOutcome.continueWith(campaigns.size());
                }))
                .step(AccessSteps.authorized("deleteProfile", context -> {
                    profileRepository.delete(context.getState().getProfile());
                    return StepOutcome.continueWith(null);
                }))
                .respond(context -> null);

        this.transferOwnershipPipeline = Pipeline.<CanonicalId, ProfileState, ProfileResponse>named("transferProfileOwnership")
                .step(accessSteps.requireOwner(CallShape.MUTATION))
                .step(AccessSteps.authorized("verifyNewOwnerShare", context -> {
                    ProfileState state = context.getState();
                    CanonicalId newOwner = context.getArguments();
                    if (context.getCaller().getAccountId().matches(newOwner.getValue())) {
                        throw new BadRequestException("You already own this profile");
                    }
                    Share share = shareRepository.findConsistent(state.getProfileId().getValue(), newOwner.getValue())
                            .orElseThrow(() -> new BadRequestException("New owner must have existing access to the profile"));
                    state.setNewOwnerShare(share);
                    return StepOutcome.continueWith(share);
                }))
                .step(AccessSteps.authorized("updateOwner", context -> {
                    SellerProfile profile = context.getState().getProfile();
                    profile.setOwnerAccountId(context.getArguments().getValue());
                    return StepOutcome.continueWith(profileRepository.save(profile));
                }))
                .step(AccessSteps.authorized("deleteNewOwnerShare", context -> StepOutcome.continueWith(
                        shareRepository.deleteShare(context.getState().getProfileId().getValue(),
                                context.getArguments().getValue()))))
                // the former owner keeps no implicit access
                .respond(context -> profileMapper.toProfileResponse(context.getState().getProfile(), AccessDecision.denied()));
    }

    @Override
    @Transactional
    public ProfileResponse createSellerProfile(ProfileRequest request, CallerIdentity caller) {
        SellerProfile profile = profileMapper.toProfile(request);
        profile.setProfileId(IdCanonicalizer.newId(IdKind.PROFILE).getValue());
        profile.setOwnerAccountId(caller.getAccountId().getValue());

        SellerProfile saved = profileRepository.save(profile);
        log.info("Profile created: id={}, sellerName='{}', owner={}",
                saved.getProfileId(), saved.getSellerName(), caller.getAccountId());
        return profileMapper.toProfileResponse(saved, AccessDecision.owner());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ProfileResponse> getProfile(String profileId, CallerIdentity caller) {
        return pipelineExecutor.execute(getProfilePipeline, caller, null, ProfileState.of(profileId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<ProfileResponse> listMyProfiles(CallerIdentity caller) {
        return profileRepository.findByOwnerAccountIdOrderByCreatedAtAsc(caller.getAccountId().getValue()).stream()
                .map(profile -> profileMapper.toProfileResponse(profile, AccessDecision.owner()))
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<ProfileResponse> listSharedProfiles(CallerIdentity caller) {
        Map<String, Share> sharesByProfile = shareRepository.findByTargetAccountId(caller.getAccountId().getValue())
                .stream()
                .filter(share -> share.getPermissions() != null && !share.getPermissions().isEmpty())
                .collect(Collectors.toMap(Share::getProfileId, Function.identity()));
        if (sharesByProfile.isEmpty()) {
            return List.of();
        }
        return profileRepository.findByProfileIdIn(sharesByProfile.keySet()).stream()
                .map(profile -> profileMapper.toProfileResponse(profile,
                        AccessDecision.shared(sharesByProfile.get(profile.getProfileId()).getPermissions())))
                .toList();
    }

    @Override
    @Transactional
    public ProfileResponse updateSellerProfile(String profileId, ProfileRequest request, CallerIdentity caller) {
        ProfileResponse response = pipelineExecutor.execute(updateProfilePipeline, caller, request, ProfileState.of(profileId));
        log.info("Profile updated: id={}, by={}", response.getProfileId(), caller.getAccountId());
        return response;
    }

    @Override
    @Transactional
    public void deleteSellerProfile(String profileId, CallerIdentity caller) {
        ProfileState state = ProfileState.of(profileId);
        pipelineExecutor.execute(deleteProfilePipeline, caller, null, state);
        if (state.isTargetMissing()) {
            log.debug("Profile {} already absent, delete is a no-op", profileId);
        } else {
            log.info("Profile deleted: id={}, owner={}", state.getProfileId(), caller.getAccountId());
        }
    }

    @Override
    @Transactional
    public ProfileResponse transferProfileOwnership(String profileId, TransferOwnershipRequest request,
                                                    CallerIdentity caller) {
        CanonicalId newOwner = IdCanonicalizer.tryCanonicalize(IdKind.TARGET_ACCOUNT, request.getNewOwnerAccountId())
                .orElseThrow(() -> new BadRequestException("New owner account id is required"));
        ProfileResponse response = pipelineExecutor.execute(transferOwnershipPipeline, caller, newOwner,
                ProfileState.of(profileId));
        log.info("Profile ownership transferred: id={}, from={}, to={}",
                response.getProfileId(), caller.getAccountId(), newOwner);
        return response;
    }

    private ProfileResponse toResponse(ProfileState state) {
        return profileMapper.toProfileResponse(state.getProfile(), state.getAccess());
    }

    @Getter
    @Setter
    static final class ProfileState extends ProfileScopedState {

        private Share newOwnerShare;

        static ProfileState of(String rawProfileId) {
            ProfileState state = new ProfileState();
            state.setProfileId(IdCanonicalizer.tryCanonicalize(IdKind.PROFILE, rawProfileId).orElse(null));
            return state;
        }
    }
}
