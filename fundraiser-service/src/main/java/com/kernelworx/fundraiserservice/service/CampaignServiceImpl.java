package com.kernelworx.fundraiserservice.service;

import com.kernelworx.common.exception.BadRequestException;
import com.kernelworx.common.exception.ResourceNotFoundException;
import com.kernelworx.fundraiserservice.access.AccessResolver;
import com.kernelworx.fundraiserservice.access.AccessSteps;
import com.kernelworx.fundraiserservice.access.ProfileScopedState;
import com.kernelworx.fundraiserservice.dto.CampaignRequest;
import com.kernelworx.fundraiserservice.dto.CampaignResponse;
import com.kernelworx.fundraiserservice.dto.UpdateCampaignRequest;
import com.kernelworx.fundraiserservice.ids.CanonicalId;
import com.kernelworx.fundraiserservice.ids.IdCanonicalizer;
import com.kernelworx.fundraiserservice.ids.IdKind;
import com.kernelworx.fundraiserservice.mapper.CampaignMapper;
import com.kernelworx.fundraiserservice.model.Campaign;
import com.kernelworx.fundraiserservice.model.Permission;
import com.kernelworx.fundraiserservice.model.Share;
import com.kernelworx.fundraiserservice.model.SharedCampaignTemplate;
import com.kernelworx.fundraiserservice.pipeline.CallShape;
import com.kernelworx.fundraiserservice.pipeline.Pipeline;
import com.kernelworx.fundraiserservice.pipeline.PipelineExecutor;
import com.kernelworx.fundraiserservice.pipeline.PipelineStep;
import com.kernelworx.fundraiserservice.pipeline.StepOutcome;
import com.kernelworx.fundraiserservice.repository.CampaignRepository;
import com.kernelworx.fundraiserservice.repository.CatalogRepository;
import com.kernelworx.fundraiserservice.repository.OrderRepository;
import com.kernelworx.fundraiserservice.repository.ShareRepository;
import com.kernelworx.fundraiserservice.repository.SharedCampaignRepository;
import com.kernelworx.fundraiserservice.security.CallerIdentity;
import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

@Service
public class CampaignServiceImpl implements CampaignService {

    private static final Logger log = LoggerFactory.getLogger(CampaignServiceImpl.class);

    private final CampaignRepository campaignRepository;
    private final OrderRepository orderRepository;
    private final CatalogRepository catalogRepository;
    private final SharedCampaignRepository sharedCampaignRepository;
    private final ShareRepository shareRepository;
    private final AccessResolver accessResolver;
    private final CampaignMapper campaignMapper;
    private final PipelineExecutor pipelineExecutor;

    private final Pipeline<CampaignRequest, CampaignState, CampaignResponse> createCampaignPipeline;
    private final Pipeline<Void, CampaignState, Optional<CampaignResponse>> getCampaignPipeline;
    private final Pipeline<Void, CampaignState, List<CampaignResponse>> listCampaignsPipeline;
    private final Pipeline<UpdateCampaignRequest, CampaignState, CampaignResponse> updateCampaignPipeline;
    private final Pipeline<Void, CampaignState, Void> deleteCampaignPipeline;

    public CampaignServiceImpl(CampaignRepository campaignRepository,
                               OrderRepository orderRepository,
                               CatalogRepository catalogRepository,
                               SharedCampaignRepository sharedCampaignRepository,
                               ShareRepository shareRepository,
                               AccessResolver accessResolver,
                               CampaignMapper campaignMapper,
                               AccessSteps accessSteps,
                               PipelineExecutor pipelineExecutor) {
        this.campaignRepository = campaignRepository;
        this.orderRepository = orderRepository;
        this.catalogRepository = catalogRepository;
        this.sharedCampaignRepository = sharedCampaignRepository;
        this.shareRepository = shareRepository;
        this.accessResolver = accessResolver;
        this.campaignMapper = campaignMapper;
        this.pipelineExecutor = pipelineExecutor;

        this.createCampaignPipeline = Pipeline.<CampaignRequest, CampaignState, CampaignResponse>named("createCampaign")
                .step(accessSteps.verifyProfileAccess(CallShape.MUTATION))
                .step(accessSteps.checkSharePermissions(Permission.WRITE, CallShape.MUTATION))
                .step(AccessSteps.authorized("resolveSharedCampaign", context -> {
                    String code = context.getArguments().getSharedCampaignCode();
                    if (code == null || code.isBlank()) {
                        return StepOutcome.skip();
                    }
                    String normalized = code.trim().toUpperCase(Locale.ROOT);
                    SharedCampaignTemplate template = sharedCampaignRepository.findById(normalized)
                            .orElseThrow(() -> new ResourceNotFoundException("Shared campaign " + normalized + " not found"));
                    if (!template.isActiveOrUnset()) {
                        throw new BadRequestException("Shared campaign " + normalized + " is no longer active");
                    }
                    context.getState().setTemplate(template);
                    return StepOutcome.continueWith(template);
                }))
                .step(AccessSteps.authorized("buildCampaign", context -> {
                    Campaign campaign = buildCampaign(context.getArguments(), context.getState());
                    context.getState().setCampaign(campaign);
                    return StepOutcome.continueWith(campaign);
                }))
                .step(AccessSteps.authorized("verifyCatalog", context ->
                        StepOutcome.continueWith(requireCatalog(context.getState().getCampaign().getCatalogId()))))
                .step(AccessSteps.authorized("createCampaign", context -> {
                    Campaign saved = campaignRepository.save(context.getState().getCampaign());
                    context.getState().setCampaign(saved);
                    return StepOutcome.continueWith(saved);
                }))
                .step(AccessSteps.authorized("shareWithCreator", context -> shareWithCreator(
                        context.getArguments(), context.getState())))
                .respond(context -> toResponse(context.getState().getCampaign()));

        this.getCampaignPipeline = Pipeline.<Void, CampaignState, Optional<CampaignResponse>>named("getCampaign")
                .step(lookupCampaign(false))
                .step(accessSteps.verifyProfileAccess(CallShape.QUERY))
                .step(accessSteps.checkSharePermissions(Permission.READ, CallShape.QUERY))
                .respond(context -> context.getState().isAuthorized() && !context.getState().isTargetMissing()
                        ? Optional.of(toResponse(context.getState().getCampaign()))
                        : Optional.empty());

        this.listCampaignsPipeline = Pipeline.<Void, CampaignState, List<CampaignResponse>>named("listCampaignsByProfile")
                .step(accessSteps.verifyProfileAccess(CallShape.QUERY))
                .step(accessSteps.checkSharePermissions(Permission.READ, CallShape.QUERY))
                .step(AccessSteps.authorized("listCampaigns", context -> {
                    context.getState().setCampaigns(campaignRepository
                            .findByProfileIdOrderByStartDateDesc(context.getState().getProfileId().getValue()));
                    return StepOutcome.continueWith(context.getState().getCampaigns());
                }))
                .respond(context -> context.getState().getCampaigns().stream()
                        .map(this::toResponse)
                        .toList());

        this.updateCampaignPipeline = Pipeline.<UpdateCampaignRequest, CampaignState, CampaignResponse>named("updateCampaign")
                .step(lookupCampaign(true))
                .step(accessSteps.verifyProfileAccess(CallShape.MUTATION))
                .step(accessSteps.checkSharePermissions(Permission.WRITE, CallShape.MUTATION))
                .step(AccessSteps.authorized("verifyCatalog", context -> {
                    String catalogId = context.getArguments().getCatalogId();
                    if (catalogId == null) {
                        return StepOutcome.skip();
                    }
                    String canonical = IdCanonicalizer.tryCanonicalize(IdKind.CATALOG, catalogId)
                            .map(CanonicalId::getValue)
                            .orElseThrow(() -> new BadRequestException("Catalog id cannot be blank"));
                    requireCatalog(canonical);
                    context.getState().getCampaign().setCatalogId(canonical);
                    return StepOutcome.continueWith(canonical);
                }))
                .step(AccessSteps.authorized("updateCampaign", context -> {
                    Campaign campaign = context.getState().getCampaign();
                    campaignMapper.updateCampaignFromRequest(context.getArguments(), campaign);
                    validateUnit(campaign);
                    validateDates(campaign);
                    campaign.setUnitCampaignKey(UnitCampaignKeys.discoveryKey(campaign.getUnitType(),
                            campaign.getUnitNumber(), campaign.getCity(), campaign.getState(),
                            campaign.getCampaignName(), campaign.getCampaignYear()));
                    Campaign saved = campaignRepository.save(campaign);
                    context.getState().setCampaign(saved);
                    return StepOutcome.continueWith(saved);
                }))
                .respond(context -> toResponse(context.getState().getCampaign()));

        this.deleteCampaignPipeline = Pipeline.<Void, CampaignState, Void>named("deleteCampaign")
                .step(lookupCampaign(false))
                .step(accessSteps.verifyProfileAccess(CallShape.MUTATION))
                .step(accessSteps.checkSharePermissions(Permission.WRITE, CallShape.MUTATION))
                .step(AccessSteps.authorized("deleteOrders", context -> {
                    var orders = orderRepository.findByCampaignIdOrderByCreatedAtAsc(
                            context.getState().getCampaign().getCampaignId());
                    orderRepository.deleteAll(orders);
                    return StepOutcome.continueWith(orders.size());
                }))
                .step(AccessSteps.authorized("deleteCampaign", context -> {
                    campaignRepository.delete(context.getState().getCampaign());
                    return StepOutcome.continueWith(null);
                }))
                .respond(context -> null);
    }

    @Override
    @Transactional
    public CampaignResponse createCampaign(CampaignRequest request, CallerIdentity caller) {
        CampaignState state = new CampaignState();
        state.setProfileId(IdCanonicalizer.tryCanonicalize(IdKind.PROFILE, request.getProfileId()).orElse(null));
        CampaignResponse response = pipelineExecutor.execute(createCampaignPipeline, caller, request, state);
        log.info("Campaign created: id={}, profile={}, name='{}', year={}, by={}",
                response.getCampaignId(), response.getProfileId(), response.getCampaignName(),
                response.getCampaignYear(), caller.getAccountId());
        return response;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<CampaignResponse> getCampaign(String campaignId, CallerIdentity caller) {
        return pipelineExecutor.execute(getCampaignPipeline, caller, null, CampaignState.forCampaign(campaignId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<CampaignResponse> listCampaignsByProfile(String profileId, CallerIdentity caller) {
        CampaignState state = new CampaignState();
        state.setProfileId(IdCanonicalizer.tryCanonicalize(IdKind.PROFILE, profileId).orElse(null));
        return pipelineExecutor.execute(listCampaignsPipeline, caller, null, state);
    }

    @Override
    @Transactional
    public CampaignResponse updateCampaign(String campaignId, UpdateCampaignRequest request, CallerIdentity caller) {
        CampaignResponse response = pipelineExecutor.execute(updateCampaignPipeline, caller, request,
                CampaignState.forCampaign(campaignId));
        log.info("Campaign updated: id={}, by={}", response.getCampaignId(), caller.getAccountId());
        return response;
    }

    @Override
    @Transactional
    public void deleteCampaign(String campaignId, CallerIdentity caller) {
        CampaignState state = CampaignState.forCampaign(campaignId);
        pipelineExecutor.execute(deleteCampaignPipeline, caller, null, state);
        if (state.isTargetMissing()) {
            log.debug("Campaign {} already absent, delete is a no-op", campaignId);
        } else {
            log.info("Campaign deleted: id={}, by={}", state.getCampaignId(), caller.getAccountId());
        }
    }

    /**
     * Loads the campaign and hands its profile to the access steps.
     *
     * @param required NotFound when absent; otherwise the target is marked missing
     */
    private <A> PipelineStep<A, CampaignState> lookupCampaign(boolean required) {
        return PipelineStep.of("lookupCampaign", context -> {
            CampaignState state = context.getState();
            Optional<Campaign> campaign = state.getCampaignId() == null
                    ? Optional.empty()
                    : campaignRepository.findById(state.getCampaignId().getValue());
            if (campaign.isEmpty()) {
                if (required) {
                    throw new ResourceNotFoundException("Campaign not found");
                }
                state.setTargetMissing(true);
                return StepOutcome.skip();
            }
            state.setCampaign(campaign.get());
            state.setProfileId(IdCanonicalizer.canonicalize(IdKind.PROFILE, campaign.get().getProfileId()));
            return StepOutcome.continueWith(campaign.get());
        });
    }

    private Campaign buildCampaign(CampaignRequest request, CampaignState state) {
        SharedCampaignTemplate template = state.getTemplate();

        Campaign campaign = new Campaign();
        campaign.setCampaignId(IdCanonicalizer.newId(IdKind.CAMPAIGN).getValue());
        campaign.setProfileId(state.getProfileId().getValue());
        campaign.setCampaignName(firstNonBlank(request.getCampaignName(), template == null ? null : template.getCampaignName()));
        campaign.setCampaignYear(request.getCampaignYear() != null || template == null
                ? request.getCampaignYear()
                : template.getCampaignYear());
        campaign.setStartDate(request.getStartDate() != null || template == null
                ? request.getStartDate()
                : template.getStartDate());
        campaign.setEndDate(request.getEndDate() != null || template == null
                ? request.getEndDate()
                : template.getEndDate());
        String catalogId = firstNonBlank(request.getCatalogId(), template == null ? null : template.getCatalogId());
        campaign.setCatalogId(catalogId == null ? null : IdCanonicalizer.canonicalize(IdKind.CATALOG, catalogId).getValue());
        campaign.setUnitType(firstNonBlank(request.getUnitType(), template == null ? null : template.getUnitType()));
        campaign.setUnitNumber(firstNonBlank(request.getUnitNumber(), template == null ? null : template.getUnitNumber()));
        campaign.setCity(firstNonBlank(request.getCity(), template == null ? null : template.getCity()));
        campaign.setState(firstNonBlank(request.getState(), template == null ? null : template.getState()));
        if (template != null) {
            campaign.setSharedCampaignCode(template.getSharedCampaignCode());
        }

        if (campaign.getCampaignName() == null) {
            throw new BadRequestException("Campaign name is required");
        }
        if (campaign.getCampaignYear() == null) {
            throw new BadRequestException("Campaign year is required");
        }
        if (campaign.getCatalogId() == null) {
            throw new BadRequestException("Catalog id is required");
        }
        if (campaign.getStartDate() == null) {
            throw new BadRequestException("Start date is required");
        }
        validateUnit(campaign);
        validateDates(campaign);

        campaign.setUnitCampaignKey(UnitCampaignKeys.discoveryKey(campaign.getUnitType(), campaign.getUnitNumber(),
                campaign.getCity(), campaign.getState(), campaign.getCampaignName(), campaign.getCampaignYear()));
        return campaign;
    }

    private StepOutcome shareWithCreator(CampaignRequest request, CampaignState state) {
        SharedCampaignTemplate template = state.getTemplate();
        if (template == null || !Boolean.TRUE.equals(request.getShareWithCreator())) {
            return StepOutcome.skip();
        }
        CanonicalId creator = IdCanonicalizer.canonicalize(IdKind.ACCOUNT, template.getCreatedBy());
        // owner or existing share: nothing to grant
        if (accessResolver.resolve(creator, state.getProfileId(), Permission.READ).isAuthorized()) {
            return StepOutcome.skip();
        }
        // a share row without usable permissions is upgraded in place
        Share share = shareRepository.findConsistent(state.getProfileId().getValue(), creator.getValue())
                .orElseGet(() -> {
                    Share created = new Share();
                    created.setProfileId(state.getProfileId().getValue());
                    created.setTargetAccountId(creator.getValue());
                    return created;
                });
        share.setOwnerAccountId(state.getProfile().getOwnerAccountId());
        share.setCreatedByAccountId(state.getProfile().getOwnerAccountId());
        share.setPermissions(EnumSet.of(Permission.READ));
        Share saved = shareRepository.save(share);
        log.info("Profile {} shared with campaign creator {} (READ)", state.getProfileId(), creator);
        return StepOutcome.continueWith(saved);
    }

    private String requireCatalog(String catalogId) {
        return catalogRepository.findById(catalogId)
                .filter(catalog -> !Boolean.TRUE.equals(catalog.getIsDeleted()))
                .map(catalog -> catalog.getCatalogId())
                .orElseThrow(() -> new ResourceNotFoundException("Catalog not found"));
    }

    private void validateUnit(Campaign campaign) {
        if (!isBlank(campaign.getUnitType())
                && (isBlank(campaign.getUnitNumber()) || isBlank(campaign.getCity()) || isBlank(campaign.getState()))) {
            throw new BadRequestException("Unit number, city and state are required when unit type is set");
        }
    }

    private void validateDates(Campaign campaign) {
        if (campaign.getEndDate() != null && campaign.getStartDate() != null
                && campaign.getEndDate().isBefore(campaign.getStartDate())) {
            throw new BadRequestException("End date cannot be before start date");
        }
    }

    private CampaignResponse toResponse(Campaign campaign) {
        return campaignMapper.toCampaignResponse(campaign, orderRepository.summarize(campaign.getCampaignId()));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String firstNonBlank(String preferred, String fallback) {
        if (preferred != null && !preferred.isBlank()) {
            return preferred.trim();
        }
        return fallback;
    }

    @Getter
    @Setter
    static final class CampaignState extends ProfileScopedState {

        private CanonicalId campaignId;
        private Campaign campaign;
        private SharedCampaignTemplate template;
        private List<Campaign> campaigns = List.of();

        static CampaignState forCampaign(String rawCampaignId) {
            CampaignState state = new CampaignState();
            state.setCampaignId(IdCanonicalizer.tryCanonicalize(IdKind.CAMPAIGN, rawCampaignId).orElse(null));
            return state;
        }
    }
}
