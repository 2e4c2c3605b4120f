package com.kernelworx.fundraiserservice.service;

import com.kernelworx.common.exception.AccessDeniedException;
import com.kernelworx.common.exception.BadRequestException;
import com.kernelworx.common.exception.ConflictException;
import com.kernelworx.common.exception.ErrorKind;
import com.kernelworx.common.exception.ResourceNotFoundException;
import com.kernelworx.fundraiserservice.config.FundraiserProperties;
import com.kernelworx.fundraiserservice.dto.SharedCampaignRequest;
import com.kernelworx.fundraiserservice.dto.SharedCampaignResponse;
import com.kernelworx.fundraiserservice.dto.UpdateSharedCampaignRequest;
import com.kernelworx.fundraiserservice.ids.IdCanonicalizer;
import com.kernelworx.fundraiserservice.ids.IdKind;
import com.kernelworx.fundraiserservice.mapper.SharedCampaignMapper;
import com.kernelworx.fundraiserservice.model.Account;
import com.kernelworx.fundraiserservice.model.SharedCampaignTemplate;
import com.kernelworx.fundraiserservice.pipeline.Pipeline;
import com.kernelworx.fundraiserservice.pipeline.PipelineExecutor;
import com.kernelworx.fundraiserservice.pipeline.PipelineStep;
import com.kernelworx.fundraiserservice.pipeline.StepOutcome;
import com.kernelworx.fundraiserservice.repository.AccountRepository;
import com.kernelworx.fundraiserservice.repository.CatalogRepository;
import com.kernelworx.fundraiserservice.repository.SharedCampaignRepository;
import com.kernelworx.fundraiserservice.security.CallerIdentity;
import com.kernelworx.fundraiserservice.store.ConditionalWriter;
import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Service
public class SharedCampaignServiceImpl implements SharedCampaignService {

    private static final Logger log = LoggerFactory.getLogger(SharedCampaignServiceImpl.class);

    static final String DUPLICATE_CODE_MESSAGE = "A Shared Campaign with this code already exists. Please try again.";

    private final SharedCampaignRepository sharedCampaignRepository;
    private final CatalogRepository catalogRepository;
    private final AccountRepository accountRepository;
    private final SharedCampaignMapper sharedCampaignMapper;
    private final ConditionalWriter conditionalWriter;
    private final FundraiserProperties properties;
    private final PipelineExecutor pipelineExecutor;

    private final Pipeline<SharedCampaignRequest, TemplateState, SharedCampaignResponse> createPipeline;

    public SharedCampaignServiceImpl(SharedCampaignRepository sharedCampaignRepository,
                                     CatalogRepository catalogRepository,
                                     AccountRepository accountRepository,
                                     SharedCampaignMapper sharedCampaignMapper,
                                     ConditionalWriter conditionalWriter,
                                     FundraiserProperties properties,
                                     PipelineExecutor pipelineExecutor) {
        this.sharedCampaignRepository = sharedCampaignRepository;
        this.catalogRepository = catalogRepository;
        this.accountRepository = accountRepository;
        this.sharedCampaignMapper = sharedCampaignMapper;
        this.conditionalWriter = conditionalWriter;
        this.properties = properties;
        this.pipelineExecutor = pipelineExecutor;

        this.createPipeline = Pipeline.<SharedCampaignRequest, TemplateState, SharedCampaignResponse>named("createSharedCampaign")
                .step("countCreatorTemplates", context -> {
                    long count = sharedCampaignRepository.countByCreatedBy(context.getCaller().getAccountId().getValue());
                    int max = properties.getSharedCampaigns().getMaxPerCreator();
                    if (count >= max) {
                        throw new BadRequestException("You can create at most " + max + " shared campaigns");
                    }
                    return StepOutcome.continueWith(count);
                })
                .step("verifyCatalog", context -> {
                    String catalogId = IdCanonicalizer.canonicalize(IdKind.CATALOG, context.getArguments().getCatalogId().trim())
                            .getValue();
                    catalogRepository.findById(catalogId)
                            .filter(catalog -> !Boolean.TRUE.equals(catalog.getIsDeleted()))
                            .orElseThrow(() -> new ResourceNotFoundException("Catalog not found"));
                    context.getState().setCatalogId(catalogId);
                    return StepOutcome.continueWith(catalogId);
                })
                .step(PipelineStep.of("createSharedCampaign", context -> {
                            SharedCampaignTemplate template = buildTemplate(context.getArguments(),
                                    context.getState().getCatalogId(), context.getCaller());
                            SharedCampaignTemplate saved = conditionalWriter.insertIfAbsent(sharedCampaignRepository, template);
                            context.getState().setTemplate(saved);
                            return StepOutcome.continueWith(saved);
                        },
                        (error, context) -> StepOutcome.abort(error.getKind() == ErrorKind.CONFLICT
                                ? new ConflictException(DUPLICATE_CODE_MESSAGE, error)
                                : error)))
                .respond(context -> sharedCampaignMapper.toSharedCampaignResponse(context.getState().getTemplate()));
    }

    @Override
    @Transactional
    public SharedCampaignResponse createSharedCampaign(SharedCampaignRequest request, CallerIdentity caller) {
        SharedCampaignResponse response = pipelineExecutor.execute(createPipeline, caller, request, new TemplateState());
        log.info("Shared campaign created: code={}, catalog={}, by={}",
                response.getSharedCampaignCode(), response.getCatalogId(), caller.getAccountId());
        return response;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<SharedCampaignResponse> getSharedCampaign(String sharedCampaignCode) {
        return findTemplate(sharedCampaignCode).map(sharedCampaignMapper::toSharedCampaignResponse);
    }

    @Override
    @Transactional(readOnly = true)
    public List<SharedCampaignResponse> listMySharedCampaigns(CallerIdentity caller) {
        return sharedCampaignRepository.findByCreatedByOrderByCreatedAtDesc(caller.getAccountId().getValue()).stream()
                .map(sharedCampaignMapper::toSharedCampaignResponse)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<SharedCampaignResponse> findSharedCampaigns(String unitType, String unitNumber, String city,
                                                            String state, String campaignName, Integer campaignYear) {
        String key = UnitCampaignKeys.discoveryKey(unitType, unitNumber, city, state, campaignName, campaignYear);
        if (key == null) {
            throw new BadRequestException("unitType, unitNumber, city, state, campaignName and campaignYear are required");
        }
        return sharedCampaignRepository.findByUnitCampaignKey(key).stream()
                .filter(SharedCampaignTemplate::isActiveOrUnset)
                .map(sharedCampaignMapper::toSharedCampaignResponse)
                .toList();
    }

    @Override
    @Transactional
    public SharedCampaignResponse updateSharedCampaign(String sharedCampaignCode, UpdateSharedCampaignRequest request,
                                                       CallerIdentity caller) {
        SharedCampaignTemplate template = findTemplate(sharedCampaignCode)
                .orElseThrow(() -> new ResourceNotFoundException("Shared campaign not found"));
        requireCreator(template, caller, "update");

        sharedCampaignMapper.updateTemplateFromRequest(request, template);
        SharedCampaignTemplate updated = sharedCampaignRepository.save(template);
        log.info("Shared campaign updated: code={}, active={}", updated.getSharedCampaignCode(), updated.isActiveOrUnset());
        return sharedCampaignMapper.toSharedCampaignResponse(updated);
    }

    @Override
    @Transactional
    public void deleteSharedCampaign(String sharedCampaignCode, CallerIdentity caller) {
        Optional<SharedCampaignTemplate> template = findTemplate(sharedCampaignCode);
        if (template.isEmpty()) {
            log.debug("Shared campaign {} already absent, delete is a no-op", sharedCampaignCode);
            return;
        }
        requireCreator(template.get(), caller, "delete");
        sharedCampaignRepository.delete(template.get());
        log.info("Shared campaign deleted: code={}, by={}", template.get().getSharedCampaignCode(), caller.getAccountId());
    }

    private Optional<SharedCampaignTemplate> findTemplate(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        return sharedCampaignRepository.findById(code.trim().toUpperCase(Locale.ROOT));
    }

    private void requireCreator(SharedCampaignTemplate template, CallerIdentity caller, String action) {
        if (!caller.getAccountId().matches(template.getCreatedBy())) {
            log.warn("Access denied: User {} attempted to {} shared campaign {} created by {}",
                    caller.getAccountId(), action, template.getSharedCampaignCode(), template.getCreatedBy());
            throw new AccessDeniedException("You are not authorized to " + action + " this shared campaign");
        }
    }

    private SharedCampaignTemplate buildTemplate(SharedCampaignRequest request, String catalogId, CallerIdentity caller) {
        SharedCampaignTemplate template = sharedCampaignMapper.toTemplate(request);
        template.setSharedCampaignCode(UnitCampaignKeys.sharedCampaignCode(request.getUnitType(),
                request.getUnitNumber(), request.getCampaignName(), request.getState(), request.getCampaignYear()));
        template.setCatalogId(catalogId);
        template.setUnitType(request.getUnitType().trim());
        template.setUnitNumber(request.getUnitNumber().trim());
        template.setCity(request.getCity().trim());
        template.setState(request.getState().trim());
        template.setCampaignName(request.getCampaignName().trim());
        template.setUnitCampaignKey(UnitCampaignKeys.discoveryKey(request.getUnitType(), request.getUnitNumber(),
                request.getCity(), request.getState(), request.getCampaignName(), request.getCampaignYear()));
        template.setCreatedBy(caller.getAccountId().getValue());
        template.setCreatedByName(creatorName(caller));
        template.setIsActive(true);
        return template;
    }

    private String creatorName(CallerIdentity caller) {
        Optional<Account> account = accountRepository.findById(caller.getAccountId().getValue());
        String given = account.map(Account::getGivenName).orElse(caller.getGivenName());
        String family = account.map(Account::getFamilyName).orElse(caller.getFamilyName());
        String name = Stream.of(given, family)
                .filter(part -> part != null && !part.isBlank())
                .collect(Collectors.joining(" "));
        return name.isEmpty() ? caller.getEmail() : name;
    }

    @Getter
    @Setter
    static final class TemplateState {

        private String catalogId;
        private SharedCampaignTemplate template;
    }
}
