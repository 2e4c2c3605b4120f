package com.kernelworx.fundraiserservice.service;

import com.kernelworx.common.exception.BadRequestException;
import com.kernelworx.common.exception.ResourceNotFoundException;
import com.kernelworx.fundraiserservice.access.AccessSteps;
import com.kernelworx.fundraiserservice.access.ProfileScopedState;
import com.kernelworx.fundraiserservice.dto.PaymentMethodResponse;
import com.kernelworx.fundraiserservice.ids.IdCanonicalizer;
import com.kernelworx.fundraiserservice.ids.IdKind;
import com.kernelworx.fundraiserservice.model.Account;
import com.kernelworx.fundraiserservice.model.Permission;
import com.kernelworx.fundraiserservice.pipeline.CallShape;
import com.kernelworx.fundraiserservice.pipeline.Pipeline;
import com.kernelworx.fundraiserservice.pipeline.PipelineExecutor;
import com.kernelworx.fundraiserservice.pipeline.StepOutcome;
import com.kernelworx.fundraiserservice.repository.AccountRepository;
import com.kernelworx.fundraiserservice.security.CallerIdentity;
import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;

@Service
public class PaymentMethodServiceImpl implements PaymentMethodService {

    private static final Logger log = LoggerFactory.getLogger(PaymentMethodServiceImpl.class);

    private final AccountService accountService;
    private final AccountRepository accountRepository;
    private final PaymentMethodPolicy paymentMethodPolicy;
    private final PipelineExecutor pipelineExecutor;

    private final Pipeline<Void, ProfileMethodsState, List<PaymentMethodResponse>> forProfilePipeline;

    public PaymentMethodServiceImpl(AccountService accountService,
                                    AccountRepository accountRepository,
                                    PaymentMethodPolicy paymentMethodPolicy,
                                    AccessSteps accessSteps,
                                    PipelineExecutor pipelineExecutor) {
        this.accountService = accountService;
        this.accountRepository = accountRepository;
        this.paymentMethodPolicy = paymentMethodPolicy;
        this.pipelineExecutor = pipelineExecutor;

        this.forProfilePipeline = Pipeline.<Void, ProfileMethodsState, List<PaymentMethodResponse>>named("paymentMethodsForProfile")
                .step(accessSteps.verifyProfileAccess(CallShape.QUERY))
                .step(accessSteps.checkSharePermissions(Permission.READ, CallShape.QUERY))
                .step(AccessSteps.authorized("readOwnerMethods", context -> {
                    context.getState().setMethods(accountRepository
                            .findById(context.getState().getProfile().getOwnerAccountId())
                            .map(Account::getPaymentMethods)
                            .orElse(List.of()));
                    return StepOutcome.continueWith(context.getState().getMethods());
                }))
                .respond(context -> {
                    if (!context.getState().isAuthorized() || context.getState().isTargetMissing()) {
                        return List.of();
                    }
                    return toResponses(context.getState().getMethods());
                });
    }

    @Override
    @Transactional
    public List<PaymentMethodResponse> myPaymentMethods(CallerIdentity caller) {
        return toResponses(accountService.provision(caller).getPaymentMethods());
    }

    @Override
    @Transactional(readOnly = true)
    public List<PaymentMethodResponse> paymentMethodsForProfile(String profileId, CallerIdentity caller) {
        ProfileMethodsState state = new ProfileMethodsState();
        state.setProfileId(IdCanonicalizer.tryCanonicalize(IdKind.PROFILE, profileId).orElse(null));
        return pipelineExecutor.execute(forProfilePipeline, caller, null, state);
    }

    @Override
    @Transactional
    public PaymentMethodResponse createPaymentMethod(String name, CallerIdentity caller) {
        Account account = accountService.provision(caller);
        String validated = paymentMethodPolicy.validateName(name, account.getPaymentMethods(), null);
        account.getPaymentMethods().add(validated);
        accountRepository.save(account);
        log.info("Payment method '{}' created for account {}", validated, caller.getAccountId());
        return custom(validated);
    }

    @Override
    @Transactional
    public PaymentMethodResponse updatePaymentMethod(String currentName, String newName, CallerIdentity caller) {
        if (paymentMethodPolicy.isReserved(currentName)) {
            throw new BadRequestException("'" + currentName.trim() + "' is a built-in payment method and cannot be changed");
        }
        Account account = accountService.provision(caller);
        List<String> methods = account.getPaymentMethods();
        int index = indexOf(methods, currentName);
        if (index < 0) {
            throw new ResourceNotFoundException("Payment method '" + currentName + "' not found");
        }
        String validated = paymentMethodPolicy.validateName(newName, methods, methods.get(index));
        methods.set(index, validated);
        accountRepository.save(account);
        log.info("Payment method renamed for account {}: '{}' -> '{}'", caller.getAccountId(), currentName, validated);
        return custom(validated);
    }

    @Override
    @Transactional
    public void deletePaymentMethod(String name, CallerIdentity caller) {
        if (paymentMethodPolicy.isReserved(name)) {
            throw new BadRequestException("'" + name.trim() + "' is a built-in payment method and cannot be deleted");
        }
        Account account = accountService.provision(caller);
        int index = indexOf(account.getPaymentMethods(), name);
        if (index < 0) {
            log.debug("Payment method '{}' already absent for account {}", name, caller.getAccountId());
            return;
        }
        account.getPaymentMethods().remove(index);
        accountRepository.save(account);
        log.info("Payment method '{}' deleted for account {}", name, caller.getAccountId());
    }

    private int indexOf(List<String> methods, String name) {
        if (name == null) {
            return -1;
        }
        String trimmed = name.trim();
        for (int i = 0; i < methods.size(); i++) {
            if (methods.get(i).equalsIgnoreCase(trimmed)) {
                return i;
            }
        }
        return -1;
    }

    private List<PaymentMethodResponse> toResponses(Collection<String> custom) {
        return paymentMethodPolicy.withBuiltIns(custom).stream()
                .map(name -> PaymentMethodResponse.builder()
                        .name(name)
                        .builtIn(paymentMethodPolicy.isReserved(name))
                        .build())
                .toList();
    }

    private PaymentMethodResponse custom(String name) {
        return PaymentMethodResponse.builder().name(name).builtIn(false).build();
    }

    @Getter
    @Setter
    static final class ProfileMethodsState extends ProfileScopedState {

        private List<String> methods = List.of();
    }
}
