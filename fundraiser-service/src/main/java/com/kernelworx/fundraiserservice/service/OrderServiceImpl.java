package com.kernelworx.fundraiserservice.service;

import com.kernelworx.common.exception.BadRequestException;
import com.kernelworx.common.exception.ResourceNotFoundException;
import com.kernelworx.fundraiserservice.access.AccessSteps;
import com.kernelworx.fundraiserservice.access.ProfileScopedState;
import com.kernelworx.fundraiserservice.dto.OrderRequest;
import com.kernelworx.fundraiserservice.dto.OrderResponse;
import com.kernelworx.fundraiserservice.dto.UpdateOrderRequest;
import com.kernelworx.fundraiserservice.ids.CanonicalId;
import com.kernelworx.fundraiserservice.ids.IdCanonicalizer;
import com.kernelworx.fundraiserservice.ids.IdKind;
import com.kernelworx.fundraiserservice.mapper.OrderMapper;
import com.kernelworx.fundraiserservice.model.Account;
import com.kernelworx.fundraiserservice.model.Campaign;
import com.kernelworx.fundraiserservice.model.Catalog;
import com.kernelworx.fundraiserservice.model.Order;
import com.kernelworx.fundraiserservice.model.Permission;
import com.kernelworx.fundraiserservice.pipeline.CallShape;
import com.kernelworx.fundraiserservice.pipeline.Pipeline;
import com.kernelworx.fundraiserservice.pipeline.PipelineContext;
import com.kernelworx.fundraiserservice.pipeline.PipelineStep;
import com.kernelworx.fundraiserservice.pipeline.PipelineExecutor;
import com.kernelworx.fundraiserservice.pipeline.StepOutcome;
import com.kernelworx.fundraiserservice.pricing.OrderPricingEngine;
import com.kernelworx.fundraiserservice.pricing.PricedOrder;
import com.kernelworx.fundraiserservice.repository.AccountRepository;
import com.kernelworx.fundraiserservice.repository.CampaignRepository;
import com.kernelworx.fundraiserservice.repository.CatalogRepository;
import com.kernelworx.fundraiserservice.repository.OrderRepository;
import com.kernelworx.fundraiserservice.security.CallerIdentity;
import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Service
public class OrderServiceImpl implements OrderService {

    private static final Logger log = LoggerFactory.getLogger(OrderServiceImpl.class);

    private final OrderRepository orderRepository;
    private final CampaignRepository campaignRepository;
    private final CatalogRepository catalogRepository;
    private final AccountRepository accountRepository;
    private final OrderPricingEngine pricingEngine;
    private final PaymentMethodPolicy paymentMethodPolicy;
    private final OrderMapper orderMapper;
    private final PipelineExecutor pipelineExecutor;

    private final Pipeline<OrderRequest, OrderState, OrderResponse> createOrderPipeline;
    private final Pipeline<Void, OrderState, Optional<OrderResponse>> getOrderPipeline;
    private final Pipeline<Void, OrderState, List<OrderResponse>> listByCampaignPipeline;
    private final Pipeline<Void, OrderState, List<OrderResponse>> listByProfilePipeline;
    private final Pipeline<UpdateOrderRequest, OrderState, OrderResponse> updateOrderPipeline;
    private final Pipeline<Void, OrderState, Void> deleteOrderPipeline;

    public OrderServiceImpl(OrderRepository orderRepository,
                            CampaignRepository campaignRepository,
                            CatalogRepository catalogRepository,
                            AccountRepository accountRepository,
                            OrderPricingEngine pricingEngine,
                            PaymentMethodPolicy paymentMethodPolicy,
                            OrderMapper orderMapper,
                            AccessSteps accessSteps,
                            PipelineExecutor pipelineExecutor) {
        this.orderRepository = orderRepository;
        this.campaignRepository = campaignRepository;
        this.catalogRepository = catalogRepository;
        this.accountRepository = accountRepository;
        this.pricingEngine = pricingEngine;
        this.paymentMethodPolicy = paymentMethodPolicy;
        this.orderMapper = orderMapper;
        this.pipelineExecutor = pipelineExecutor;

        this.createOrderPipeline = Pipeline.<OrderRequest, OrderState, OrderResponse>named("createOrder")
                .step(accessSteps.verifyProfileAccess(CallShape.MUTATION))
                .step(accessSteps.checkSharePermissions(Permission.WRITE, CallShape.MUTATION))
                .step(AccessSteps.authorized("validatePaymentMethod", context ->
                        validatePaymentMethod(context.getState(), context.getArguments().getPaymentMethod())))
                .step(AccessSteps.authorized("lookupCampaign", context -> {
                    OrderState state = context.getState();
                    Campaign campaign = IdCanonicalizer.tryCanonicalize(IdKind.CAMPAIGN, context.getArguments().getCampaignId())
                            .flatMap(id -> campaignRepository.findById(id.getValue()))
                            .filter(found -> state.getProfileId().matches(found.getProfileId()))
                            .orElseThrow(() -> new ResourceNotFoundException("Campaign not found"));
                    state.setCampaign(campaign);
                    return StepOutcome.continueWith(campaign);
                }))
                .step(AccessSteps.authorized("lookupCatalog", this::lookupCatalog))
                .step(AccessSteps.authorized("priceLineItems", context -> {
                    PricedOrder priced = pricingEngine.price(context.getState().getCatalog(),
                            context.getArguments().getLineItems());
                    context.getState().setPriced(priced);
                    return StepOutcome.continueWith(priced);
                }))
                .step(AccessSteps.authorized("createOrder", context -> {
                    OrderState state = context.getState();
                    Order order = orderMapper.toOrder(context.getArguments());
                    order.setOrderId(IdCanonicalizer.newId(IdKind.ORDER).getValue());
                    order.setProfileId(state.getProfileId().getValue());
                    order.setCampaignId(state.getCampaign().getCampaignId());
                    order.setPaymentMethod(order.getPaymentMethod().trim());
                    if (order.getOrderDate() == null) {
                        order.setOrderDate(Instant.now());
                    }
                    applyPricing(order, state.getPriced());
                    Order saved = orderRepository.save(order);
                    state.setOrder(saved);
                    return StepOutcome.continueWith(saved);
                }))
                .respond(context -> orderMapper.toOrderResponse(context.getState().getOrder()));

        this.getOrderPipeline = Pipeline.<Void, OrderState, Optional<OrderResponse>>named("getOrder")
                .step(lookupOrder(false))
                .step(accessSteps.verifyProfileAccess(CallShape.QUERY))
                .step(accessSteps.checkSharePermissions(Permission.READ, CallShape.QUERY))
                .respond(context -> context.getState().isAuthorized() && !context.getState().isTargetMissing()
                        ? Optional.of(orderMapper.toOrderResponse(context.getState().getOrder()))
                        : Optional.empty());

        this.listByCampaignPipeline = Pipeline.<Void, OrderState, List<OrderResponse>>named("listOrdersByCampaign")
                .step(PipelineStep.of("lookupCampaign", context -> {
                    OrderState state = context.getState();
                    Optional<Campaign> campaign = state.getCampaignId() == null
                            ? Optional.empty()
                            : campaignRepository.findById(state.getCampaignId().getValue());
                    if (campaign.isEmpty()) {
                        state.setTargetMissing(true);
                        return StepOutcome.skip();
                    }
                    state.setCampaign(campaign.get());
                    state.setProfileId(IdCanonicalizer.canonicalize(IdKind.PROFILE, campaign.get().getProfileId()));
                    return StepOutcome.continueWith(campaign.get());
                }))
                .step(accessSteps.verifyProfileAccess(CallShape.QUERY))
                .step(accessSteps.checkSharePermissions(Permission.READ, CallShape.QUERY))
                .step(AccessSteps.authorized("listOrders", context -> {
                    OrderState state = context.getState();
                    state.setOrders(orderRepository.findByCampaignIdOrderByCreatedAtAsc(state.getCampaign().getCampaignId()));
                    return StepOutcome.continueWith(state.getOrders());
                }))
                .respond(this::toResponses);

        this.listByProfilePipeline = Pipeline.<Void, OrderState, List<OrderResponse>>named("listOrdersByProfile")
                .step(accessSteps.verifyProfileAccess(CallShape.QUERY))
                .step(accessSteps.checkSharePermissions(Permission.READ, CallShape.QUERY))
                .step(AccessSteps.authorized("listOrders", context -> {
                    OrderState state = context.getState();
                    state.setOrders(orderRepository.findByProfileIdOrderByCreatedAtAsc(state.getProfileId().getValue()));
                    return StepOutcome.continueWith(state.getOrders());
                }))
                .respond(this::toResponses);

        this.updateOrderPipeline = Pipeline.<UpdateOrderRequest, OrderState, OrderResponse>named("updateOrder")
                .step(lookupOrder(true))
                .step(accessSteps.verifyProfileAccess(CallShape.MUTATION))
                .step(accessSteps.checkSharePermissions(Permission.WRITE, CallShape.MUTATION))
                .step(AccessSteps.authorized("validatePaymentMethod", context -> {
                    String requested = context.getArguments().getPaymentMethod();
                    if (requested == null || requested.trim().equalsIgnoreCase(context.getState().getOrder().getPaymentMethod())) {
                        return StepOutcome.skip();
                    }
                    return validatePaymentMethod(context.getState(), requested);
                }))
                .step(AccessSteps.authorized("lookupCatalog", context -> {
                    if (context.getArguments().getLineItems() == null) {
                        return StepOutcome.skip();
                    }
                    OrderState state = context.getState();
                    Campaign campaign = campaignRepository.findById(state.getOrder().getCampaignId())
                            .orElseThrow(() -> new ResourceNotFoundException("Campaign not found"));
                    state.setCampaign(campaign);
                    return lookupCatalog(context);
                }))
                .step(AccessSteps.authorized("priceLineItems", context -> {
                    if (context.getArguments().getLineItems() == null) {
                        return StepOutcome.skip();
                    }
                    PricedOrder priced = pricingEngine.price(context.getState().getCatalog(),
                            context.getArguments().getLineItems());
                    context.getState().setPriced(priced);
                    return StepOutcome.continueWith(priced);
                }))
                // nothing on the stored order changes before this step
                .step(AccessSteps.authorized("updateOrder", context -> {
                    OrderState state = context.getState();
                    Order order = state.getOrder();
                    UpdateOrderRequest request = context.getArguments();
                    if (request.getCustomerName() != null && request.getCustomerName().isBlank()) {
                        throw new BadRequestException("Customer name cannot be blank");
                    }
                    orderMapper.updateOrderFromRequest(request, order);
                    if (request.getPaymentMethod() != null) {
                        order.setPaymentMethod(request.getPaymentMethod().trim());
                    }
                    if (state.getPriced() != null) {
                        applyPricing(order, state.getPriced());
                    }
                    Order saved = orderRepository.save(order);
                    state.setOrder(saved);
                    return StepOutcome.continueWith(saved);
                }))
                .respond(context -> orderMapper.toOrderResponse(context.getState().getOrder()));

        this.deleteOrderPipeline = Pipeline.<Void, OrderState, Void>named("deleteOrder")
                .step(lookupOrder(false))
                .step(accessSteps.verifyProfileAccess(CallShape.MUTATION))
                .step(accessSteps.checkSharePermissions(Permission.WRITE, CallShape.MUTATION))
                .step(AccessSteps.authorized("deleteOrder", context -> {
                    orderRepository.delete(context.getState().getOrder());
                    return StepOutcome.continueWith(null);
                }))
                .respond(context -> null);
    }

    @Override
    @Transactional
    public OrderResponse createOrder(OrderRequest request, CallerIdentity caller) {
        OrderState state = new OrderState();
        state.setProfileId(IdCanonicalizer.tryCanonicalize(IdKind.PROFILE, request.getProfileId()).orElse(null));
        OrderResponse response = pipelineExecutor.execute(createOrderPipeline, caller, request, state);
        log.info("Order created: id={}, campaign={}, total={}, items={}, by={}",
                response.getOrderId(), response.getCampaignId(), response.getTotalAmount(),
                response.getLineItems().size(), caller.getAccountId());
        return response;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<OrderResponse> getOrder(String orderId, CallerIdentity caller) {
        return pipelineExecutor.execute(getOrderPipeline, caller, null, OrderState.forOrder(orderId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<OrderResponse> listOrdersByCampaign(String campaignId, CallerIdentity caller) {
        OrderState state = new OrderState();
        state.setCampaignId(IdCanonicalizer.tryCanonicalize(IdKind.CAMPAIGN, campaignId).orElse(null));
        return pipelineExecutor.execute(listByCampaignPipeline, caller, null, state);
    }

    @Override
    @Transactional(readOnly = true)
    public List<OrderResponse> listOrdersByProfile(String profileId, CallerIdentity caller) {
        OrderState state = new OrderState();
        state.setProfileId(IdCanonicalizer.tryCanonicalize(IdKind.PROFILE, profileId).orElse(null));
        return pipelineExecutor.execute(listByProfilePipeline, caller, null, state);
    }

    @Override
    @Transactional
    public OrderResponse updateOrder(String orderId, UpdateOrderRequest request, CallerIdentity caller) {
        OrderResponse response = pipelineExecutor.execute(updateOrderPipeline, caller, request, OrderState.forOrder(orderId));
        log.info("Order updated: id={}, total={}, by={}", response.getOrderId(), response.getTotalAmount(),
                caller.getAccountId());
        return response;
    }

    @Override
    @Transactional
    public void deleteOrder(String orderId, CallerIdentity caller) {
        OrderState state = OrderState.forOrder(orderId);
        pipelineExecutor.execute(deleteOrderPipeline, caller, null, state);
        if (state.isTargetMissing()) {
            log.debug("Order {} already absent, delete is a no-op", orderId);
        } else {
            log.info("Order deleted: id={}, by={}", state.getOrderId(), caller.getAccountId());
        }
    }

    private <A> PipelineStep<A, OrderState> lookupOrder(boolean required) {
        return PipelineStep.of("lookupOrder", context -> {
            OrderState state = context.getState();
            Optional<Order> order = state.getOrderId() == null
                    ? Optional.empty()
                    : orderRepository.findById(state.getOrderId().getValue());
            if (order.isEmpty()) {
                if (required) {
                    throw new ResourceNotFoundException("Order not found");
                }
                state.setTargetMissing(true);
                return StepOutcome.skip();
            }
            state.setOrder(order.get());
            state.setProfileId(IdCanonicalizer.canonicalize(IdKind.PROFILE, order.get().getProfileId()));
            return StepOutcome.continueWith(order.get());
        });
    }

    private <A> StepOutcome lookupCatalog(PipelineContext<A, OrderState> context) {
        OrderState state = context.getState();
        Catalog catalog = catalogRepository.findById(state.getCampaign().getCatalogId())
                .orElseThrow(() -> new ResourceNotFoundException("Catalog not found"));
        state.setCatalog(catalog);
        return StepOutcome.continueWith(catalog);
    }

    /**
     * Payment methods belong to the profile owner, not to the caller.
     */
    private StepOutcome validatePaymentMethod(OrderState state, String paymentMethod) {
        List<String> ownerMethods = accountRepository.findById(state.getProfile().getOwnerAccountId())
                .map(Account::getPaymentMethods)
                .orElse(List.of());
        if (!paymentMethodPolicy.isAvailable(ownerMethods, paymentMethod)) {
            log.warn("Rejected payment method '{}' for profile {}", paymentMethod, state.getProfileId());
            throw new BadRequestException("Payment method '" + paymentMethod + "' is not available for this profile");
        }
        return StepOutcome.continueWith(paymentMethod.trim());
    }

    private void applyPricing(Order order, PricedOrder priced) {
        order.setLineItems(new ArrayList<>(priced.getLineItems()));
        order.setTotalAmount(priced.getTotalAmount());
    }

    private List<OrderResponse> toResponses(PipelineContext<Void, OrderState> context) {
        if (!context.getState().isAuthorized() || context.getState().isTargetMissing()) {
            return List.of();
        }
        return orderMapper.toOrderResponses(context.getState().getOrders());
    }

    @Getter
    @Setter
    static final class OrderState extends ProfileScopedState {

        private CanonicalId orderId;
        private CanonicalId campaignId;
        private Order order;
        private Campaign campaign;
        private Catalog catalog;
        private PricedOrder priced;
        private List<Order> orders = List.of();

        static OrderState forOrder(String rawOrderId) {
            OrderState state = new OrderState();
            state.setOrderId(IdCanonicalizer.tryCanonicalize(IdKind.ORDER, rawOrderId).orElse(null));
            return state;
        }
    }
}
