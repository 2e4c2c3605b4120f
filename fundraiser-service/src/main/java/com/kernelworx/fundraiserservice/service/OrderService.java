package com.kernelworx.fundraiserservice.service;

import com.kernelworx.fundraiserservice.dto.OrderRequest;
import com.kernelworx.fundraiserservice.dto.OrderResponse;
import com.kernelworx.fundraiserservice.dto.UpdateOrderRequest;
import com.kernelworx.fundraiserservice.security.CallerIdentity;

import java.util.List;
import java.util.Optional;

public interface OrderService {

    OrderResponse createOrder(OrderRequest request, CallerIdentity caller);

    Optional<OrderResponse> getOrder(String orderId, CallerIdentity caller);

    List<OrderResponse> listOrdersByCampaign(String campaignId, CallerIdentity caller);

    List<OrderResponse> listOrdersByProfile(String profileId, CallerIdentity caller);

    /**
     * Line items, when present, replace the stored ones and are repriced from the catalog.
     */
    OrderResponse updateOrder(String orderId, UpdateOrderRequest request, CallerIdentity caller);

    void deleteOrder(String orderId, CallerIdentity caller);
}
