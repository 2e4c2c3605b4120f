package com.kernelworx.fundraiserservice.mapper;

import com.kernelworx.fundraiserservice.dto.LineItemResponse;
import com.kernelworx.fundraiserservice.dto.OrderRequest;
import com.kernelworx.fundraiserservice.dto.OrderResponse;
import com.kernelworx.fundraiserservice.dto.UpdateOrderRequest;
import com.kernelworx.fundraiserservice.model.LineItem;
import com.kernelworx.fundraiserservice.model.Order;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.MappingTarget;
import org.mapstruct.NullValuePropertyMappingStrategy;
import org.mapstruct.ReportingPolicy;

import java.util.List;

@Mapper(componentModel = "spring"
        , unmappedTargetPolicy = ReportingPolicy.IGNORE
        , nullValuePropertyMappingStrategy = NullValuePropertyMappingStrategy.IGNORE)
public interface OrderMapper {

    /**
     * Customer fields only. Ids, line items and totals are set by the service.
     */
    @Mapping(target = "orderId", ignore = true)
    @Mapping(target = "profileId", ignore = true)
    @Mapping(target = "campaignId", ignore = true)
    @Mapping(target = "lineItems", ignore = true)
    @Mapping(target = "totalAmount", ignore = true)
    Order toOrder(OrderRequest request);

    OrderResponse toOrderResponse(Order order);

    LineItemResponse toLineItemResponse(LineItem lineItem);

    List<OrderResponse> toOrderResponses(List<Order> orders);

    @Mapping(target = "lineItems", ignore = true)
    @Mapping(target = "totalAmount", ignore = true)
    void updateOrderFromRequest(UpdateOrderRequest request, @MappingTarget Order order);
}
