package com.kernelworx.fundraiserservice.dto;

import com.kernelworx.common.model.Address;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderResponse {

    private String orderId;
    private String campaignId;
    private String profileId;
    private String customerName;
    private String customerPhone;
    private Address customerAddress;
    private String paymentMethod;
    private Instant orderDate;
    private String notes;
    private List<LineItemResponse> lineItems;
    private BigDecimal totalAmount;
    private Instant createdAt;
    private Instant updatedAt;
}
