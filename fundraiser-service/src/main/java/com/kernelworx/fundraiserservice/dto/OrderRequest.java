package com.kernelworx.fundraiserservice.dto;

import com.kernelworx.common.model.Address;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.time.Instant;
import java.util.List;

@Data
public class OrderRequest {

    @NotBlank(message = "Profile id is required")
    private String profileId;

    @NotBlank(message = "Campaign id is required")
    private String campaignId;

    @NotBlank(message = "Customer name cannot be blank")
    @Size(max = 100)
    private String customerName;

    @Size(max = 30)
    private String customerPhone;

    @Valid
    private Address customerAddress;

    @NotBlank(message = "Payment method is required")
    private String paymentMethod;

    private Instant orderDate;

    @Size(max = 2000)
    private String notes;

    private List<@NotNull @Valid LineItemRequest> lineItems;
}
