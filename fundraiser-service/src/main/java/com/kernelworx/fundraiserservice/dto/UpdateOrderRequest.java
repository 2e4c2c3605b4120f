package com.kernelworx.fundraiserservice.dto;

import com.kernelworx.common.model.Address;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.time.Instant;
import java.util.List;

@Data
public class UpdateOrderRequest {

    @Size(max = 100)
    private String customerName;

    @Size(max = 30)
    private String customerPhone;

    @Valid
    private Address customerAddress;

    private String paymentMethod;
    private Instant orderDate;

    @Size(max = 2000)
    private String notes;

    // null keeps the stored items and total
    private List<@NotNull @Valid LineItemRequest> lineItems;
}
