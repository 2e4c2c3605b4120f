package com.kernelworx.fundraiserservice.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * Requested order line. Prices are looked up in the catalog, so none are accepted here.
 */
@Data
public class LineItemRequest {

    @NotBlank(message = "Product id is required")
    private String productId;

    @NotNull(message = "Quantity is required")
    private Integer quantity;
}
