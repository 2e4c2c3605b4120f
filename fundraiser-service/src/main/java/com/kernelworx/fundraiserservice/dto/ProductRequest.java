package com.kernelworx.fundraiserservice.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class ProductRequest {

    // present when updating an existing product
    private String productId;

    @NotBlank(message = "Product name cannot be blank")
    @Size(max = 100)
    private String productName;

    @Size(max = 1000)
    private String description;

    @NotNull(message = "Price is required")
    @DecimalMin(value = "0.01", message = "Price must be greater than zero")
    @Digits(integer = 10, fraction = 2, message = "Price must have at most two decimal places")
    private BigDecimal price;

    private Integer sortOrder;
}
