package com.kernelworx.fundraiserservice.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Product {

    @Column(name = "product_id", nullable = false)
    private String productId;

    @Column(nullable = false)
    private String productName;

    @Column(length = 1000)
    private String description;

    @Column(precision = 12, scale = 2, nullable = false)
    private BigDecimal price;

    private Integer sortOrder;
}
