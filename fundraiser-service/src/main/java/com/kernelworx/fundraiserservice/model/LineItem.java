package com.kernelworx.fundraiserservice.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Priced order line. Name and unit price are copied from the catalog at
 * pricing time.
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LineItem {

    @Column(name = "product_id", nullable = false)
    private String productId;

    private String productName;

    @Column(nullable = false)
    private Integer quantity;

    @Column(precision = 12, scale = 2, nullable = false)
    private BigDecimal pricePerUnit;

    @Column(precision = 12, scale = 2, nullable = false)
    private BigDecimal subtotal;
}
