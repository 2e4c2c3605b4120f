package com.kernelworx.fundraiserservice.model;

import com.kernelworx.common.model.Address;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "orders", indexes = {
        @Index(name = "idx_orders_campaign", columnList = "campaign_id"),
        @Index(name = "idx_orders_profile", columnList = "profile_id")
})
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class Order {

    @Id
    @ToString.Include
    @Column(name = "order_id")
    private String orderId;

    @ToString.Include
    @Column(name = "campaign_id", nullable = false)
    private String campaignId;

    @Column(name = "profile_id", nullable = false)
    private String profileId;

    @Column(nullable = false)
    private String customerName;

    private String customerPhone;

    @Embedded
    private Address customerAddress;

    @Column(nullable = false)
    private String paymentMethod;

    private Instant orderDate;

    @Column(length = 2000)
    private String notes;

    // Always produced by the pricing engine, never copied from a request
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "order_line_items", joinColumns = @JoinColumn(name = "order_id"))
    @OrderColumn(name = "line_index")
    private List<LineItem> lineItems = new ArrayList<>();

    @Column(precision = 12, scale = 2, nullable = false)
    private BigDecimal totalAmount;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    private Long version;
}
