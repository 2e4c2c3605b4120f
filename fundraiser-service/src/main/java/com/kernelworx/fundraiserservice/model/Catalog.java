package com.kernelworx.fundraiserservice.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Entity
@Table(name = "catalogs", indexes = @Index(name = "idx_catalogs_owner", columnList = "owner_account_id"))
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class Catalog {

    @Id
    @ToString.Include
    @Column(name = "catalog_id")
    private String catalogId;

    @Column(nullable = false)
    private String catalogName;

    @Enumerated(EnumType.STRING)
    @Column(name = "catalog_type", nullable = false)
    private CatalogType catalogType;

    @Column(name = "owner_account_id", nullable = false)
    private String ownerAccountId;

    @Column(name = "is_public", nullable = false)
    private Boolean isPublic = false;

    // Soft delete: campaigns created earlier keep resolving their catalog
    @Column(name = "is_deleted", nullable = false)
    private Boolean isDeleted = false;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "catalog_products", joinColumns = @JoinColumn(name = "catalog_id"))
    @OrderColumn(name = "position")
    private List<Product> products = new ArrayList<>();

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    private Long version;

    public Optional<Product> findProduct(String productId) {
        return products.stream()
                .filter(product -> product.getProductId().equals(productId))
                .findFirst();
    }
}
