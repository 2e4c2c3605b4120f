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

@Entity
@Table(name = "accounts")
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class Account {

    // ACCOUNT#<identity provider subject>
    @Id
    @ToString.Include
    @Column(name = "account_id")
    private String accountId;

    @Column(unique = true)
    private String email;

    private String givenName;
    private String familyName;
    private String city;
    private String state;
    private String unitType;
    private String unitNumber;

    @Column(name = "is_admin", nullable = false)
    private Boolean isAdmin = false;

    // Custom payment methods only; Cash and Check are never stored
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "account_payment_methods", joinColumns = @JoinColumn(name = "account_id"))
    @OrderColumn(name = "position")
    @Column(name = "name", nullable = false)
    private List<String> paymentMethods = new ArrayList<>();

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    private Long version;
}
