package com.kernelworx.fundraiserservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogResponse {

    private String catalogId;
    private String catalogName;
    private String catalogType;
    private String ownerAccountId;
    private Boolean isPublic;
    private List<ProductResponse> products;
    private Instant createdAt;
    private Instant updatedAt;
}
