package com.kernelworx.fundraiserservice.dto;

import com.kernelworx.fundraiserservice.model.CatalogType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.List;

@Data
public class CatalogRequest {

    @NotBlank(message = "Catalog name cannot be blank")
    @Size(max = 100)
    private String catalogName;

    private Boolean isPublic;

    // ADMIN_MANAGED is reserved for administrators
    private CatalogType catalogType;

    @NotEmpty(message = "Catalog must have at least one product")
    @Valid
    private List<ProductRequest> products;
}
