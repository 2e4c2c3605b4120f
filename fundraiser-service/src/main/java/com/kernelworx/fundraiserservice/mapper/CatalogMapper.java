package com.kernelworx.fundraiserservice.mapper;

import com.kernelworx.fundraiserservice.dto.CatalogResponse;
import com.kernelworx.fundraiserservice.dto.ProductResponse;
import com.kernelworx.fundraiserservice.ids.IdCanonicalizer;
import com.kernelworx.fundraiserservice.model.Catalog;
import com.kernelworx.fundraiserservice.model.Product;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

@Mapper(componentModel = "spring"
        , imports = IdCanonicalizer.class
        , unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface CatalogMapper {

    @Mapping(target = "catalogType", expression = "java(catalog.getCatalogType() != null ? catalog.getCatalogType().name() : null)")
    @Mapping(target = "ownerAccountId", expression = "java(IdCanonicalizer.strip(catalog.getOwnerAccountId()))")
    CatalogResponse toCatalogResponse(Catalog catalog);

    ProductResponse toProductResponse(Product product);
}
