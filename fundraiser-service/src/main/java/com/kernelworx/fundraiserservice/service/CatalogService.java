package com.kernelworx.fundraiserservice.service;

import com.kernelworx.fundraiserservice.dto.CatalogRequest;
import com.kernelworx.fundraiserservice.dto.CatalogResponse;
import com.kernelworx.fundraiserservice.security.CallerIdentity;

import java.util.List;
import java.util.Optional;

public interface CatalogService {

    CatalogResponse createCatalog(CatalogRequest request, CallerIdentity caller);

    Optional<CatalogResponse> getCatalog(String catalogId, CallerIdentity caller);

    List<CatalogResponse> listPublicCatalogs();

    List<CatalogResponse> listMyCatalogs(CallerIdentity caller);

    List<CatalogResponse> listManagedCatalogs();

    CatalogResponse updateCatalog(String catalogId, CatalogRequest request, CallerIdentity caller);

    void deleteCatalog(String catalogId, CallerIdentity caller);
}
