package com.kernelworx.fundraiserservice.service;

import com.kernelworx.common.exception.AccessDeniedException;
import com.kernelworx.common.exception.BadRequestException;
import com.kernelworx.common.exception.ResourceNotFoundException;
import com.kernelworx.fundraiserservice.dto.CatalogRequest;
import com.kernelworx.fundraiserservice.dto.CatalogResponse;
import com.kernelworx.fundraiserservice.dto.ProductRequest;
import com.kernelworx.fundraiserservice.ids.CanonicalId;
import com.kernelworx.fundraiserservice.ids.IdCanonicalizer;
import com.kernelworx.fundraiserservice.ids.IdKind;
import com.kernelworx.fundraiserservice.mapper.CatalogMapper;
import com.kernelworx.fundraiserservice.model.Catalog;
import com.kernelworx.fundraiserservice.model.CatalogType;
import com.kernelworx.fundraiserservice.model.Product;
import com.kernelworx.fundraiserservice.repository.CampaignRepository;
import com.kernelworx.fundraiserservice.repository.CatalogRepository;
import com.kernelworx.fundraiserservice.security.CallerIdentity;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class CatalogServiceImpl implements CatalogService {

    private static final Logger log = LoggerFactory.getLogger(CatalogServiceImpl.class);

    private final CatalogRepository catalogRepository;
    private final CampaignRepository campaignRepository;
    private final CatalogMapper catalogMapper;

    @Override
    @Transactional
    public CatalogResponse createCatalog(CatalogRequest request, CallerIdentity caller) {
        CatalogType type = request.getCatalogType() == null ? CatalogType.USER_CREATED : request.getCatalogType();
        if (type == CatalogType.ADMIN_MANAGED && !caller.isAdmin()) {
            log.warn("Access denied: User {} attempted to create an admin-managed catalog", caller.getAccountId());
            throw new AccessDeniedException("Only administrators can create managed catalogs");
        }
        requireProducts(request);

        Catalog catalog = new Catalog();
        catalog.setCatalogId(IdCanonicalizer.newId(IdKind.CATALOG).getValue());
        catalog.setCatalogName(request.getCatalogName().trim());
        catalog.setCatalogType(type);
        catalog.setOwnerAccountId(caller.getAccountId().getValue());
        catalog.setIsPublic(Boolean.TRUE.equals(request.getIsPublic()));
        catalog.setIsDeleted(false);
        catalog.setProducts(buildProducts(request.getProducts(), Set.of()));

        Catalog saved = catalogRepository.save(catalog);
        log.info("Catalog created: id={}, name='{}', type={}, products={}, owner={}",
                saved.getCatalogId(), saved.getCatalogName(), type, saved.getProducts().size(), caller.getAccountId());
        return catalogMapper.toCatalogResponse(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<CatalogResponse> getCatalog(String catalogId, CallerIdentity caller) {
        return IdCanonicalizer.tryCanonicalize(IdKind.CATALOG, catalogId)
                .flatMap(id -> catalogRepository.findById(id.getValue()))
                .filter(catalog -> !Boolean.TRUE.equals(catalog.getIsDeleted()))
                .filter(catalog -> isVisibleTo(catalog, caller))
                .map(catalogMapper::toCatalogResponse);
    }

    @Override
    @Transactional(readOnly = true)
    public List<CatalogResponse> listPublicCatalogs() {
        return catalogRepository.findByIsPublicTrueAndIsDeletedFalse().stream()
                .map(catalogMapper::toCatalogResponse)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<CatalogResponse> listMyCatalogs(CallerIdentity caller) {
        return catalogRepository.findByOwnerAccountIdAndIsDeletedFalse(caller.getAccountId().getValue()).stream()
                .map(catalogMapper::toCatalogResponse)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<CatalogResponse> listManagedCatalogs() {
        return catalogRepository.findByCatalogTypeAndIsDeletedFalse(CatalogType.ADMIN_MANAGED).stream()
                .map(catalogMapper::toCatalogResponse)
                .toList();
    }

    @Override
    @Transactional
    public CatalogResponse updateCatalog(String catalogId, CatalogRequest request, CallerIdentity caller) {
        Catalog catalog = findActiveCatalog(catalogId)
                .orElseThrow(() -> new ResourceNotFoundException("Catalog not found"));
        if (!canModify(catalog, caller)) {
            log.warn("Access denied: User {} attempted to update catalog {} owned by {}",
                    caller.getAccountId(), catalog.getCatalogId(), catalog.getOwnerAccountId());
            throw new AccessDeniedException("You are not authorized to update this catalog");
        }
        if (request.getCatalogType() != null && request.getCatalogType() != catalog.getCatalogType()) {
            throw new BadRequestException("Catalog type cannot be changed");
        }
        requireProducts(request);

        Set<String> existingIds = catalog.getProducts().stream()
                .map(Product::getProductId)
                .collect(Collectors.toSet());
        catalog.setCatalogName(request.getCatalogName().trim());
        if (request.getIsPublic() != null) {
            catalog.setIsPublic(request.getIsPublic());
        }
        catalog.getProducts().clear();
        catalog.getProducts().addAll(buildProducts(request.getProducts(), existingIds));

        Catalog updated = catalogRepository.save(catalog);
        log.info("Catalog updated: id={}, products={}, by={}",
                updated.getCatalogId(), updated.getProducts().size(), caller.getAccountId());
        return catalogMapper.toCatalogResponse(updated);
    }

    @Override
    @Transactional
    public void deleteCatalog(String catalogId, CallerIdentity caller) {
        Optional<Catalog> found = findActiveCatalog(catalogId);
        if (found.isEmpty()) {
            log.debug("Catalog {} already absent, delete is a no-op", catalogId);
            return;
        }
        Catalog catalog = found.get();
        if (!canModify(catalog, caller)) {
            log.warn("Access denied: User {} attempted to delete catalog {} owned by {}",
                    caller.getAccountId(), catalog.getCatalogId(), catalog.getOwnerAccountId());
            throw new AccessDeniedException("You are not authorized to delete this catalog");
        }
        long usage = campaignRepository.countByCatalogId(catalog.getCatalogId());
        if (usage > 0) {
            log.warn("Catalog {} delete blocked: used by {} campaign(s)", catalog.getCatalogId(), usage);
            throw new BadRequestException("Cannot delete catalog: " + usage
                    + " campaign(s) are using it. Please update or delete those campaigns first.");
        }
        catalog.setIsDeleted(true);
        catalogRepository.save(catalog);
        log.info("Catalog deleted: id={}, by={}", catalog.getCatalogId(), caller.getAccountId());
    }

    private Optional<Catalog> findActiveCatalog(String catalogId) {
        return IdCanonicalizer.tryCanonicalize(IdKind.CATALOG, catalogId)
                .flatMap(id -> catalogRepository.findById(id.getValue()))
                .filter(catalog -> !Boolean.TRUE.equals(catalog.getIsDeleted()));
    }

    private boolean isVisibleTo(Catalog catalog, CallerIdentity caller) {
        return Boolean.TRUE.equals(catalog.getIsPublic())
                || catalog.getCatalogType() == CatalogType.ADMIN_MANAGED
                || caller.getAccountId().matches(catalog.getOwnerAccountId());
    }

    private boolean canModify(Catalog catalog, CallerIdentity caller) {
        if (caller.getAccountId().matches(catalog.getOwnerAccountId())) {
            return true;
        }
        return catalog.getCatalogType() == CatalogType.ADMIN_MANAGED && caller.isAdmin();
    }

    private void requireProducts(CatalogRequest request) {
        if (request.getProducts() == null || request.getProducts().isEmpty()) {
            throw new BadRequestException("Catalog must have at least one product");
        }
    }

    /**
     * Keeps a submitted product id only when it already belongs to this catalog.
     */
    private List<Product> buildProducts(List<ProductRequest> requested, Set<String> existingIds) {
        List<Product> products = new ArrayList<>(requested.size());
        for (int i = 0; i < requested.size(); i++) {
            ProductRequest item = requested.get(i);
            String productId = IdCanonicalizer.tryCanonicalize(IdKind.PRODUCT, item.getProductId())
                    .map(CanonicalId::getValue)
                    .filter(existingIds::contains)
                    .orElseGet(() -> IdCanonicalizer.newId(IdKind.PRODUCT).getValue());
            products.add(Product.builder()
                    .productId(productId)
                    .productName(item.getProductName().trim())
                    .description(item.getDescription())
                    .price(item.getPrice())
                    .sortOrder(item.getSortOrder() != null ? item.getSortOrder() : i)
                    .build());
        }
        return products;
    }
}
