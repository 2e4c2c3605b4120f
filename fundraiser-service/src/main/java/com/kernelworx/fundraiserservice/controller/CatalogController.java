package com.kernelworx.fundraiserservice.controller;

import com.kernelworx.fundraiserservice.dto.CatalogRequest;
import com.kernelworx.fundraiserservice.dto.CatalogResponse;
import com.kernelworx.fundraiserservice.security.CallerIdentityResolver;
import com.kernelworx.fundraiserservice.service.CatalogService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/catalogs")
@RequiredArgsConstructor
public class CatalogController {

    private final CatalogService catalogService;
    private final CallerIdentityResolver identityResolver;

    @PostMapping
    public ResponseEntity<CatalogResponse> createCatalog(@Valid @RequestBody CatalogRequest request,
                                                         @AuthenticationPrincipal Jwt jwt) {
        CatalogResponse created = catalogService.createCatalog(request, identityResolver.resolve(jwt));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    // Public catalogs lister
    @GetMapping
    public ResponseEntity<List<CatalogResponse>> getPublicCatalogs() {
        return ResponseEntity.ok(catalogService.listPublicCatalogs());
    }

    @GetMapping("/mine")
    public ResponseEntity<List<CatalogResponse>> getMyCatalogs(@AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(catalogService.listMyCatalogs(identityResolver.resolve(jwt)));
    }

    @GetMapping("/managed")
    public ResponseEntity<List<CatalogResponse>> getManagedCatalogs() {
        return ResponseEntity.ok(catalogService.listManagedCatalogs());
    }

    @GetMapping("/{catalogId}")
    public ResponseEntity<CatalogResponse> getCatalog(@PathVariable String catalogId,
                                                      @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.of(catalogService.getCatalog(catalogId, identityResolver.resolve(jwt)));
    }

    @PutMapping("/{catalogId}")
    public ResponseEntity<CatalogResponse> updateCatalog(@PathVariable String catalogId,
                                                         @Valid @RequestBody CatalogRequest request,
                                                         @AuthenticationPrincipal Jwt jwt) {
        CatalogResponse updated = catalogService.updateCatalog(catalogId, request, identityResolver.resolve(jwt));
        return ResponseEntity.ok(updated);
    }

    @DeleteMapping("/{catalogId}")
    public ResponseEntity<Void> deleteCatalog(@PathVariable String catalogId, @AuthenticationPrincipal Jwt jwt) {
        catalogService.deleteCatalog(catalogId, identityResolver.resolve(jwt));
        return ResponseEntity.noContent().build();
    }
}
