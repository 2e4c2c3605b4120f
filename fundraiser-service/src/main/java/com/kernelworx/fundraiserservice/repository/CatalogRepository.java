package com.kernelworx.fundraiserservice.repository;

import com.kernelworx.fundraiserservice.model.Catalog;
import com.kernelworx.fundraiserservice.model.CatalogType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CatalogRepository extends JpaRepository<Catalog, String> {

    List<Catalog> findByIsPublicTrueAndIsDeletedFalse();

    List<Catalog> findByOwnerAccountIdAndIsDeletedFalse(String ownerAccountId);

    List<Catalog> findByCatalogTypeAndIsDeletedFalse(CatalogType catalogType);
}
