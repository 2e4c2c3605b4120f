package com.kernelworx.fundraiserservice.repository;

import com.kernelworx.fundraiserservice.model.SellerProfile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface SellerProfileRepository extends JpaRepository<SellerProfile, String> {

    List<SellerProfile> findByOwnerAccountIdOrderByCreatedAtAsc(String ownerAccountId);

    List<SellerProfile> findByProfileIdIn(Collection<String> profileIds);
}
