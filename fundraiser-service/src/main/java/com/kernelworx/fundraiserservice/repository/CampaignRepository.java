package com.kernelworx.fundraiserservice.repository;

import com.kernelworx.fundraiserservice.model.Campaign;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CampaignRepository extends JpaRepository<Campaign, String> {

    List<Campaign> findByProfileIdOrderByStartDateDesc(String profileId);

    long countByCatalogId(String catalogId);
}
