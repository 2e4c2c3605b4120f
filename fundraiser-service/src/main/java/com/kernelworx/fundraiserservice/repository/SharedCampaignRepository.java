package com.kernelworx.fundraiserservice.repository;

import com.kernelworx.fundraiserservice.model.SharedCampaignTemplate;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SharedCampaignRepository extends JpaRepository<SharedCampaignTemplate, String> {

    // discovery index lookup
    List<SharedCampaignTemplate> findByUnitCampaignKey(String unitCampaignKey);

    List<SharedCampaignTemplate> findByCreatedByOrderByCreatedAtDesc(String createdBy);

    long countByCreatedBy(String createdBy);
}
