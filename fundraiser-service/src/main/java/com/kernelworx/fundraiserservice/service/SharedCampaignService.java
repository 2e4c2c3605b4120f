package com.kernelworx.fundraiserservice.service;

import com.kernelworx.fundraiserservice.dto.SharedCampaignRequest;
import com.kernelworx.fundraiserservice.dto.SharedCampaignResponse;
import com.kernelworx.fundraiserservice.dto.UpdateSharedCampaignRequest;
import com.kernelworx.fundraiserservice.security.CallerIdentity;

import java.util.List;
import java.util.Optional;

public interface SharedCampaignService {

    SharedCampaignResponse createSharedCampaign(SharedCampaignRequest request, CallerIdentity caller);

    Optional<SharedCampaignResponse> getSharedCampaign(String sharedCampaignCode);

    List<SharedCampaignResponse> listMySharedCampaigns(CallerIdentity caller);

    /**
     * Active presets of one unit campaign. Never writes.
     */
    List<SharedCampaignResponse> findSharedCampaigns(String unitType, String unitNumber, String city, String state,
                                                     String campaignName, Integer campaignYear);

    SharedCampaignResponse updateSharedCampaign(String sharedCampaignCode, UpdateSharedCampaignRequest request,
                                                CallerIdentity caller);

    void deleteSharedCampaign(String sharedCampaignCode, CallerIdentity caller);
}
