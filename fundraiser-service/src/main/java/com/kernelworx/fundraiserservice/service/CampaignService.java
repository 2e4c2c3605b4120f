package com.kernelworx.fundraiserservice.service;

import com.kernelworx.fundraiserservice.dto.CampaignRequest;
import com.kernelworx.fundraiserservice.dto.CampaignResponse;
import com.kernelworx.fundraiserservice.dto.UpdateCampaignRequest;
import com.kernelworx.fundraiserservice.security.CallerIdentity;

import java.util.List;
import java.util.Optional;

public interface CampaignService {

    CampaignResponse createCampaign(CampaignRequest request, CallerIdentity caller);

    Optional<CampaignResponse> getCampaign(String campaignId, CallerIdentity caller);

    List<CampaignResponse> listCampaignsByProfile(String profileId, CallerIdentity caller);

    CampaignResponse updateCampaign(String campaignId, UpdateCampaignRequest request, CallerIdentity caller);

    /**
     * Deletes the campaign and its orders. Succeeds when the campaign is already gone.
     */
    void deleteCampaign(String campaignId, CallerIdentity caller);
}
