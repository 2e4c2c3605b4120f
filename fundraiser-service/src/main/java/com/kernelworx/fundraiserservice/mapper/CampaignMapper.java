package com.kernelworx.fundraiserservice.mapper;

import com.kernelworx.fundraiserservice.dto.CampaignResponse;
import com.kernelworx.fundraiserservice.dto.UpdateCampaignRequest;
import com.kernelworx.fundraiserservice.model.Campaign;
import com.kernelworx.fundraiserservice.repository.CampaignTotals;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.MappingTarget;
import org.mapstruct.NullValuePropertyMappingStrategy;
import org.mapstruct.ReportingPolicy;

@Mapper(componentModel = "spring"
        , unmappedTargetPolicy = ReportingPolicy.IGNORE
        , nullValuePropertyMappingStrategy = NullValuePropertyMappingStrategy.IGNORE)
public interface CampaignMapper {

    @Mapping(target = "totalOrders", source = "totals.orderCount")
    @Mapping(target = "totalRevenue", source = "totals.revenue")
    @Mapping(target = "createdAt", source = "campaign.createdAt")
    @Mapping(target = "updatedAt", source = "campaign.updatedAt")
    CampaignResponse toCampaignResponse(Campaign campaign, CampaignTotals totals);

    // catalogId is canonicalized by the service, not copied raw
    @Mapping(target = "catalogId", ignore = true)
    void updateCampaignFromRequest(UpdateCampaignRequest request, @MappingTarget Campaign campaign);
}
