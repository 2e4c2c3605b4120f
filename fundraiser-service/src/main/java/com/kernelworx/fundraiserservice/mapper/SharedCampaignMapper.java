package com.kernelworx.fundraiserservice.mapper;

import com.kernelworx.fundraiserservice.dto.SharedCampaignRequest;
import com.kernelworx.fundraiserservice.dto.SharedCampaignResponse;
import com.kernelworx.fundraiserservice.dto.UpdateSharedCampaignRequest;
import com.kernelworx.fundraiserservice.ids.IdCanonicalizer;
import com.kernelworx.fundraiserservice.model.SharedCampaignTemplate;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.MappingTarget;
import org.mapstruct.NullValuePropertyMappingStrategy;
import org.mapstruct.ReportingPolicy;

@Mapper(componentModel = "spring"
        , imports = IdCanonicalizer.class
        , unmappedTargetPolicy = ReportingPolicy.IGNORE
        , nullValuePropertyMappingStrategy = NullValuePropertyMappingStrategy.IGNORE)
public interface SharedCampaignMapper {

    // code, key, creator and catalog id are derived by the service
    @Mapping(target = "catalogId", ignore = true)
    @Mapping(target = "sharedCampaignCode", ignore = true)
    @Mapping(target = "unitCampaignKey", ignore = true)
    @Mapping(target = "createdBy", ignore = true)
    SharedCampaignTemplate toTemplate(SharedCampaignRequest request);

    @Mapping(target = "createdBy", expression = "java(IdCanonicalizer.strip(template.getCreatedBy()))")
    @Mapping(target = "isActive", expression = "java(template.isActiveOrUnset())")
    SharedCampaignResponse toSharedCampaignResponse(SharedCampaignTemplate template);

    void updateTemplateFromRequest(UpdateSharedCampaignRequest request, @MappingTarget SharedCampaignTemplate template);
}
