package com.kernelworx.fundraiserservice.mapper;

import com.kernelworx.fundraiserservice.access.AccessDecision;
import com.kernelworx.fundraiserservice.dto.ProfileRequest;
import com.kernelworx.fundraiserservice.dto.ProfileResponse;
import com.kernelworx.fundraiserservice.ids.IdCanonicalizer;
import com.kernelworx.fundraiserservice.model.SellerProfile;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.MappingTarget;
import org.mapstruct.ReportingPolicy;

@Mapper(componentModel = "spring"
        , imports = IdCanonicalizer.class
        , unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface ProfileMapper {

    SellerProfile toProfile(ProfileRequest request);

    /**
     * @param profile the source entity
     * @param access  the caller's resolved access, drives isOwner and permissions
     */
    @Mapping(target = "ownerAccountId", expression = "java(IdCanonicalizer.strip(profile.getOwnerAccountId()))")
    @Mapping(target = "isOwner", expression = "java(access.isOwner())")
    @Mapping(target = "permissions", expression = "java(access.getPermissions())")
    ProfileResponse toProfileResponse(SellerProfile profile, AccessDecision access);

    // all three fields are replaced; clearing the unit is allowed
    void updateProfileFromRequest(ProfileRequest request, @MappingTarget SellerProfile profile);
}
