package com.kernelworx.fundraiserservice.mapper;

import com.kernelworx.fundraiserservice.dto.InviteResponse;
import com.kernelworx.fundraiserservice.dto.ShareResponse;
import com.kernelworx.fundraiserservice.ids.IdCanonicalizer;
import com.kernelworx.fundraiserservice.model.Invite;
import com.kernelworx.fundraiserservice.model.Share;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

@Mapper(componentModel = "spring"
        , imports = IdCanonicalizer.class
        , unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface SharingMapper {

    @Mapping(target = "targetAccountId", expression = "java(IdCanonicalizer.strip(share.getTargetAccountId()))")
    @Mapping(target = "createdByAccountId", expression = "java(IdCanonicalizer.strip(share.getCreatedByAccountId()))")
    ShareResponse toShareResponse(Share share);

    @Mapping(target = "createdBy", expression = "java(IdCanonicalizer.strip(invite.getCreatedBy()))")
    @Mapping(target = "usedBy", expression = "java(IdCanonicalizer.strip(invite.getUsedBy()))")
    InviteResponse toInviteResponse(Invite invite);
}
