package com.kernelworx.fundraiserservice.service;

import com.kernelworx.fundraiserservice.dto.ProfileRequest;
import com.kernelworx.fundraiserservice.dto.ProfileResponse;
import com.kernelworx.fundraiserservice.dto.TransferOwnershipRequest;
import com.kernelworx.fundraiserservice.security.CallerIdentity;

import java.util.List;
import java.util.Optional;

public interface ProfileService {

    ProfileResponse createSellerProfile(ProfileRequest request, CallerIdentity caller);

    /**
     * Empty when the profile does not exist or the caller cannot read it.
     */
    Optional<ProfileResponse> getProfile(String profileId, CallerIdentity caller);

    List<ProfileResponse> listMyProfiles(CallerIdentity caller);

    List<ProfileResponse> listSharedProfiles(CallerIdentity caller);

    ProfileResponse updateSellerProfile(String profileId, ProfileRequest request, CallerIdentity caller);

    void deleteSellerProfile(String profileId, CallerIdentity caller);

    ProfileResponse transferProfileOwnership(String profileId, TransferOwnershipRequest request, CallerIdentity caller);
}
