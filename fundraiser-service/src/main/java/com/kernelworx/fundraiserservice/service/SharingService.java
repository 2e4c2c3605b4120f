package com.kernelworx.fundraiserservice.service;

import com.kernelworx.fundraiserservice.dto.InviteRequest;
import com.kernelworx.fundraiserservice.dto.InviteResponse;
import com.kernelworx.fundraiserservice.dto.RedeemInviteRequest;
import com.kernelworx.fundraiserservice.dto.ShareRequest;
import com.kernelworx.fundraiserservice.dto.ShareResponse;
import com.kernelworx.fundraiserservice.security.CallerIdentity;

import java.util.List;

public interface SharingService {

    InviteResponse createProfileInvite(String profileId, InviteRequest request, CallerIdentity caller);

    ShareResponse redeemProfileInvite(RedeemInviteRequest request, CallerIdentity caller);

    List<InviteResponse> listInvitesByProfile(String profileId, CallerIdentity caller);

    void deleteProfileInvite(String profileId, String inviteCode, CallerIdentity caller);

    ShareResponse shareProfileDirect(String profileId, ShareRequest request, CallerIdentity caller);

    void revokeShare(String profileId, String targetAccountId, CallerIdentity caller);

    List<ShareResponse> listSharesByProfile(String profileId, CallerIdentity caller);
}
