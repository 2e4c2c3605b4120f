package com.kernelworx.fundraiserservice.access;

import com.kernelworx.fundraiserservice.ids.CanonicalId;
import com.kernelworx.fundraiserservice.model.Permission;
import com.kernelworx.fundraiserservice.model.SellerProfile;
import com.kernelworx.fundraiserservice.model.Share;
import com.kernelworx.fundraiserservice.repository.SellerProfileRepository;
import com.kernelworx.fundraiserservice.repository.ShareRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Decides whether a caller may act on a profile.
 * <ol>
 *   <li>missing or unknown profile: denied, indistinguishable from each other</li>
 *   <li>caller owns the profile: owner, share records are not consulted</li>
 *   <li>otherwise the caller's share, read fresh from the database, must grant the level</li>
 * </ol>
 */
@Component
@RequiredArgsConstructor
public class AccessResolver {

    private final SellerProfileRepository profileRepository;
    private final ShareRepository shareRepository;

    public AccessDecision resolve(CanonicalId caller, CanonicalId profileId, Permission required) {
        Optional<SellerProfile> profile = findProfile(profileId);
        if (profile.isEmpty()) {
            return AccessDecision.denied();
        }
        if (isOwner(caller, profile.get())) {
            return AccessDecision.owner();
        }
        return resolveShare(caller, profileId, required);
    }

    public Optional<SellerProfile> findProfile(CanonicalId profileId) {
        if (profileId == null) {
            return Optional.empty();
        }
        return profileRepository.findById(profileId.getValue());
    }

    public boolean isOwner(CanonicalId caller, SellerProfile profile) {
        return caller.matches(profile.getOwnerAccountId());
    }

    public AccessDecision resolveShare(CanonicalId caller, CanonicalId profileId, Permission required) {
        Optional<Share> share = shareRepository.findConsistent(profileId.getValue(), caller.getValue());
        if (share.isEmpty() || share.get().getPermissions() == null || share.get().getPermissions().isEmpty()) {
            return AccessDecision.denied();
        }
        AccessDecision decision = AccessDecision.shared(share.get().getPermissions());
        return decision.allows(required) ? decision : AccessDecision.denied();
    }
}
