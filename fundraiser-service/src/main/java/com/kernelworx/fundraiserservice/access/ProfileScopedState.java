package com.kernelworx.fundraiserservice.access;

import com.kernelworx.fundraiserservice.ids.CanonicalId;
import com.kernelworx.fundraiserservice.model.SellerProfile;
import lombok.Getter;
import lombok.Setter;

/**
 * Pipeline state shared by every operation authorized against a profile.
 * <p>
 * {@code profileId} is set before the access steps run, either from the
 * arguments or by a lookup step reading the parent of a campaign or order.
 * {@code targetMissing} is set by lookup steps of idempotent operations; every
 * later step then skips.
 */
@Getter
@Setter
public abstract class ProfileScopedState {

    private CanonicalId profileId;
    private SellerProfile profile;
    private AccessDecision access;
    private boolean targetMissing;

    public boolean isResolved() {
        return access != null;
    }

    public boolean isAuthorized() {
        return access != null && access.isAuthorized();
    }

    public boolean isDenied() {
        return access != null && !access.isAuthorized();
    }
}
