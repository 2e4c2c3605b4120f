package com.kernelworx.fundraiserservice.security;

import com.kernelworx.fundraiserservice.ids.CanonicalId;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * The authenticated caller, resolved once per request from the bearer token.
 */
@Getter
@Builder
@ToString(onlyExplicitlyIncluded = true)
public class CallerIdentity {

    @ToString.Include
    private final CanonicalId accountId;
    private final String email;
    private final String givenName;
    private final String familyName;
    private final boolean admin;

    public String rawAccountId() {
        return accountId.getRaw();
    }
}
