package com.kernelworx.fundraiserservice.security;

import com.kernelworx.common.exception.UnauthorizedException;
import com.kernelworx.fundraiserservice.ids.IdCanonicalizer;
import com.kernelworx.fundraiserservice.ids.IdKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

@Component
public class CallerIdentityResolver {

    private static final Logger log = LoggerFactory.getLogger(CallerIdentityResolver.class);

    static final String GROUPS_CLAIM = "cognito:groups";
    static final String ADMIN_GROUP = "ADMIN";

    /**
     * Builds the caller identity from the token subject. There is no fallback
     * to other claims: a token without a subject is rejected.
     */
    public CallerIdentity resolve(Jwt jwt) {
        if (jwt == null || jwt.getSubject() == null || jwt.getSubject().isBlank()) {
            log.warn("Rejected request without an authenticated subject");
            throw new UnauthorizedException("Authentication required");
        }
        return CallerIdentity.builder()
                .accountId(IdCanonicalizer.canonicalize(IdKind.ACCOUNT, jwt.getSubject()))
                .email(jwt.getClaimAsString("email"))
                .givenName(jwt.getClaimAsString("given_name"))
                .familyName(jwt.getClaimAsString("family_name"))
                .admin(extractGroups(jwt).contains(ADMIN_GROUP))
                .build();
    }

    private List<String> extractGroups(Jwt jwt) {
        return Optional.ofNullable(jwt.getClaim(GROUPS_CLAIM))
                .filter(List.class::isInstance)
                .map(groups -> (List<?>) groups)
                .map(list -> list.stream()
                        .filter(String.class::isInstance)
                        .map(String.class::cast)
                        .toList())
                .orElse(List.of());
    }
}
