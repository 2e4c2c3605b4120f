package com.kernelworx.fundraiserservice.access;

import com.kernelworx.fundraiserservice.model.Permission;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Outcome of resolving a caller against a profile.
 */
public final class AccessDecision {

    public enum Basis {
        OWNER,
        SHARED,
        DENIED
    }

    private static final AccessDecision OWNER =
            new AccessDecision(Basis.OWNER, EnumSet.allOf(Permission.class));
    private static final AccessDecision DENIED =
            new AccessDecision(Basis.DENIED, EnumSet.noneOf(Permission.class));

    private final Basis basis;
    private final Set<Permission> permissions;

    private AccessDecision(Basis basis, Set<Permission> permissions) {
        this.basis = basis;
        this.permissions = Collections.unmodifiableSet(permissions);
    }

    public static AccessDecision owner() {
        return OWNER;
    }

    public static AccessDecision shared(Set<Permission> permissions) {
        return new AccessDecision(Basis.SHARED,
                permissions.isEmpty() ? EnumSet.noneOf(Permission.class) : EnumSet.copyOf(permissions));
    }

    public static AccessDecision denied() {
        return DENIED;
    }

    public Basis getBasis() {
        return basis;
    }

    public Set<Permission> getPermissions() {
        return permissions;
    }

    public boolean isAuthorized() {
        return basis != Basis.DENIED;
    }

    public boolean isOwner() {
        return basis == Basis.OWNER;
    }

    public boolean allows(Permission required) {
        return switch (basis) {
            case OWNER -> true;
            case SHARED -> permissions.stream().anyMatch(granted -> granted.satisfies(required));
            case DENIED -> false;
        };
    }

    @Override
    public String toString() {
        return basis == Basis.SHARED ? "SHARED" + permissions : basis.name();
    }
}
