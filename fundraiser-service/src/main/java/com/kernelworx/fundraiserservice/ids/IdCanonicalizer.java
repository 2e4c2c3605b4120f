package com.kernelworx.fundraiserservice.ids;

import java.util.Optional;
import java.util.UUID;

/**
 * Single place where identifiers are normalized.
 * <p>
 * Every id entering the service goes through {@link #canonicalize} before it
 * touches the store or an authorization check. Entity ids leave the service in
 * canonical form; account ids leave raw (see {@link #strip}).
 */
public final class IdCanonicalizer {

    private IdCanonicalizer() {
    }

    /**
     * Total and idempotent: legacy prefixes are removed, then the kind's prefix
     * is added unless already present.
     */
    public static CanonicalId canonicalize(IdKind kind, String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Cannot canonicalize a null " + kind + " id");
        }
        String value = raw.trim();
        for (String legacy : kind.getLegacyPrefixes()) {
            if (value.startsWith(legacy)) {
                value = value.substring(legacy.length());
                break;
            }
        }
        if (!value.startsWith(kind.getPrefix())) {
            value = kind.getPrefix() + value;
        }
        return new CanonicalId(kind, value);
    }

    /**
     * Empty for null or blank input, or when only a bare prefix remains.
     */
    public static Optional<CanonicalId> tryCanonicalize(IdKind kind, String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        CanonicalId id = canonicalize(kind, raw);
        return isCanonical(kind, id.getValue()) ? Optional.of(id) : Optional.empty();
    }

    public static boolean isCanonical(IdKind kind, String value) {
        return value != null
                && value.startsWith(kind.getPrefix())
                && value.length() > kind.getPrefix().length()
                && kind.getLegacyPrefixes().stream().noneMatch(value::startsWith);
    }

    public static String decanonicalize(CanonicalId id) {
        return id.getRaw();
    }

    /**
     * Raw account id for a stored canonical account id; null passes through.
     */
    public static String strip(String storedAccountId) {
        if (storedAccountId == null) {
            return null;
        }
        return canonicalize(IdKind.ACCOUNT, storedAccountId).getRaw();
    }

    public static CanonicalId newId(IdKind kind) {
        return new CanonicalId(kind, kind.getPrefix() + UUID.randomUUID());
    }
}
