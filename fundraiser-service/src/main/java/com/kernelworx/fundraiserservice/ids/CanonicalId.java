package com.kernelworx.fundraiserservice.ids;

import java.util.Objects;

/**
 * A prefix-tagged identifier. Two ids are equal only when both the kind and
 * the canonical string match, so a profile id never equals an account id.
 */
public final class CanonicalId {

    private final IdKind kind;
    private final String value;

    CanonicalId(IdKind kind, String value) {
        this.kind = kind;
        this.value = value;
    }

    public IdKind getKind() {
        return kind;
    }

    /** Canonical form, e.g. {@code PROFILE#1234}. */
    public String getValue() {
        return value;
    }

    /** Raw form without the prefix. */
    public String getRaw() {
        return value.substring(kind.getPrefix().length());
    }

    /** Whether this id names the same entity as a stored canonical string. */
    public boolean matches(String storedValue) {
        return value.equals(storedValue);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CanonicalId other)) {
            return false;
        }
        return kind == other.kind && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        return value;
    }
}
