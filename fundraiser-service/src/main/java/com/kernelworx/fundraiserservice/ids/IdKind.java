package com.kernelworx.fundraiserservice.ids;

import java.util.List;

/**
 * Entity families with their canonical key prefix.
 * TARGET_ACCOUNT is an account id arriving through the sharing surface, where
 * older clients still send ids tagged with the retired share prefixes.
 */
public enum IdKind {
    PROFILE("PROFILE#"),
    ACCOUNT("ACCOUNT#"),
    TARGET_ACCOUNT("ACCOUNT#", "SHARE#ACCOUNT#", "SHARE#"),
    CATALOG("CATALOG#"),
    CAMPAIGN("CAMPAIGN#"),
    ORDER("ORDER#"),
    PRODUCT("PRODUCT#");

    private final String prefix;
    // longest first, so "SHARE#ACCOUNT#" is stripped before "SHARE#"
    private final List<String> legacyPrefixes;

    IdKind(String prefix, String... legacyPrefixes) {
        this.prefix = prefix;
        this.legacyPrefixes = List.of(legacyPrefixes);
    }

    public String getPrefix() {
        return prefix;
    }

    public List<String> getLegacyPrefixes() {
        return legacyPrefixes;
    }
}
