package com.kernelworx.fundraiserservice.model;

/**
 * Permission levels a share can grant. WRITE implies READ.
 */
public enum Permission {
    READ,
    WRITE;

    public boolean satisfies(Permission required) {
        return this == required || (this == WRITE && required == READ);
    }
}
