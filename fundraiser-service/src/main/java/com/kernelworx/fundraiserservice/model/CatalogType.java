package com.kernelworx.fundraiserservice.model;

public enum CatalogType {
    USER_CREATED,
    ADMIN_MANAGED
}
