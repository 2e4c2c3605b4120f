package com.kernelworx.fundraiserservice.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Stores a permission set as a comma separated column, e.g. {@code READ,WRITE}.
 * Unknown tokens are dropped on read, so a corrupt column yields an empty set
 * and the share grants nothing.
 */
@Converter
public class PermissionSetConverter implements AttributeConverter<Set<Permission>, String> {

    @Override
    public String convertToDatabaseColumn(Set<Permission> permissions) {
        if (permissions == null || permissions.isEmpty()) {
            return "";
        }
        return permissions.stream()
                .sorted()
                .map(Permission::name)
                .collect(Collectors.joining(","));
    }

    @Override
    public Set<Permission> convertToEntityAttribute(String column) {
        EnumSet<Permission> permissions = EnumSet.noneOf(Permission.class);
        if (column == null || column.isBlank()) {
            return permissions;
        }
        Arrays.stream(column.split(","))
                .map(String::trim)
                .filter(name -> !name.isEmpty())
                .forEach(name -> Arrays.stream(Permission.values())
                        .filter(permission -> permission.name().equals(name))
                        .findFirst()
                        .ifPresent(permissions::add));
        return permissions;
    }
}
