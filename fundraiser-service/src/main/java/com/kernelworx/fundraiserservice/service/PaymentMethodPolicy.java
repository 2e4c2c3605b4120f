package com.kernelworx.fundraiserservice.service;

import com.kernelworx.common.exception.BadRequestException;
import com.kernelworx.fundraiserservice.config.FundraiserProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Naming rules for payment methods, shared by payment method management and
 * order validation.
 */
@Component
@RequiredArgsConstructor
public class PaymentMethodPolicy {

    public static final List<String> BUILT_IN = List.of("Cash", "Check");

    private final FundraiserProperties properties;

    public boolean isReserved(String name) {
        if (name == null) {
            return false;
        }
        String trimmed = name.trim();
        return BUILT_IN.stream().anyMatch(builtIn -> builtIn.equalsIgnoreCase(trimmed));
    }

    /**
     * Validates a new custom name and returns it trimmed.
     *
     * @param existing    the account's current custom names
     * @param excludeName name being renamed, left out of the duplicate check; may be null
     */
    public String validateName(String name, Collection<String> existing, String excludeName) {
        String trimmed = name == null ? "" : name.trim();
        if (trimmed.isEmpty()) {
            throw new BadRequestException("Payment method name is required");
        }
        int maxLength = properties.getPaymentMethods().getMaxNameLength();
        if (trimmed.length() > maxLength) {
            throw new BadRequestException("Payment method name must be at most " + maxLength + " characters");
        }
        if (isReserved(trimmed)) {
            throw new BadRequestException("'" + trimmed + "' is a reserved payment method name");
        }
        boolean duplicate = existing.stream()
                .filter(current -> excludeName == null || !current.equalsIgnoreCase(excludeName.trim()))
                .anyMatch(current -> current.equalsIgnoreCase(trimmed));
        if (duplicate) {
            throw new BadRequestException("A payment method named '" + trimmed + "' already exists");
        }
        return trimmed;
    }

    /**
     * Built-ins first, then the custom names alphabetically.
     */
    public List<String> withBuiltIns(Collection<String> custom) {
        List<String> sorted = new ArrayList<>(custom);
        sorted.sort(String.CASE_INSENSITIVE_ORDER);
        List<String> all = new ArrayList<>(BUILT_IN);
        all.addAll(sorted);
        return all;
    }

    public boolean isAvailable(Collection<String> custom, String name) {
        if (name == null || name.isBlank()) {
            return false;
        }
        String trimmed = name.trim();
        return isReserved(trimmed) || custom.stream().anyMatch(current -> current.equalsIgnoreCase(trimmed));
    }
}
