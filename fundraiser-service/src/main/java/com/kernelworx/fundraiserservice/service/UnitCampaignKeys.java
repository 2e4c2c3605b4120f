package com.kernelworx.fundraiserservice.service;

import com.kernelworx.common.exception.BadRequestException;

import java.util.Locale;

/**
 * Derived keys for unit campaigns: the discovery key and shared campaign codes.
 */
public final class UnitCampaignKeys {

    private UnitCampaignKeys() {
    }

    /**
     * {@code unitType#unitNumber#city#state#campaignName#campaignYear}; null when
     * any part is missing.
     */
    public static String discoveryKey(String unitType, String unitNumber, String city, String state,
                                      String campaignName, Integer campaignYear) {
        if (isBlank(unitType) || isBlank(unitNumber) || isBlank(city) || isBlank(state)
                || isBlank(campaignName) || campaignYear == null) {
            return null;
        }
        return String.join("#", unitType.trim(), unitNumber.trim(), city.trim(), state.trim(),
                campaignName.trim(), String.valueOf(campaignYear));
    }

    /**
     * Human-typeable code, e.g. {@code PACK158-POPC-IL-25} for pack 158's 2025
     * "Popcorn" sale in Illinois.
     */
    public static String sharedCampaignCode(String unitType, String unitNumber, String campaignName,
                                            String state, Integer campaignYear) {
        String namePart = campaignName == null ? "" : campaignName.replaceAll("[^A-Za-z0-9]", "");
        if (isBlank(unitType) || isBlank(unitNumber) || namePart.isEmpty() || isBlank(state) || campaignYear == null) {
            throw new BadRequestException("Unit type, unit number, campaign name, state and year are required");
        }
        String yearPart = String.format("%02d", Math.floorMod(campaignYear, 100));
        String code = unitType.trim() + unitNumber.trim()
                + "-" + namePart.substring(0, Math.min(4, namePart.length()))
                + "-" + state.trim()
                + "-" + yearPart;
        return code.replaceAll("\\s+", "").toUpperCase(Locale.ROOT);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
