package com.kernelworx.fundraiserservice.repository;

import java.math.BigDecimal;

/**
 * Aggregate over the orders of one campaign.
 */
public interface CampaignTotals {

    Long getOrderCount();

    BigDecimal getRevenue();
}
