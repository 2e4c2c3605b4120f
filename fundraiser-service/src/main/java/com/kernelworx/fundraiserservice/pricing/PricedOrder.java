package com.kernelworx.fundraiserservice.pricing;

import com.kernelworx.fundraiserservice.model.LineItem;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.List;

@Getter
public class PricedOrder {

    private final List<LineItem> lineItems;
    private final BigDecimal totalAmount;

    public PricedOrder(List<LineItem> lineItems, BigDecimal totalAmount) {
        this.lineItems = List.copyOf(lineItems);
        this.totalAmount = totalAmount;
    }
}
