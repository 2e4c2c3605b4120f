package com.kernelworx.fundraiserservice.pricing;

import com.kernelworx.common.exception.BadRequestException;
import com.kernelworx.common.exception.InternalErrorException;
import com.kernelworx.fundraiserservice.dto.LineItemRequest;
import com.kernelworx.fundraiserservice.ids.CanonicalId;
import com.kernelworx.fundraiserservice.ids.IdCanonicalizer;
import com.kernelworx.fundraiserservice.ids.IdKind;
import com.kernelworx.fundraiserservice.model.Catalog;
import com.kernelworx.fundraiserservice.model.LineItem;
import com.kernelworx.fundraiserservice.model.Product;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Prices requested order lines against a catalog.
 * <p>
 * Every line is validated before any is priced, so a single bad line rejects
 * the whole request. Amounts use scale 2 and are never rounded: a catalog
 * price with finer precision is reported as an internal error.
 */
@Component
public class OrderPricingEngine {

    private static final Logger log = LoggerFactory.getLogger(OrderPricingEngine.class);

    static final int MONEY_SCALE = 2;

    public PricedOrder price(Catalog catalog, List<LineItemRequest> requested) {
        if (requested == null || requested.isEmpty()) {
            throw new BadRequestException("Order must have at least one line item");
        }

        List<Product> products = new ArrayList<>(requested.size());
        for (LineItemRequest item : requested) {
            if (item == null) {
                throw new BadRequestException("Line items cannot contain empty entries");
            }
            Integer quantity = item.getQuantity();
            if (quantity == null || quantity < 1) {
                log.warn("Rejected line item for product {} with quantity {}", item.getProductId(), quantity);
                throw new BadRequestException("Quantity must be at least 1 (got " + quantity + ")");
            }
            Optional<CanonicalId> productId = IdCanonicalizer.tryCanonicalize(IdKind.PRODUCT, item.getProductId());
            Product product = productId
                    .flatMap(id -> catalog.findProduct(id.getValue()))
                    .orElseThrow(() -> {
                        log.warn("Rejected line item: product {} not in catalog {}",
                                item.getProductId(), catalog.getCatalogId());
                        return new BadRequestException("Product " + item.getProductId() + " not found in catalog");
                    });
            products.add(product);
        }

        List<LineItem> lineItems = new ArrayList<>(requested.size());
        BigDecimal total = BigDecimal.ZERO.setScale(MONEY_SCALE);
        for (int i = 0; i < requested.size(); i++) {
            Product product = products.get(i);
            int quantity = requested.get(i).getQuantity();
            BigDecimal unitPrice = toMoney(product);
            BigDecimal subtotal = unitPrice.multiply(BigDecimal.valueOf(quantity));
            lineItems.add(LineItem.builder()
                    .productId(product.getProductId())
                    .productName(product.getProductName())
                    .quantity(quantity)
                    .pricePerUnit(unitPrice)
                    .subtotal(subtotal)
                    .build());
            total = total.add(subtotal);
        }
        return new PricedOrder(lineItems, total);
    }

    private BigDecimal toMoney(Product product) {
        BigDecimal price = product.getPrice();
        if (price == null || price.signum() < 0) {
            log.error("Catalog product {} has invalid price {}", product.getProductId(), price);
            throw new InternalErrorException("Catalog price is invalid for product " + product.getProductId());
        }
        try {
            return price.setScale(MONEY_SCALE, RoundingMode.UNNECESSARY);
        } catch (ArithmeticException ex) {
            log.error("Catalog product {} has price {} with more than {} decimals",
                    product.getProductId(), price, MONEY_SCALE);
            throw new InternalErrorException("Catalog price is not representable for product "
                    + product.getProductId(), ex);
        }
    }
}
