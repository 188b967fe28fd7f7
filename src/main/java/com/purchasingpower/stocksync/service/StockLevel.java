package com.purchasingpower.stocksync.service;

import lombok.Builder;
import lombok.Value;

/**
 * What is left of one product after its orders.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class StockLevel {
    long productKey;
    String productName;
    long quantity;
    long ordered;

    public long getLeft() {
        return quantity - ordered;
    }

    public boolean isShort() {
        return getLeft() < 0;
    }

    /**
     * "Left of X: n", or "Need to supply of X: n" when orders exceed stock.
     */
    public String getLabel() {
        return isShort()
                ? "Need to supply of " + productName + ": " + -getLeft()
                : "Left of " + productName + ": " + getLeft();
    }
}
