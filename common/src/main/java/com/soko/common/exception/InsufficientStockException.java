package com.soko.common.exception;

import lombok.Getter;

/**
 * Exception thrown when a cart line asks for more units than the product has in stock.
 * Carries the product and the stock that was available when the check failed.
 * HTTP Status: 422 Unprocessable Entity
 */
@Getter
public class InsufficientStockException extends RuntimeException {

    private final Long productId;
    private final String productName;
    private final int available;
    private final int requested;

    public InsufficientStockException(Long productId, String productName, int available, int requested) {
        super(String.format("Insufficient stock for %s. Available: %d, Requested: %d",
                productName, available, requested));
        this.productId = productId;
        this.productName = productName;
        this.available = available;
        this.requested = requested;
    }
}
