package com.soko.marketplaceservice.model;

/**
 * Payment state of an order. Written only by PaymentService.
 */
public enum PaymentStatus {
    PENDING,
    PAID,
    FAILED
}
