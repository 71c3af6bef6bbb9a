package com.soko.marketplaceservice.model;

import java.util.Locale;

/**
 * Semantic order transitions. All of them are only legal on a PENDING order.
 */
public enum OrderAction {
    APPROVE(OrderStatus.CONFIRMED),
    REJECT(OrderStatus.CANCELLED),
    CANCEL(OrderStatus.CANCELLED);

    private final OrderStatus targetStatus;

    OrderAction(OrderStatus targetStatus) {
        this.targetStatus = targetStatus;
    }

    public OrderStatus getTargetStatus() {
        return targetStatus;
    }

    public static OrderAction from(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Order action must not be blank");
        }
        try {
            return OrderAction.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown order action: " + value);
        }
    }
}
