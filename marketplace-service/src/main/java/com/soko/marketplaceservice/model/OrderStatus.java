package com.soko.marketplaceservice.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Order lifecycle.
 *
 * <pre>
 * PENDING --approve--> CONFIRMED --> SHIPPED --> DELIVERED
 *    |
 *    +--reject/cancel--> CANCELLED (stock restored)
 * </pre>
 *
 * Both action-based and direct status changes are checked against {@link #canTransitionTo}.
 */
public enum OrderStatus {
    PENDING,
    CONFIRMED,
    SHIPPED,
    DELIVERED,
    CANCELLED;

    public boolean canTransitionTo(OrderStatus target) {
        return nextStates().contains(target);
    }

    public boolean isTerminal() {
        return nextStates().isEmpty();
    }

    private Set<OrderStatus> nextStates() {
        return switch (this) {
            case PENDING -> EnumSet.of(CONFIRMED, CANCELLED);
            case CONFIRMED -> EnumSet.of(SHIPPED);
            case SHIPPED -> EnumSet.of(DELIVERED);
            case DELIVERED, CANCELLED -> EnumSet.noneOf(OrderStatus.class);
        };
    }

    /**
     * Parses a status as sent by clients ("shipped", "SHIPPED").
     *
     * @throws IllegalArgumentException for unknown values
     */
    public static OrderStatus from(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Order status must not be blank");
        }
        try {
            return OrderStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown order status: " + value);
        }
    }
}
