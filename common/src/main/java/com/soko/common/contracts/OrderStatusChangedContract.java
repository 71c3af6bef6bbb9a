package com.soko.common.contracts;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Contract for 'order.status_changed' events.
 * Statuses are carried as enum names so consumers don't depend on the service model.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderStatusChangedContract {
    private Long orderId;
    private Long buyerId; // null for guest orders
    private String oldStatus;
    private String newStatus;
    private Long changedBy;
    private boolean stockRestored;
}
