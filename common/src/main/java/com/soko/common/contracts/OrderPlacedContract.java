package com.soko.common.contracts;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Contract for 'order.placed' events, written to the outbox in the same transaction
 * that decremented stock and inserted the order.
 *
 * Consumed by the seller fan-out, which sends one message per seller whose
 * products appear in the order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderPlacedContract {
    private Long orderId;
    private Long buyerId; // null for guest orders
    private List<OrderLineContract> items;
    private BigDecimal totalAmount;
    private Instant createdAt;
}
