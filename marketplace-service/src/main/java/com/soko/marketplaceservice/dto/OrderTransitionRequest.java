package com.soko.marketplaceservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of {@code PUT /api/v1/orders/{id}}. Exactly one of {@code action} or {@code status} is set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderTransitionRequest {
    private String action; // approve | reject | cancel
    private String status; // target status, e.g. shipped
}
