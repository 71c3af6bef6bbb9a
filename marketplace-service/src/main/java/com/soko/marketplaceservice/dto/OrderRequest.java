package com.soko.marketplaceservice.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderRequest {

    @NotEmpty(message = "Order must contain at least one item")
    @Valid // Triggers validation for each OrderItemRequest in the list
    private List<OrderItemRequest> items;

    // Required for guest checkout, ignored for authenticated buyers
    @Valid
    private GuestContactRequest buyerContact;
}
