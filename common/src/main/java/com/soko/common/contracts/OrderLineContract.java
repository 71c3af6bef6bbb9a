package com.soko.common.contracts;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * One line of a placed order, with the unit price frozen at purchase time.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderLineContract {
    private Long productId;
    private String productName;
    private Integer quantity;
    private BigDecimal unitPrice;
}
