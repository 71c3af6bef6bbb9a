package com.soko.marketplaceservice.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.math.BigDecimal;
import java.math.BigInteger;

@Entity
@Table(name = "order_items")
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class OrderItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "order_id", nullable = false)
    private Order order;

    // position inside the order, zero based
    @Column(name = "line_number", nullable = false)
    private Integer lineNumber;

    @Column(name = "product_id", nullable = false)
    @ToString.Include
    private Long productId;

    // snapshot of the product name at purchase time
    @Column(name = "product_name", nullable = false)
    private String productName;

    @Column(nullable = false)
    @ToString.Include
    private Integer quantity;

    // snapshot of the product price at purchase time
    @Column(name = "unit_price", nullable = false, precision = 12, scale = 2)
    private BigDecimal unitPrice;

    public BigDecimal getSubtotal() {
        return unitPrice.multiply(new BigDecimal(BigInteger.valueOf(quantity)));
    }
}
