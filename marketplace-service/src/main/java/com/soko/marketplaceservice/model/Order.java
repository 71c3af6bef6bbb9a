package com.soko.marketplaceservice.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "orders", indexes = {
        @Index(name = "idx_order_buyer_created", columnList = "buyer_id,created_at")
})
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class Order {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @ToString.Include
    private Long id;

    // Registered buyer. Null for guest orders, which carry guestContact instead
    @Column(name = "buyer_id")
    private Long buyerId;

    @Embedded
    private GuestContact guestContact;

    // Line items in cart order
    @OneToMany(mappedBy = "order", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("lineNumber ASC")
    private List<OrderItem> items = new ArrayList<>();

    // Frozen at creation, never recomputed from live prices
    @Column(name = "total_amount", nullable = false, precision = 14, scale = 2)
    private BigDecimal totalAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @ToString.Include
    private OrderStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false, length = 20)
    private PaymentStatus paymentStatus;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    // Optimistic locking: two concurrent cancellations cannot both restore stock.
    // The loser fails with OptimisticLockingFailureException and rolls back.
    @Version
    @Column(name = "version")
    private Long version;

    public void addItem(OrderItem item) {
        item.setOrder(this);
        item.setLineNumber(items.size());
        items.add(item);
    }

    public boolean isGuestOrder() {
        return buyerId == null;
    }
}
