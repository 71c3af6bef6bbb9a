package com.soko.marketplaceservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;

/**
 * A persistent message between users. Order notifications to sellers are messages with
 * {@code orderId} set; status updates to buyers are system messages with no sender.
 */
@Entity
@Table(name = "messages", indexes = {
        @Index(name = "idx_message_receiver_read", columnList = "receiver_id,is_read"),
        @Index(name = "idx_message_sender_receiver", columnList = "sender_id,receiver_id"),
        @Index(name = "idx_message_order", columnList = "order_id")
})
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Message {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @ToString.Include
    private Long id;

    @Column(name = "sender_id")
    private Long senderId; // null for guests and system messages

    @Column(name = "receiver_id", nullable = false)
    @ToString.Include
    private Long receiverId;

    @Column(name = "product_id")
    private Long productId;

    @Column(name = "order_id")
    @ToString.Include
    private Long orderId;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String content;

    @Column(name = "is_read", nullable = false)
    @Builder.Default
    private Boolean isRead = false;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
