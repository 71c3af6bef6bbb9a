package com.soko.marketplaceservice.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.soko.common.contracts.OrderLineContract;
import com.soko.common.contracts.OrderPlacedContract;
import com.soko.common.contracts.OrderStatusChangedContract;
import com.soko.marketplaceservice.config.AmqpConfig;
import com.soko.marketplaceservice.model.Order;
import com.soko.marketplaceservice.model.OrderStatus;
import com.soko.marketplaceservice.model.OutboxEvent;
import com.soko.marketplaceservice.repository.OutboxRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Writes order events to the outbox table. Must be called inside the transaction that
 * changed the order, so the event commits or rolls back together with it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrderOutboxService {

    private static final String AGGREGATE_TYPE = "ORDER";

    private final OutboxRepository outboxRepository;
    private final ObjectMapper objectMapper;

    @Transactional(propagation = Propagation.MANDATORY)
    public void saveOrderPlacedEvent(Order order) {
        List<OrderLineContract> lines = order.getItems().stream()
                .map(item -> OrderLineContract.builder()
                        .productId(item.getProductId())
                        .productName(item.getProductName())
                        .quantity(item.getQuantity())
                        .unitPrice(item.getUnitPrice())
                        .build())
                .collect(Collectors.toList());

        OrderPlacedContract contract = OrderPlacedContract.builder()
                .orderId(order.getId())
                .buyerId(order.getBuyerId())
                .items(lines)
                .totalAmount(order.getTotalAmount())
                .createdAt(order.getCreatedAt())
                .build();

        save(order.getId(), AmqpConfig.ROUTING_KEY_ORDER_PLACED, contract);
        log.info("'order.placed' event saved to Outbox. orderId={}", order.getId());
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void saveStatusChangedEvent(Order order, OrderStatus oldStatus, Long changedBy, boolean stockRestored) {
        OrderStatusChangedContract contract = OrderStatusChangedContract.builder()
                .orderId(order.getId())
                .buyerId(order.getBuyerId())
                .oldStatus(oldStatus.name())
                .newStatus(order.getStatus().name())
                .changedBy(changedBy)
                .stockRestored(stockRestored)
                .build();

        save(order.getId(), AmqpConfig.ROUTING_KEY_ORDER_STATUS_CHANGED, contract);
        log.info("'order.status_changed' event saved to Outbox. orderId={}, from={}, to={}",
                order.getId(), oldStatus, order.getStatus());
    }

    private void save(Long orderId, String type, Object payloadObj) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(payloadObj);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize outbox event: orderId={}, type={}", orderId, type, e);
            throw new IllegalStateException("Failed to serialize outbox event " + type, e);
        }

        outboxRepository.save(OutboxEvent.builder()
                .aggregateType(AGGREGATE_TYPE)
                .aggregateId(orderId.toString())
                .type(type)
                .payload(payload)
                .createdAt(LocalDateTime.now())
                .processed(false)
                .build());
    }
}
