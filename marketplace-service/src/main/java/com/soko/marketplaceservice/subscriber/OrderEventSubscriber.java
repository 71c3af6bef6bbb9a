package com.soko.marketplaceservice.subscriber;

import com.soko.common.contracts.OrderPlacedContract;
import com.soko.common.contracts.OrderStatusChangedContract;
import com.soko.marketplaceservice.config.AmqpConfig;
import com.soko.marketplaceservice.service.OrderNotificationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.stereotype.Component;

/**
 * Consumes order events after commit and turns them into messages.
 *
 * Failures are logged and the event is acknowledged: a notification problem never reaches the
 * order that was already committed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OrderEventSubscriber {

    private final OrderNotificationService orderNotificationService;

    @RabbitListener(queues = AmqpConfig.Q_SELLER_FANOUT)
    public void handleOrderPlaced(OrderPlacedContract contract) {
        log.info("Received 'order.placed' event: orderId={}, items={}",
                contract.getOrderId(), contract.getItems() == null ? 0 : contract.getItems().size());
        try {
            orderNotificationService.notifySellers(contract);
        } catch (Exception e) {
            log.error("Seller fan-out failed: orderId={}, error={}", contract.getOrderId(), e.getMessage(), e);
        }
    }

    @RabbitListener(queues = AmqpConfig.Q_BUYER_UPDATES)
    public void handleOrderStatusChanged(OrderStatusChangedContract contract) {
        log.info("Received 'order.status_changed' event: orderId={}, from={}, to={}",
                contract.getOrderId(), contract.getOldStatus(), contract.getNewStatus());
        try {
            orderNotificationService.notifyBuyer(contract);
        } catch (Exception e) {
            log.error("Buyer status message failed: orderId={}, error={}", contract.getOrderId(), e.getMessage(), e);
        }
    }
}
