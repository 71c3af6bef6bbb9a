package com.soko.marketplaceservice.service;

import com.soko.common.exception.AccessDeniedException;
import com.soko.common.exception.ResourceNotFoundException;
import com.soko.marketplaceservice.dto.OrderResponse;
import com.soko.marketplaceservice.dto.OrderTransitionRequest;
import com.soko.marketplaceservice.exception.InvalidOrderStateException;
import com.soko.marketplaceservice.mapper.OrderMapper;
import com.soko.marketplaceservice.model.Message;
import com.soko.marketplaceservice.model.Order;
import com.soko.marketplaceservice.model.OrderAction;
import com.soko.marketplaceservice.model.OrderItem;
import com.soko.marketplaceservice.model.OrderStatus;
import com.soko.marketplaceservice.repository.OrderRepository;
import com.soko.marketplaceservice.security.CallerIdentity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Moves orders through their lifecycle.
 *
 * Actions (approve, reject, cancel) and direct status changes are checked against the same
 * table in {@link OrderStatus}. Cancelling gives the stock back in the same transaction as the
 * status update, and the order's version column makes sure only one of two racing
 * cancellations commits.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrderTransitionService {

    private final OrderRepository orderRepository;
    private final CatalogService catalogService;
    private final MessageService messageService;
    private final OrderOutboxService orderOutboxService;
    private final OrderMapper orderMapper;

    @Transactional
    public OrderResponse transitionOrder(Long orderId, CallerIdentity caller, OrderTransitionRequest request) {
        boolean hasAction = request.getAction() != null && !request.getAction().isBlank();
        boolean hasStatus = request.getStatus() != null && !request.getStatus().isBlank();
        if (hasAction == hasStatus) {
            throw new IllegalArgumentException("Provide exactly one of 'action' or 'status'");
        }
        OrderAction action = hasAction ? OrderAction.from(request.getAction()) : null;
        OrderStatus requestedStatus = hasStatus ? OrderStatus.from(request.getStatus()) : null;

        log.info("Order transition started. orderId={}, callerId={}, role={}, action={}, status={}",
                orderId, caller.getUserId(), caller.getRole(), action, requestedStatus);

        Order order = findOrder(orderId);
        authorize(order, caller, action);

        OrderStatus target;
        if (action != null) {
            if (order.getStatus() != OrderStatus.PENDING) {
                log.warn("Invalid state transition: orderId={}, currentStatus={}, attemptedAction={}",
                        orderId, order.getStatus(), action);
                throw new InvalidOrderStateException(
                        "Order status must be PENDING to " + action.name().toLowerCase() + ". Current status: "
                                + order.getStatus());
            }
            target = action.getTargetStatus();
        } else {
            if (order.getStatus().isTerminal()) {
                log.warn("Transition on terminal order rejected: orderId={}, currentStatus={}, requestedStatus={}",
                        orderId, order.getStatus(), requestedStatus);
                throw new InvalidOrderStateException(
                        "Order is already " + order.getStatus() + " and can no longer change");
            }
            if (!order.getStatus().canTransitionTo(requestedStatus)) {
                log.warn("Invalid state transition: orderId={}, currentStatus={}, requestedStatus={}",
                        orderId, order.getStatus(), requestedStatus);
                throw new InvalidOrderStateException(
                        "Cannot change order status from " + order.getStatus() + " to " + requestedStatus);
            }
            target = requestedStatus;
        }

        return orderMapper.toOrderResponse(applyTransition(order, target, caller.getUserId()));
    }

    /**
     * A seller answering the order notification they received. The transition and marking the
     * notification read commit together.
     */
    @Transactional
    public OrderResponse handleOrderReply(Long messageId, CallerIdentity caller, String actionValue) {
        Message message = messageService.getMessage(messageId);

        if (message.getOrderId() == null) {
            log.warn("Reply to a message without order: messageId={}", messageId);
            throw new IllegalArgumentException("This message is not linked to an order");
        }
        if (!message.getReceiverId().equals(caller.getUserId())) {
            log.warn("Access denied: User {} attempted to answer message {} addressed to {}",
                    caller.getUserId(), messageId, message.getReceiverId());
            throw new AccessDeniedException("Access Denied: You are not the receiver of this message");
        }

        Order order = findOrder(message.getOrderId());
        if (!catalogService.ownsAnyProduct(caller.getUserId(), productIds(order))) {
            log.warn("Access denied: User {} owns no product in order {}", caller.getUserId(), order.getId());
            throw new AccessDeniedException("Access Denied: You have no products in this order");
        }

        OrderAction action = OrderAction.from(actionValue);
        if (action == OrderAction.CANCEL) {
            throw new IllegalArgumentException("Order replies accept 'approve' or 'reject'");
        }
        if (order.getStatus() != OrderStatus.PENDING) {
            log.warn("Invalid state transition: orderId={}, currentStatus={}, attemptedAction={} (reply)",
                    order.getId(), order.getStatus(), action);
            throw new InvalidOrderStateException(
                    "Order has already been processed. Current status: " + order.getStatus());
        }

        Order updated = applyTransition(order, action.getTargetStatus(), caller.getUserId());
        messageService.markMessageRead(messageId);
        log.info("Order reply handled: messageId={}, orderId={}, action={}", messageId, order.getId(), action);
        return orderMapper.toOrderResponse(updated);
    }

    private Order applyTransition(Order order, OrderStatus target, Long changedBy) {
        OrderStatus oldStatus = order.getStatus();
        order.setStatus(target);

        // Flush now so a concurrent transition fails on the version check before any stock moves
        Order updated = orderRepository.saveAndFlush(order);
        log.info("Order status updated: orderId={}, from={}, to={}, by={}",
                order.getId(), oldStatus, target, changedBy);

        boolean stockRestored = false;
        if (target == OrderStatus.CANCELLED) {
            restoreStock(updated);
            stockRestored = true;
        }

        // Seller decisions are reported to the buyer; fulfilment updates are plain overwrites
        if (oldStatus == OrderStatus.PENDING) {
            orderOutboxService.saveStatusChangedEvent(updated, oldStatus, changedBy, stockRestored);
        }
        return updated;
    }

    private void restoreStock(Order order) {
        int restored = 0;
        for (OrderItem item : order.getItems()) {
            if (catalogService.restoreStock(item.getProductId(), item.getQuantity())) {
                restored++;
            }
        }
        log.info("Stock restoration completed: orderId={}, restoredLines={}, totalLines={}",
                order.getId(), restored, order.getItems().size());
    }

    // First match wins: admin, seller with a product in the order, buyer cancelling a pending order
    private void authorize(Order order, CallerIdentity caller, OrderAction action) {
        if (caller.isAdmin()) {
            return;
        }
        if (caller.isSeller() && catalogService.ownsAnyProduct(caller.getUserId(), productIds(order))) {
            return;
        }
        if (action == OrderAction.CANCEL
                && caller.getUserId().equals(order.getBuyerId())
                && order.getStatus() == OrderStatus.PENDING) {
            return;
        }
        log.warn("Access denied: User {} (role={}) attempted to transition order {} (status={})",
                caller.getUserId(), caller.getRole(), order.getId(), order.getStatus());
        throw new AccessDeniedException("Access Denied: You are not authorized to update this order");
    }

    private Order findOrder(Long orderId) {
        return orderRepository.findById(orderId)
                .orElseThrow(() -> {
                    log.warn("Order not found: orderId={}", orderId);
                    return new ResourceNotFoundException("Order not found with id: " + orderId);
                });
    }

    private static List<Long> productIds(Order order) {
        return order.getItems().stream()
                .map(OrderItem::getProductId)
                .collect(Collectors.toList());
    }
}
