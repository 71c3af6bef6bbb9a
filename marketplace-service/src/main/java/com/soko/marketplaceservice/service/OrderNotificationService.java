package com.soko.marketplaceservice.service;

import com.soko.common.contracts.OrderLineContract;
import com.soko.common.contracts.OrderPlacedContract;
import com.soko.common.contracts.OrderStatusChangedContract;
import com.soko.marketplaceservice.config.MarketplaceProperties;
import com.soko.marketplaceservice.model.IdempotentEvent;
import com.soko.marketplaceservice.model.Product;
import com.soko.marketplaceservice.repository.IdempotentEventRepository;
import com.soko.marketplaceservice.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Turns committed order events into messages: one per seller when an order is placed, and one
 * to the registered buyer when a seller decides on the order. Each event is handled at most
 * once, keyed in the idempotent_events table.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrderNotificationService {

    private final CatalogService catalogService;
    private final MessageService messageService;
    private final UserRepository userRepository;
    private final IdempotentEventRepository idempotentEventRepository;
    private final MarketplaceProperties properties;

    /**
     * Sends each seller a summary of their part of the order.
     *
     * @return number of sellers notified
     */
    @Transactional
    public int notifySellers(OrderPlacedContract contract) {
        String eventKey = "SELLER_FANOUT:" + contract.getOrderId();
        if (!claim(eventKey)) {
            return 0;
        }

        List<Long> productIds = contract.getItems().stream()
                .map(OrderLineContract::getProductId)
                .collect(Collectors.toList());
        Map<Long, Product> products = catalogService.findProducts(productIds);

        Map<Long, List<OrderLineContract>> linesBySeller = new LinkedHashMap<>();
        for (OrderLineContract line : contract.getItems()) {
            Product product = products.get(line.getProductId());
            if (product == null) {
                log.warn("Product removed after order placement, line skipped in fan-out: orderId={}, productId={}",
                        contract.getOrderId(), line.getProductId());
                continue;
            }
            linesBySeller.computeIfAbsent(product.getSellerId(), id -> new ArrayList<>()).add(line);
        }

        int notified = 0;
        for (Map.Entry<Long, List<OrderLineContract>> entry : linesBySeller.entrySet()) {
            Long sellerId = entry.getKey();
            if (!userRepository.existsById(sellerId)) {
                log.warn("Seller account not found, skipping notification: orderId={}, sellerId={}",
                        contract.getOrderId(), sellerId);
                continue;
            }
            messageService.send(contract.getBuyerId(), sellerId,
                    sellerMessage(contract.getOrderId(), entry.getValue()), null, contract.getOrderId());
            notified++;
        }

        log.info("Seller fan-out completed: orderId={}, sellersNotified={}", contract.getOrderId(), notified);
        return notified;
    }

    /**
     * Tells a registered buyer about the new status of their order. Guest orders are skipped.
     *
     * @return true when a message was stored
     */
    @Transactional
    public boolean notifyBuyer(OrderStatusChangedContract contract) {
        if (contract.getBuyerId() == null) {
            log.debug("Guest order, no buyer message: orderId={}", contract.getOrderId());
            return false;
        }
        if (!claim("BUYER_STATUS:" + contract.getOrderId() + ":" + contract.getNewStatus())) {
            return false;
        }
        if (!userRepository.existsById(contract.getBuyerId())) {
            log.warn("Buyer account not found, skipping status message: orderId={}, buyerId={}",
                    contract.getOrderId(), contract.getBuyerId());
            return false;
        }

        String content = String.format("Your order #%d is now %s.", contract.getOrderId(), contract.getNewStatus());
        messageService.send(null, contract.getBuyerId(), content, null, contract.getOrderId());
        log.info("Buyer status message sent: orderId={}, buyerId={}, status={}",
                contract.getOrderId(), contract.getBuyerId(), contract.getNewStatus());
        return true;
    }

    String sellerMessage(Long orderId, List<OrderLineContract> lines) {
        String currency = properties.getCurrency();
        BigDecimal subtotal = BigDecimal.ZERO;
        List<String> products = new ArrayList<>();
        for (OrderLineContract line : lines) {
            products.add(String.format("%s (%d x %s %s)",
                    line.getProductName(), line.getQuantity(), amount(line.getUnitPrice()), currency));
            subtotal = subtotal.add(line.getUnitPrice().multiply(BigDecimal.valueOf(line.getQuantity())));
        }
        return "New order #" + orderId + " received!\n"
                + "Products: " + String.join(", ", products) + "\n"
                + "Total: " + amount(subtotal) + " " + currency + "\n"
                + "Please approve or reject this order.";
    }

    private static String amount(BigDecimal value) {
        return value.stripTrailingZeros().toPlainString();
    }

    // First writer wins. A concurrent duplicate fails on the primary key and rolls back.
    private boolean claim(String eventKey) {
        if (idempotentEventRepository.existsById(eventKey)) {
            log.warn("Event already processed (idempotency check). Skipping. key={}", eventKey);
            return false;
        }
        idempotentEventRepository.saveAndFlush(IdempotentEvent.builder()
                .eventKey(eventKey)
                .createdAt(LocalDateTime.now())
                .build());
        return true;
    }
}
