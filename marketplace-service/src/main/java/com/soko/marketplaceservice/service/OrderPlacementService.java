package com.soko.marketplaceservice.service;

import com.soko.common.exception.InsufficientStockException;
import com.soko.common.exception.ResourceNotFoundException;
import com.soko.marketplaceservice.dto.OrderItemRequest;
import com.soko.marketplaceservice.dto.OrderResponse;
import com.soko.marketplaceservice.mapper.OrderMapper;
import com.soko.marketplaceservice.model.BuyerIdentity;
import com.soko.marketplaceservice.model.Order;
import com.soko.marketplaceservice.model.OrderItem;
import com.soko.marketplaceservice.model.OrderStatus;
import com.soko.marketplaceservice.model.PaymentStatus;
import com.soko.marketplaceservice.model.Product;
import com.soko.marketplaceservice.repository.OrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns a cart into an order. Validation, stock decrements, the order insert and the
 * 'order.placed' outbox row share one transaction; seller notifications happen after commit
 * in {@link OrderNotificationService}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrderPlacementService {

    private final CatalogService catalogService;
    private final OrderRepository orderRepository;
    private final OrderOutboxService orderOutboxService;
    private final OrderMapper orderMapper;

    @Transactional
    public OrderResponse placeOrder(BuyerIdentity buyer, List<OrderItemRequest> cart) {
        if (buyer == null) {
            throw new IllegalArgumentException("Buyer identity is required");
        }
        Map<Long, Integer> demand = mergeCart(cart);
        log.info("Order placement started. lines={}, products={}", cart.size(), demand.size());

        // 1. Resolve & validate against the aggregated demand, before any mutation
        Map<Long, Product> products = catalogService.findProducts(demand.keySet());
        for (Map.Entry<Long, Integer> line : demand.entrySet()) {
            Product product = products.get(line.getKey());
            if (product == null) {
                log.warn("Product not found during placement: productId={}", line.getKey());
                throw new ResourceNotFoundException("Product not found: " + line.getKey());
            }
            if (product.getStock() < line.getValue()) {
                log.warn("Insufficient stock: productId={}, available={}, requested={}",
                        product.getId(), product.getStock(), line.getValue());
                throw new InsufficientStockException(product.getId(), product.getName(),
                        product.getStock(), line.getValue());
            }
        }

        // 2. Price freeze
        Order order = new Order();
        BigDecimal totalAmount = BigDecimal.ZERO;
        for (Map.Entry<Long, Integer> line : demand.entrySet()) {
            Product product = products.get(line.getKey());
            OrderItem item = new OrderItem();
            item.setProductId(product.getId());
            item.setProductName(product.getName());
            item.setQuantity(line.getValue());
            item.setUnitPrice(product.getPrice());
            order.addItem(item);
            totalAmount = totalAmount.add(item.getSubtotal());
        }

        // 3. Decrement in ascending product id so concurrent carts lock rows in the same order
        new TreeMap<>(demand).forEach((productId, quantity) -> catalogService.adjustStock(productId, -quantity));

        if (buyer instanceof BuyerIdentity.Registered registered) {
            order.setBuyerId(registered.getBuyerId());
        } else if (buyer instanceof BuyerIdentity.Guest guest) {
            order.setGuestContact(guest.getContact());
        }
        order.setTotalAmount(totalAmount);
        order.setStatus(OrderStatus.PENDING);
        order.setPaymentStatus(PaymentStatus.PENDING);

        Order savedOrder = orderRepository.save(order);
        log.info("Order saved to database. orderId={}, buyerId={}, guest={}, totalAmount={}",
                savedOrder.getId(), savedOrder.getBuyerId(), savedOrder.isGuestOrder(), totalAmount);

        // 4. Seller fan-out is driven by this event once the transaction commits
        orderOutboxService.saveOrderPlacedEvent(savedOrder);

        return orderMapper.toOrderResponse(savedOrder);
    }

    // Sums quantities of repeated product ids, keeping first-seen order
    private Map<Long, Integer> mergeCart(List<OrderItemRequest> cart) {
        if (cart == null || cart.isEmpty()) {
            throw new IllegalArgumentException("Order must contain at least one item");
        }
        Map<Long, Integer> demand = new LinkedHashMap<>();
        for (OrderItemRequest line : cart) {
            if (line.getProductId() == null) {
                throw new IllegalArgumentException("Product ID cannot be null");
            }
            if (line.getQuantity() == null || line.getQuantity() < 1) {
                throw new IllegalArgumentException("Quantity must be at least 1 for product " + line.getProductId());
            }
            try {
                demand.merge(line.getProductId(), line.getQuantity(), Math::addExact);
            } catch (ArithmeticException e) {
                throw new IllegalArgumentException("Total quantity too large for product " + line.getProductId(), e);
            }
        }
        return demand;
    }
}
