package com.soko.marketplaceservice.service;

import com.soko.common.exception.AccessDeniedException;
import com.soko.common.exception.ResourceNotFoundException;
import com.soko.marketplaceservice.config.MarketplaceProperties;
import com.soko.marketplaceservice.dto.OrderResponse;
import com.soko.marketplaceservice.mapper.OrderMapper;
import com.soko.marketplaceservice.model.Order;
import com.soko.marketplaceservice.model.OrderItem;
import com.soko.marketplaceservice.repository.OrderRepository;
import com.soko.marketplaceservice.security.CallerIdentity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class OrderQueryService {

    private final OrderRepository orderRepository;
    private final CatalogService catalogService;
    private final OrderMapper orderMapper;
    private final MarketplaceProperties properties;

    @Transactional(readOnly = true)
    public Page<OrderResponse> listOrders(Long buyerId, int page, int size) {
        return orderRepository.findByBuyerIdOrderByCreatedAtDescIdDesc(buyerId, pageRequest(page, size, properties))
                .map(orderMapper::toOrderResponse);
    }

    @Transactional(readOnly = true)
    public List<OrderResponse> listSellerOrders(CallerIdentity caller) {
        if (!caller.isSeller()) {
            log.warn("Access denied: User {} (role={}) requested seller orders", caller.getUserId(), caller.getRole());
            throw new AccessDeniedException("Access Denied: Only sellers can list seller orders");
        }
        return orderRepository.findOrdersForSeller(caller.getUserId()).stream()
                .map(orderMapper::toOrderResponse)
                .collect(Collectors.toList());
    }

    /**
     * Visible to the buyer, to admins and to sellers with at least one product in the order.
     */
    @Transactional(readOnly = true)
    public OrderResponse getOrder(Long orderId, CallerIdentity caller) {
        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> {
                    log.warn("Order not found: orderId={}", orderId);
                    return new ResourceNotFoundException("Order not found with id: " + orderId);
                });

        boolean allowed = caller.isAdmin()
                || caller.getUserId().equals(order.getBuyerId())
                || (caller.isSeller() && catalogService.ownsAnyProduct(caller.getUserId(),
                        order.getItems().stream().map(OrderItem::getProductId).collect(Collectors.toList())));
        if (!allowed) {
            log.warn("Access denied: User {} attempted to view order {}", caller.getUserId(), orderId);
            throw new AccessDeniedException("Access Denied: You are not authorized to view this order");
        }
        return orderMapper.toOrderResponse(order);
    }

    static Pageable pageRequest(int page, int size, MarketplaceProperties properties) {
        if (page < 0) {
            throw new IllegalArgumentException("Page index must not be negative");
        }
        if (size < 1) {
            throw new IllegalArgumentException("Page size must be at least 1");
        }
        return PageRequest.of(page, Math.min(size, properties.getMaxPageSize()));
    }
}
