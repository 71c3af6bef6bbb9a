package com.soko.marketplaceservice.service;

import com.soko.common.exception.AccessDeniedException;
import com.soko.common.exception.ResourceNotFoundException;
import com.soko.marketplaceservice.config.MarketplaceProperties;
import com.soko.marketplaceservice.dto.PaymentRequest;
import com.soko.marketplaceservice.dto.PaymentResponse;
import com.soko.marketplaceservice.exception.InvalidOrderStateException;
import com.soko.marketplaceservice.mapper.PaymentMapper;
import com.soko.marketplaceservice.model.Order;
import com.soko.marketplaceservice.model.OrderStatus;
import com.soko.marketplaceservice.model.Payment;
import com.soko.marketplaceservice.model.PaymentStatus;
import com.soko.marketplaceservice.repository.OrderRepository;
import com.soko.marketplaceservice.repository.PaymentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Mocked settlement: every payment completes immediately with a generated transaction id.
 * The only writer of {@link Order#getPaymentStatus()}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentService {

    private final PaymentRepository paymentRepository;
    private final OrderRepository orderRepository;
    private final PaymentMapper paymentMapper;
    private final MarketplaceProperties properties;

    @Transactional
    public PaymentResponse pay(Long buyerId, PaymentRequest request) {
        Long orderId = request.getOrderId();
        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> {
                    log.warn("Order not found: orderId={}", orderId);
                    return new ResourceNotFoundException("Order not found with id: " + orderId);
                });

        if (!buyerId.equals(order.getBuyerId())) {
            log.warn("Access denied: User {} attempted to pay order {} of buyer {}",
                    buyerId, orderId, order.getBuyerId());
            throw new AccessDeniedException("Access Denied: You can only pay for your own orders");
        }
        if (order.getPaymentStatus() == PaymentStatus.PAID) {
            log.warn("Payment rejected, order already paid: orderId={}", orderId);
            throw new InvalidOrderStateException("Order is already paid");
        }
        if (order.getStatus() == OrderStatus.CANCELLED) {
            log.warn("Payment rejected, order cancelled: orderId={}", orderId);
            throw new InvalidOrderStateException("Cannot pay for a cancelled order");
        }

        Payment payment = paymentRepository.save(Payment.builder()
                .order(order)
                .amount(order.getTotalAmount())
                .paymentMethod(request.getPaymentMethod())
                .status(Payment.SettlementStatus.COMPLETED)
                .transactionId("MOCK-" + UUID.randomUUID())
                .build());

        order.setPaymentStatus(PaymentStatus.PAID);
        orderRepository.save(order);

        log.info("Payment completed: paymentId={}, orderId={}, method={}, amount={}",
                payment.getId(), orderId, payment.getPaymentMethod(), payment.getAmount());
        return paymentMapper.toPaymentResponse(payment);
    }

    @Transactional(readOnly = true)
    public Page<PaymentResponse> listPayments(Long buyerId, int page, int size) {
        return paymentRepository
                .findByOrderBuyerIdOrderByCreatedAtDesc(buyerId, OrderQueryService.pageRequest(page, size, properties))
                .map(paymentMapper::toPaymentResponse);
    }
}
