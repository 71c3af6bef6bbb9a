package com.soko.marketplaceservice.service;

import com.soko.common.contracts.OrderLineContract;
import com.soko.common.contracts.OrderPlacedContract;
import com.soko.common.contracts.OrderStatusChangedContract;
import com.soko.marketplaceservice.config.MarketplaceProperties;
import com.soko.marketplaceservice.model.IdempotentEvent;
import com.soko.marketplaceservice.model.Product;
import com.soko.marketplaceservice.repository.IdempotentEventRepository;
import com.soko.marketplaceservice.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OrderNotificationServiceTest {

    @Mock
    private CatalogService catalogService;
    @Mock
    private MessageService messageService;
    @Mock
    private UserRepository userRepository;
    @Mock
    private IdempotentEventRepository idempotentEventRepository;
    @Spy
    private MarketplaceProperties properties = new MarketplaceProperties();

    @InjectMocks
    private OrderNotificationService orderNotificationService;

    private OrderPlacedContract placed;

    @BeforeEach
    void setUp() {
        placed = OrderPlacedContract.builder()
                .orderId(12L)
                .buyerId(3L)
                .totalAmount(new BigDecimal("5300"))
                .createdAt(Instant.now())
                .items(List.of(
                        line(1L, "Tomatoes", 3, "1500.00"),
                        line(2L, "Beans", 1, "800"),
                        line(5L, "Avocado", 2, "0.50")))
                .build();
    }

    private static OrderLineContract line(Long productId, String name, int quantity, String price) {
        return OrderLineContract.builder()
                .productId(productId)
                .productName(name)
                .quantity(quantity)
                .unitPrice(new BigDecimal(price))
                .build();
    }

    private static Product product(Long id, Long sellerId) {
        return Product.builder().id(id).sellerId(sellerId).stock(0).build();
    }

    @Test
    void notifySellers_OneMessagePerSellerWithTheirLinesOnly() {
        when(idempotentEventRepository.existsById("SELLER_FANOUT:12")).thenReturn(false);
        when(catalogService.findProducts(List.of(1L, 2L, 5L))).thenReturn(Map.of(
                1L, product(1L, 9L),
                2L, product(2L, 10L),
                5L, product(5L, 9L)));
        when(userRepository.existsById(anyLong())).thenReturn(true);

        int notified = orderNotificationService.notifySellers(placed);

        assertThat(notified).isEqualTo(2);
        ArgumentCaptor<String> content = ArgumentCaptor.forClass(String.class);
        verify(messageService).send(eq(3L), eq(9L), content.capture(), isNull(), eq(12L));
        assertThat(content.getValue()).isEqualTo("New order #12 received!\n"
                + "Products: Tomatoes (3 x 1500 RWF), Avocado (2 x 0.5 RWF)\n"
                + "Total: 4501 RWF\n"
                + "Please approve or reject this order.");
        verify(messageService).send(eq(3L), eq(10L), contains("Beans (1 x 800 RWF)"), isNull(), eq(12L));
        verify(idempotentEventRepository).saveAndFlush(any(IdempotentEvent.class));
    }

    @Test
    void notifySellers_SecondDeliveryIsSkipped() {
        when(idempotentEventRepository.existsById("SELLER_FANOUT:12")).thenReturn(true);

        assertThat(orderNotificationService.notifySellers(placed)).isZero();

        verifyNoInteractions(messageService, catalogService);
        verify(idempotentEventRepository, never()).saveAndFlush(any());
    }

    @Test
    void notifySellers_GuestOrderHasNoSender() {
        placed.setBuyerId(null);
        placed.setItems(List.of(line(1L, "Tomatoes", 1, "1500")));
        when(catalogService.findProducts(List.of(1L))).thenReturn(Map.of(1L, product(1L, 9L)));
        when(userRepository.existsById(9L)).thenReturn(true);

        orderNotificationService.notifySellers(placed);

        verify(messageService).send(isNull(), eq(9L), anyString(), isNull(), eq(12L));
    }

    @Test
    void notifySellers_SkipsDeletedProductsAndMissingSellers() {
        when(catalogService.findProducts(List.of(1L, 2L, 5L))).thenReturn(Map.of(
                1L, product(1L, 9L),
                2L, product(2L, 10L)));
        when(userRepository.existsById(9L)).thenReturn(true);
        when(userRepository.existsById(10L)).thenReturn(false);

        assertThat(orderNotificationService.notifySellers(placed)).isEqualTo(1);

        ArgumentCaptor<String> content = ArgumentCaptor.forClass(String.class);
        verify(messageService).send(eq(3L), eq(9L), content.capture(), isNull(), eq(12L));
        assertThat(content.getValue()).doesNotContain("Avocado");
    }

    @Test
    void notifySellers_UsesConfiguredCurrency() {
        properties.setCurrency("KES");
        placed.setItems(List.of(line(1L, "Tomatoes", 2, "100")));
        when(catalogService.findProducts(List.of(1L))).thenReturn(Map.of(1L, product(1L, 9L)));
        when(userRepository.existsById(9L)).thenReturn(true);

        orderNotificationService.notifySellers(placed);

        verify(messageService).send(eq(3L), eq(9L), contains("Total: 200 KES"), isNull(), eq(12L));
    }

    @Test
    void notifyBuyer_PostsSystemMessage() {
        OrderStatusChangedContract changed = OrderStatusChangedContract.builder()
                .orderId(12L).buyerId(3L).oldStatus("PENDING").newStatus("CONFIRMED").changedBy(9L).build();
        when(idempotentEventRepository.existsById("BUYER_STATUS:12:CONFIRMED")).thenReturn(false);
        when(userRepository.existsById(3L)).thenReturn(true);

        assertThat(orderNotificationService.notifyBuyer(changed)).isTrue();

        verify(messageService).send(null, 3L, "Your order #12 is now CONFIRMED.", null, 12L);
    }

    @Test
    void notifyBuyer_GuestOrderIsSkipped() {
        OrderStatusChangedContract changed = OrderStatusChangedContract.builder()
                .orderId(12L).buyerId(null).oldStatus("PENDING").newStatus("CANCELLED").build();

        assertThat(orderNotificationService.notifyBuyer(changed)).isFalse();

        verifyNoInteractions(messageService, idempotentEventRepository);
    }

    @Test
    void notifyBuyer_DuplicateIsSkipped() {
        OrderStatusChangedContract changed = OrderStatusChangedContract.builder()
                .orderId(12L).buyerId(3L).oldStatus("PENDING").newStatus("CANCELLED").build();
        when(idempotentEventRepository.existsById("BUYER_STATUS:12:CANCELLED")).thenReturn(true);

        assertThat(orderNotificationService.notifyBuyer(changed)).isFalse();

        verifyNoInteractions(messageService);
    }
}
