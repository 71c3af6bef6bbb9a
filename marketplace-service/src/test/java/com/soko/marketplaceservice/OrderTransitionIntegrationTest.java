package com.soko.marketplaceservice;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.soko.marketplaceservice.dto.MessageRequest;
import com.soko.marketplaceservice.dto.OrderReplyRequest;
import com.soko.marketplaceservice.dto.OrderTransitionRequest;
import com.soko.marketplaceservice.model.Message;
import com.soko.marketplaceservice.model.Order;
import com.soko.marketplaceservice.model.OrderItem;
import com.soko.marketplaceservice.model.OrderStatus;
import com.soko.marketplaceservice.model.PaymentStatus;
import com.soko.marketplaceservice.model.Product;
import com.soko.marketplaceservice.model.User;
import com.soko.marketplaceservice.model.UserRole;
import com.soko.marketplaceservice.repository.IdempotentEventRepository;
import com.soko.marketplaceservice.repository.MessageRepository;
import com.soko.marketplaceservice.repository.OrderRepository;
import com.soko.marketplaceservice.repository.OutboxRepository;
import com.soko.marketplaceservice.repository.ProductRepository;
import com.soko.marketplaceservice.repository.UserRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.RequestPostProcessor;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@AutoConfigureMockMvc
public class OrderTransitionIntegrationTest extends AbstractIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private OrderRepository orderRepository;

    @Autowired
    private OutboxRepository outboxRepository;

    @Autowired
    private ProductRepository productRepository;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private MessageRepository messageRepository;

    @Autowired
    private IdempotentEventRepository idempotentEventRepository;

    private User seller;
    private User buyer;
    private Product tomatoes;
    private Order pendingOrder;

    @BeforeEach
    void setUp() {
        seller = userRepository.save(User.builder().name("Seller").email("seller@soko.rw").role(UserRole.SELLER).build());
        buyer = userRepository.save(User.builder().name("Buyer").email("buyer@soko.rw").build());
        // stock already reflects the 3 units held by the pending order
        tomatoes = productRepository.save(Product.builder()
                .name("Tomatoes").price(new BigDecimal("1500")).stock(7).sellerId(seller.getId()).build());

        Order order = new Order();
        order.setBuyerId(buyer.getId());
        order.setStatus(OrderStatus.PENDING);
        order.setPaymentStatus(PaymentStatus.PENDING);
        order.setTotalAmount(new BigDecimal("4500"));
        OrderItem item = new OrderItem();
        item.setProductId(tomatoes.getId());
        item.setProductName("Tomatoes");
        item.setQuantity(3);
        item.setUnitPrice(new BigDecimal("1500"));
        order.addItem(item);
        pendingOrder = orderRepository.save(order);
    }

    @AfterEach
    void tearDown() {
        messageRepository.deleteAll();
        orderRepository.deleteAll();
        outboxRepository.deleteAll();
        idempotentEventRepository.deleteAllInBatch();
        productRepository.deleteAll();
        userRepository.deleteAll();
    }

    private RequestPostProcessor as(User user, String role) {
        return jwt().jwt(builder -> builder.subject(user.getId().toString()).claim("role", role));
    }

    private String body(Object value) throws Exception {
        return objectMapper.writeValueAsString(value);
    }

    @Test
    void should_confirm_order_when_seller_approves() throws Exception {
        mockMvc.perform(put("/api/v1/orders/" + pendingOrder.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(OrderTransitionRequest.builder().action("approve").build()))
                        .with(as(seller, "seller")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CONFIRMED"));

        assertEquals(OrderStatus.CONFIRMED, orderRepository.findById(pendingOrder.getId()).orElseThrow().getStatus());
        assertEquals(7, productRepository.findById(tomatoes.getId()).orElseThrow().getStock());
        assertEquals(1, outboxRepository.findByAggregateIdAndType(
                pendingOrder.getId().toString(), "order.status_changed").size());
    }

    @Test
    void should_restore_stock_when_seller_rejects() throws Exception {
        mockMvc.perform(put("/api/v1/orders/" + pendingOrder.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(OrderTransitionRequest.builder().action("reject").build()))
                        .with(as(seller, "seller")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CANCELLED"));

        assertEquals(10, productRepository.findById(tomatoes.getId()).orElseThrow().getStock());
    }

    @Test
    void should_let_buyer_cancel_own_pending_order_once() throws Exception {
        mockMvc.perform(put("/api/v1/orders/" + pendingOrder.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(OrderTransitionRequest.builder().action("cancel").build()))
                        .with(as(buyer, "user")))
                .andExpect(status().isOk());

        // second cancel must not restore stock again
        mockMvc.perform(put("/api/v1/orders/" + pendingOrder.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(OrderTransitionRequest.builder().action("cancel").build()))
                        .with(as(buyer, "user")))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.errorCode").value("ACCESS_DENIED"));

        assertEquals(10, productRepository.findById(tomatoes.getId()).orElseThrow().getStock());
    }

    @Test
    void should_deny_seller_without_products_in_order() throws Exception {
        User otherSeller = userRepository.save(User.builder().name("Other").email("other@soko.rw").role(UserRole.SELLER).build());

        mockMvc.perform(put("/api/v1/orders/" + pendingOrder.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(OrderTransitionRequest.builder().action("approve").build()))
                        .with(as(otherSeller, "seller")))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.errorCode").value("ACCESS_DENIED"));

        assertEquals(OrderStatus.PENDING, orderRepository.findById(pendingOrder.getId()).orElseThrow().getStatus());
    }

    @Test
    void should_let_admin_ship_confirmed_order_without_side_effects() throws Exception {
        pendingOrder.setStatus(OrderStatus.CONFIRMED);
        orderRepository.save(pendingOrder);
        User admin = userRepository.save(User.builder().name("Admin").email("admin@soko.rw").role(UserRole.ADMIN).build());

        mockMvc.perform(put("/api/v1/orders/" + pendingOrder.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(OrderTransitionRequest.builder().status("shipped").build()))
                        .with(as(admin, "admin")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("SHIPPED"));

        assertEquals(7, productRepository.findById(tomatoes.getId()).orElseThrow().getStock());
        assertTrue(outboxRepository.findByAggregateIdAndType(
                pendingOrder.getId().toString(), "order.status_changed").isEmpty());
    }

    @Test
    void should_reject_approving_a_non_pending_order() throws Exception {
        pendingOrder.setStatus(OrderStatus.CANCELLED);
        orderRepository.save(pendingOrder);

        mockMvc.perform(put("/api/v1/orders/" + pendingOrder.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(OrderTransitionRequest.builder().action("approve").build()))
                        .with(as(seller, "seller")))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.errorCode").value("INVALID_TRANSITION"));
    }

    @Test
    void should_apply_seller_reply_to_order_message() throws Exception {
        Message notification = messageRepository.save(Message.builder()
                .senderId(buyer.getId())
                .receiverId(seller.getId())
                .orderId(pendingOrder.getId())
                .content("New order")
                .build());

        mockMvc.perform(put("/api/v1/messages/order/" + notification.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(new OrderReplyRequest("reject")))
                        .with(as(seller, "seller")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CANCELLED"));

        assertTrue(messageRepository.findById(notification.getId()).orElseThrow().getIsRead());
        assertEquals(10, productRepository.findById(tomatoes.getId()).orElseThrow().getStock());
    }

    @Test
    void should_refuse_reply_from_someone_other_than_the_receiver() throws Exception {
        Message notification = messageRepository.save(Message.builder()
                .senderId(buyer.getId())
                .receiverId(seller.getId())
                .orderId(pendingOrder.getId())
                .content("New order")
                .build());

        mockMvc.perform(put("/api/v1/messages/order/" + notification.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(new OrderReplyRequest("approve")))
                        .with(as(buyer, "seller")))
                .andExpect(status().isForbidden());

        assertFalse(messageRepository.findById(notification.getId()).orElseThrow().getIsRead());
    }

    @Test
    void should_tag_buyer_message_with_order() throws Exception {
        mockMvc.perform(post("/api/v1/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(MessageRequest.builder()
                                .receiverId(seller.getId())
                                .content("Can you deliver before noon?")
                                .orderId(pendingOrder.getId())
                                .build()))
                        .with(as(buyer, "user")))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.orderId").value(pendingOrder.getId()));

        mockMvc.perform(post("/api/v1/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(MessageRequest.builder()
                                .receiverId(seller.getId())
                                .content("And this one?")
                                .orderId(pendingOrder.getId() + 1000)
                                .build()))
                        .with(as(buyer, "user")))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("RESOURCE_NOT_FOUND"));

        assertEquals(1, messageRepository.count());
    }
}
