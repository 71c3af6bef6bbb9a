package com.soko.marketplaceservice.controller;

import com.soko.marketplaceservice.dto.OrderRequest;
import com.soko.marketplaceservice.dto.OrderResponse;
import com.soko.marketplaceservice.dto.OrderTransitionRequest;
import com.soko.marketplaceservice.mapper.OrderMapper;
import com.soko.marketplaceservice.model.BuyerIdentity;
import com.soko.marketplaceservice.security.CallerIdentity;
import com.soko.marketplaceservice.security.CallerResolver;
import com.soko.marketplaceservice.service.OrderPlacementService;
import com.soko.marketplaceservice.service.OrderQueryService;
import com.soko.marketplaceservice.service.OrderTransitionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/orders")
@RequiredArgsConstructor
public class OrderController {

    private final OrderPlacementService orderPlacementService;
    private final OrderTransitionService orderTransitionService;
    private final OrderQueryService orderQueryService;
    private final CallerResolver callerResolver;
    private final OrderMapper orderMapper;

    // jwt is null for guest checkout
    @PostMapping
    public ResponseEntity<OrderResponse> placeOrder(
            @Valid @RequestBody OrderRequest orderRequest,
            @AuthenticationPrincipal Jwt jwt) {
        BuyerIdentity buyer = callerResolver.resolveBuyer(jwt,
                orderRequest.getBuyerContact() == null ? null : orderMapper.toGuestContact(orderRequest.getBuyerContact()));
        OrderResponse response = orderPlacementService.placeOrder(buyer, orderRequest.getItems());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping
    public ResponseEntity<Page<OrderResponse>> listOrders(
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "10") int size,
            @AuthenticationPrincipal Jwt jwt) {
        CallerIdentity caller = callerResolver.resolve(jwt);
        return ResponseEntity.ok(orderQueryService.listOrders(caller.getUserId(), page, size));
    }

    @GetMapping("/seller")
    public ResponseEntity<List<OrderResponse>> listSellerOrders(@AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(orderQueryService.listSellerOrders(callerResolver.resolve(jwt)));
    }

    @GetMapping("/{orderId}")
    public ResponseEntity<OrderResponse> getOrder(
            @PathVariable Long orderId,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(orderQueryService.getOrder(orderId, callerResolver.resolve(jwt)));
    }

    @PutMapping("/{orderId}")
    public ResponseEntity<OrderResponse> transitionOrder(
            @PathVariable Long orderId,
            @RequestBody OrderTransitionRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        OrderResponse response = orderTransitionService.transitionOrder(orderId, callerResolver.resolve(jwt), request);
        return ResponseEntity.ok(response);
    }
}
