package com.soko.marketplaceservice.controller;

import com.soko.marketplaceservice.dto.MarkReadResponse;
import com.soko.marketplaceservice.dto.MessageRequest;
import com.soko.marketplaceservice.dto.MessageResponse;
import com.soko.marketplaceservice.dto.OrderReplyRequest;
import com.soko.marketplaceservice.dto.OrderResponse;
import com.soko.marketplaceservice.dto.UnreadCountResponse;
import com.soko.marketplaceservice.security.CallerIdentity;
import com.soko.marketplaceservice.security.CallerResolver;
import com.soko.marketplaceservice.service.MessageService;
import com.soko.marketplaceservice.service.OrderTransitionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/messages")
@RequiredArgsConstructor
public class MessageController {

    private final MessageService messageService;
    private final OrderTransitionService orderTransitionService;
    private final CallerResolver callerResolver;

    @PostMapping
    public ResponseEntity<MessageResponse> sendMessage(
            @Valid @RequestBody MessageRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        CallerIdentity caller = callerResolver.resolve(jwt);
        MessageResponse response = messageService.send(caller.getUserId(), request.getReceiverId(),
                request.getContent(), request.getProductId(), request.getOrderId());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping
    public ResponseEntity<List<MessageResponse>> listMessages(@AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(messageService.listFor(callerResolver.resolve(jwt).getUserId()));
    }

    @GetMapping("/conversation/{otherUserId}")
    public ResponseEntity<List<MessageResponse>> conversation(
            @PathVariable Long otherUserId,
            @RequestParam(required = false) Long productId,
            @AuthenticationPrincipal Jwt jwt) {
        Long me = callerResolver.resolve(jwt).getUserId();
        return ResponseEntity.ok(messageService.conversation(me, otherUserId, productId));
    }

    @PutMapping("/read/{otherUserId}")
    public ResponseEntity<MarkReadResponse> markRead(
            @PathVariable Long otherUserId,
            @AuthenticationPrincipal Jwt jwt) {
        Long me = callerResolver.resolve(jwt).getUserId();
        return ResponseEntity.ok(new MarkReadResponse(messageService.markRead(otherUserId, me)));
    }

    @GetMapping("/unread-count")
    public ResponseEntity<UnreadCountResponse> unreadCount(@AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(new UnreadCountResponse(messageService.unreadCount(callerResolver.resolve(jwt).getUserId())));
    }

    @PutMapping("/order/{messageId}")
    public ResponseEntity<OrderResponse> replyToOrder(
            @PathVariable Long messageId,
            @Valid @RequestBody OrderReplyRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        OrderResponse response = orderTransitionService.handleOrderReply(messageId, callerResolver.resolve(jwt),
                request.getAction());
        return ResponseEntity.ok(response);
    }
}
