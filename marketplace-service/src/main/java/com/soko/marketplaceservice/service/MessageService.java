package com.soko.marketplaceservice.service;

import com.soko.common.exception.ResourceNotFoundException;
import com.soko.marketplaceservice.dto.MessageResponse;
import com.soko.marketplaceservice.mapper.MessageMapper;
import com.soko.marketplaceservice.model.Message;
import com.soko.marketplaceservice.repository.MessageRepository;
import com.soko.marketplaceservice.repository.OrderRepository;
import com.soko.marketplaceservice.repository.ProductRepository;
import com.soko.marketplaceservice.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Persistent user-to-user messages. Order notifications to sellers and status updates to
 * buyers go through here too. Retrieval is by polling.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MessageService {

    private final MessageRepository messageRepository;
    private final UserRepository userRepository;
    private final ProductRepository productRepository;
    private final OrderRepository orderRepository;
    private final MessageMapper messageMapper;

    /**
     * Stores a message.
     *
     * @param senderId null for guests and system messages
     * @param productId optional product the message is about
     * @param orderId optional order the message is about
     */
    @Transactional
    public MessageResponse send(Long senderId, Long receiverId, String content, Long productId, Long orderId) {
        String body = content == null ? "" : content.trim();
        if (body.isEmpty()) {
            throw new IllegalArgumentException("Message content cannot be empty");
        }
        if (receiverId == null || !userRepository.existsById(receiverId)) {
            log.warn("Message rejected, receiver not found: receiverId={}", receiverId);
            throw new ResourceNotFoundException("Receiver not found: " + receiverId);
        }
        if (productId != null && !productRepository.existsById(productId)) {
            log.warn("Message rejected, product not found: productId={}", productId);
            throw new ResourceNotFoundException("Product not found: " + productId);
        }
        if (orderId != null && !orderRepository.existsById(orderId)) {
            log.warn("Message rejected, order not found: orderId={}", orderId);
            throw new ResourceNotFoundException("Order not found: " + orderId);
        }

        Message saved = messageRepository.save(Message.builder()
                .senderId(senderId)
                .receiverId(receiverId)
                .content(body)
                .productId(productId)
                .orderId(orderId)
                .isRead(false)
                .build());

        log.info("Message stored: id={}, senderId={}, receiverId={}, orderId={}",
                saved.getId(), senderId, receiverId, orderId);
        return messageMapper.toMessageResponse(saved);
    }

    @Transactional(readOnly = true)
    public List<MessageResponse> listFor(Long userId) {
        return messageRepository.findBySenderIdOrReceiverIdOrderByCreatedAtDescIdDesc(userId, userId).stream()
                .map(messageMapper::toMessageResponse)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<MessageResponse> conversation(Long userId, Long otherUserId, Long productId) {
        List<Message> messages = productId == null
                ? messageRepository.findConversation(userId, otherUserId)
                : messageRepository.findConversationAboutProduct(userId, otherUserId, productId);
        return messages.stream()
                .map(messageMapper::toMessageResponse)
                .collect(Collectors.toList());
    }

    /**
     * Marks every unread message from {@code fromUserId} to {@code toUserId} as read.
     *
     * @return number of messages flipped
     */
    @Transactional
    public int markRead(Long fromUserId, Long toUserId) {
        int updated = messageRepository.markRead(fromUserId, toUserId);
        log.debug("Messages marked read: from={}, to={}, count={}", fromUserId, toUserId, updated);
        return updated;
    }

    @Transactional(readOnly = true)
    public long unreadCount(Long userId) {
        return messageRepository.countByReceiverIdAndIsReadFalse(userId);
    }

    @Transactional(readOnly = true)
    public Message getMessage(Long messageId) {
        return messageRepository.findById(messageId)
                .orElseThrow(() -> {
                    log.warn("Message not found: messageId={}", messageId);
                    return new ResourceNotFoundException("Message not found with id: " + messageId);
                });
    }

    @Transactional
    public void markMessageRead(Long messageId) {
        Message message = getMessage(messageId);
        message.setIsRead(true);
        messageRepository.save(message);
    }
}
