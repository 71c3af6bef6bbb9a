package com.soko.marketplaceservice.repository;

import com.soko.marketplaceservice.model.Message;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for persisted messages and order notifications.
 */
@Repository
public interface MessageRepository extends JpaRepository<Message, Long> {

    /**
     * Everything the user sent or received, newest first.
     */
    List<Message> findBySenderIdOrReceiverIdOrderByCreatedAtDescIdDesc(Long senderId, Long receiverId);

    /**
     * Messages exchanged between two users in either direction, oldest first.
     */
    @Query("""
            SELECT m FROM Message m
            WHERE (m.senderId = :userA AND m.receiverId = :userB)
               OR (m.senderId = :userB AND m.receiverId = :userA)
            ORDER BY m.createdAt ASC, m.id ASC
            """)
    List<Message> findConversation(@Param("userA") Long userA, @Param("userB") Long userB);

    /**
     * Same as {@link #findConversation} restricted to one product.
     */
    @Query("""
            SELECT m FROM Message m
            WHERE ((m.senderId = :userA AND m.receiverId = :userB)
               OR (m.senderId = :userB AND m.receiverId = :userA))
              AND m.productId = :productId
            ORDER BY m.createdAt ASC, m.id ASC
            """)
    List<Message> findConversationAboutProduct(@Param("userA") Long userA, @Param("userB") Long userB,
            @Param("productId") Long productId);

    @Modifying
    @Query("UPDATE Message m SET m.isRead = true WHERE m.senderId = :fromUserId AND m.receiverId = :toUserId AND m.isRead = false")
    int markRead(@Param("fromUserId") Long fromUserId, @Param("toUserId") Long toUserId);

    long countByReceiverIdAndIsReadFalse(Long receiverId);

    List<Message> findByOrderIdOrderByCreatedAtAsc(Long orderId);
}
