package com.soko.marketplaceservice.repository;

import com.soko.marketplaceservice.model.Order;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface OrderRepository extends JpaRepository<Order, Long> {

    // a buyer's orders, newest first
    Page<Order> findByBuyerIdOrderByCreatedAtDescIdDesc(Long buyerId, Pageable pageable);

    // orders containing at least one product owned by the seller, newest first
    @Query("""
            SELECT o FROM Order o
            WHERE EXISTS (
                SELECT 1 FROM OrderItem i, Product p
                WHERE i.order = o AND p.id = i.productId AND p.sellerId = :sellerId
            )
            ORDER BY o.createdAt DESC, o.id DESC
            """)
    List<Order> findOrdersForSeller(@Param("sellerId") Long sellerId);
}
