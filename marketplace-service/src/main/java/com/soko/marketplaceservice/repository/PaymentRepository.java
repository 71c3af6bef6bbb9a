package com.soko.marketplaceservice.repository;

import com.soko.marketplaceservice.model.Payment;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PaymentRepository extends JpaRepository<Payment, Long> {

    Page<Payment> findByOrderBuyerIdOrderByCreatedAtDesc(Long buyerId, Pageable pageable);
}
