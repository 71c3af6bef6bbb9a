package com.soko.marketplaceservice.repository;

import com.soko.marketplaceservice.model.IdempotentEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface IdempotentEventRepository extends JpaRepository<IdempotentEvent, String> {
}
