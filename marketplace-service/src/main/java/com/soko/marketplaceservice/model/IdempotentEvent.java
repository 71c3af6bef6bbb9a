package com.soko.marketplaceservice.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

import java.time.LocalDateTime;

/**
 * Marker row recording that a side effect already happened.
 * Always treated as new so that save() issues an INSERT and a duplicate key fails instead of merging.
 */
@Entity
@Table(name = "idempotent_events")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IdempotentEvent implements Persistable<String> {

  @Id
  @Column(name = "event_key", nullable = false)
  private String eventKey; // e.g. "SELLER_FANOUT:<orderId>"

  @Column(nullable = false)
  private LocalDateTime createdAt;

  @Override
  public String getId() {
    return eventKey;
  }

  @Override
  @Transient
  public boolean isNew() {
    return true;
  }
}
