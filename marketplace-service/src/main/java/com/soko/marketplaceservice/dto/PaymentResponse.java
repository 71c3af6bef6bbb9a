package com.soko.marketplaceservice.dto;

import com.soko.marketplaceservice.model.Payment;
import com.soko.marketplaceservice.model.PaymentMethod;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentResponse {
    private Long id;
    private Long orderId;
    private BigDecimal amount;
    private PaymentMethod paymentMethod;
    private Payment.SettlementStatus status;
    private String transactionId;
    private Instant createdAt;
}
