package com.soko.marketplaceservice.model;

public enum PaymentMethod {
    MTN_MOMO,
    AIRTEL_MONEY,
    CREDIT_CARD
}
