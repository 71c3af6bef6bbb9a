package com.soko.marketplaceservice.model;

public enum ProductUnit {
    KG,
    PIECE
}
