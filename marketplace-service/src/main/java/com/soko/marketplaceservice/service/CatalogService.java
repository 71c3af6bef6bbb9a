package com.soko.marketplaceservice.service;

import com.soko.marketplaceservice.dto.ProductResponse;
import com.soko.marketplaceservice.model.Product;

import java.util.Collection;
import java.util.Map;

public interface CatalogService {

    ProductResponse getProductById(Long productId);

    Product getProduct(Long productId);

    // Batch lookup for cart validation; missing ids are simply absent from the map
    Map<Long, Product> findProducts(Collection<Long> productIds);

    // Stock Management. Both join the caller's transaction and never open their own
    Product adjustStock(Long productId, int delta);

    boolean restoreStock(Long productId, int quantity);

    boolean ownsAnyProduct(Long sellerId, Collection<Long> productIds);
}
