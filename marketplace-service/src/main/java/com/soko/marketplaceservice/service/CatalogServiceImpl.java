package com.soko.marketplaceservice.service;

import com.soko.common.exception.InsufficientStockException;
import com.soko.common.exception.ResourceNotFoundException;
import com.soko.marketplaceservice.dto.ProductResponse;
import com.soko.marketplaceservice.mapper.ProductMapper;
import com.soko.marketplaceservice.model.Product;
import com.soko.marketplaceservice.repository.ProductRepository;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class CatalogServiceImpl implements CatalogService {

    private final ProductRepository productRepository;
    private final ProductMapper productMapper;

    @PersistenceContext
    private final EntityManager entityManager;

    @Override
    @Transactional(readOnly = true)
    public ProductResponse getProductById(Long productId) {
        return productMapper.toProductResponse(getProduct(productId));
    }

    @Override
    @Transactional(readOnly = true)
    public Product getProduct(Long productId) {
        return productRepository.findById(productId)
                .orElseThrow(() -> {
                    log.warn("Product not found: productId={}", productId);
                    return new ResourceNotFoundException("Product not found with id: " + productId);
                });
    }

    @Override
    @Transactional(readOnly = true)
    public Map<Long, Product> findProducts(Collection<Long> productIds) {
        return productRepository.findAllById(productIds).stream()
                .collect(Collectors.toMap(Product::getId, Function.identity()));
    }

    /**
     * Applies a signed stock change. A negative delta is a conditional decrement that fails
     * instead of letting stock go below zero; a positive delta is an atomic increment.
     */
    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public Product adjustStock(Long productId, int delta) {
        Product product = getProduct(productId);
        if (delta == 0) {
            return product;
        }

        int oldStock = product.getStock();
        if (delta < 0) {
            int quantity = -delta;
            int updatedRows = productRepository.decreaseStock(productId, quantity);
            if (updatedRows == 0) {
                entityManager.refresh(product);
                log.warn("Insufficient stock during atomic update: productId={}, name='{}', available={}, requested={}",
                        productId, product.getName(), product.getStock(), quantity);
                throw new InsufficientStockException(productId, product.getName(), product.getStock(), quantity);
            }
        } else {
            productRepository.increaseStock(productId, delta);
        }

        // Refresh entity so callers see the value written by the UPDATE
        entityManager.refresh(product);

        log.info("Stock adjusted: productId={}, name='{}', delta={}, oldStock={}, newStock={}",
                productId, product.getName(), delta, oldStock, product.getStock());
        return product;
    }

    /**
     * Gives units back to a product. A product deleted since the order was placed is skipped.
     *
     * @return false when the product no longer exists
     */
    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean restoreStock(Long productId, int quantity) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("Restored quantity must be positive: " + quantity);
        }
        int updatedRows = productRepository.increaseStock(productId, quantity);
        if (updatedRows == 0) {
            log.warn("Product no longer exists, skipping stock restoration: productId={}, quantity={}",
                    productId, quantity);
            return false;
        }
        log.info("Stock restored: productId={}, quantity={}", productId, quantity);
        return true;
    }

    @Override
    @Transactional(readOnly = true)
    public boolean ownsAnyProduct(Long sellerId, Collection<Long> productIds) {
        if (sellerId == null || productIds.isEmpty()) {
            return false;
        }
        return productRepository.existsByIdInAndSellerId(productIds, sellerId);
    }
}
