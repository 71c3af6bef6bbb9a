package com.soko.marketplaceservice.service;

import com.soko.common.exception.InsufficientStockException;
import com.soko.common.exception.ResourceNotFoundException;
import com.soko.marketplaceservice.mapper.ProductMapper;
import com.soko.marketplaceservice.model.Product;
import com.soko.marketplaceservice.repository.ProductRepository;
import jakarta.persistence.EntityManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CatalogServiceImplTest {

    @Mock
    private ProductRepository productRepository;
    @Mock
    private ProductMapper productMapper;
    @Mock
    private EntityManager entityManager;

    @InjectMocks
    private CatalogServiceImpl catalogService;

    private Product tomatoes;

    @BeforeEach
    void setUp() {
        tomatoes = Product.builder()
                .id(1L)
                .name("Tomatoes")
                .price(new BigDecimal("1500"))
                .stock(5)
                .sellerId(9L)
                .build();
    }

    @Test
    void adjustStock_Decrement_Success() {
        when(productRepository.findById(1L)).thenReturn(Optional.of(tomatoes));
        when(productRepository.decreaseStock(1L, 3)).thenReturn(1);
        // refresh reloads the value written by the UPDATE
        doAnswer(i -> {
            tomatoes.setStock(2);
            return null;
        }).when(entityManager).refresh(tomatoes);

        Product result = catalogService.adjustStock(1L, -3);

        assertThat(result.getStock()).isEqualTo(2);
        verify(productRepository, never()).increaseStock(anyLong(), anyInt());
    }

    @Test
    void adjustStock_Decrement_FailsWhenStockWouldGoNegative() {
        when(productRepository.findById(1L)).thenReturn(Optional.of(tomatoes));
        when(productRepository.decreaseStock(1L, 10)).thenReturn(0);

        assertThatThrownBy(() -> catalogService.adjustStock(1L, -10))
                .isInstanceOf(InsufficientStockException.class)
                .satisfies(e -> {
                    InsufficientStockException ex = (InsufficientStockException) e;
                    assertThat(ex.getProductId()).isEqualTo(1L);
                    assertThat(ex.getAvailable()).isEqualTo(5);
                    assertThat(ex.getRequested()).isEqualTo(10);
                });
    }

    @Test
    void adjustStock_Increment_UsesAtomicUpdate() {
        when(productRepository.findById(1L)).thenReturn(Optional.of(tomatoes));
        when(productRepository.increaseStock(1L, 4)).thenReturn(1);

        catalogService.adjustStock(1L, 4);

        verify(productRepository).increaseStock(1L, 4);
        verify(productRepository, never()).decreaseStock(anyLong(), anyInt());
        verify(entityManager).refresh(tomatoes);
    }

    @Test
    void adjustStock_UnknownProduct_NotFound() {
        when(productRepository.findById(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> catalogService.adjustStock(99L, -1))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessageContaining("99");
    }

    @Test
    void adjustStock_ZeroDelta_NoWrite() {
        when(productRepository.findById(1L)).thenReturn(Optional.of(tomatoes));

        assertThat(catalogService.adjustStock(1L, 0)).isSameAs(tomatoes);
        verifyNoInteractions(entityManager);
    }

    @Test
    void restoreStock_MissingProductIsSkipped() {
        when(productRepository.increaseStock(77L, 2)).thenReturn(0);

        assertThat(catalogService.restoreStock(77L, 2)).isFalse();
    }

    @Test
    void restoreStock_Success() {
        when(productRepository.increaseStock(1L, 2)).thenReturn(1);

        assertThat(catalogService.restoreStock(1L, 2)).isTrue();
    }

    @Test
    void findProducts_IndexesById() {
        Product other = Product.builder().id(2L).name("Beans").stock(1).build();
        when(productRepository.findAllById(List.of(1L, 2L))).thenReturn(List.of(tomatoes, other));

        assertThat(catalogService.findProducts(List.of(1L, 2L)))
                .containsEntry(1L, tomatoes)
                .containsEntry(2L, other);
    }

    @Test
    void ownsAnyProduct_NoProducts_False() {
        assertThat(catalogService.ownsAnyProduct(9L, List.of())).isFalse();
        verifyNoInteractions(productRepository);
    }
}
