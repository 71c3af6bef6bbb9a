package com.soko.marketplaceservice.dto;

import com.soko.marketplaceservice.model.ProductUnit;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductResponse {
    private Long id;
    private String name;
    private String description;
    private ProductUnit unit;
    private BigDecimal price;
    private Integer stock;
    private Long sellerId;
}
