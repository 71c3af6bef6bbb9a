package com.soko.marketplaceservice.mapper;

import com.soko.marketplaceservice.dto.ProductResponse;
import com.soko.marketplaceservice.model.Product;
import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface ProductMapper {

    ProductResponse toProductResponse(Product product);
}
