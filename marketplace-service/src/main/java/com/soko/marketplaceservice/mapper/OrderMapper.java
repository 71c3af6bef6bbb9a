package com.soko.marketplaceservice.mapper;

import com.soko.marketplaceservice.dto.GuestContactRequest;
import com.soko.marketplaceservice.dto.OrderItemResponse;
import com.soko.marketplaceservice.dto.OrderResponse;
import com.soko.marketplaceservice.model.GuestContact;
import com.soko.marketplaceservice.model.Order;
import com.soko.marketplaceservice.model.OrderItem;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface OrderMapper {

    @Mapping(source = "guestContact", target = "buyerContact")
    OrderResponse toOrderResponse(Order order);

    OrderItemResponse toOrderItemResponse(OrderItem orderItem);

    GuestContact toGuestContact(GuestContactRequest request);

    // Note: items are not mapped from the request.
    // Names and prices come from the catalog at purchase time, see OrderPlacementService
}
