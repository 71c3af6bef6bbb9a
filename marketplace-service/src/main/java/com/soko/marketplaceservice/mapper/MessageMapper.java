package com.soko.marketplaceservice.mapper;

import com.soko.marketplaceservice.dto.MessageResponse;
import com.soko.marketplaceservice.model.Message;
import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface MessageMapper {

    MessageResponse toMessageResponse(Message message);
}
