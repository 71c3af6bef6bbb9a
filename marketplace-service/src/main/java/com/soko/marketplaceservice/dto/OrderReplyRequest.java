package com.soko.marketplaceservice.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class OrderReplyRequest {
    @NotBlank(message = "Action is required")
    private String action; // approve | reject
}
