package com.soko.marketplaceservice.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GuestContactRequest {

    @NotBlank(message = "Guest name is required")
    private String name;

    @NotBlank(message = "Guest phone is required")
    private String phone;

    @Email(message = "Guest email must be a valid address")
    private String email;

    private String address;
}
