package com.soko.marketplaceservice.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Contact details of a buyer without an account.
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GuestContact {

    @Column(name = "guest_name")
    private String name;

    @Column(name = "guest_phone")
    private String phone;

    @Column(name = "guest_email")
    private String email;

    @Column(name = "guest_address")
    private String address;
}
