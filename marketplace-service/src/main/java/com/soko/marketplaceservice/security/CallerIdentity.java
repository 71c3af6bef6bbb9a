package com.soko.marketplaceservice.security;

import com.soko.marketplaceservice.model.UserRole;
import lombok.Value;

/**
 * Authenticated caller as seen by the services: numeric user id plus role.
 */
@Value
public class CallerIdentity {
    Long userId;
    UserRole role;

    public boolean isAdmin() {
        return role == UserRole.ADMIN;
    }

    public boolean isSeller() {
        return role == UserRole.SELLER;
    }
}
