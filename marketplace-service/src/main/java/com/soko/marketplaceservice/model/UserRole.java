package com.soko.marketplaceservice.model;

import java.util.Locale;

public enum UserRole {
    USER,
    SELLER,
    ADMIN;

    // unknown or missing claims fall back to USER
    public static UserRole fromClaim(String claim) {
        if (claim == null) {
            return USER;
        }
        for (UserRole role : values()) {
            if (role.name().equals(claim.trim().toUpperCase(Locale.ROOT))) {
                return role;
            }
        }
        return USER;
    }
}
