package com.soko.marketplaceservice.security;

import com.soko.marketplaceservice.model.BuyerIdentity;
import com.soko.marketplaceservice.model.GuestContact;
import com.soko.marketplaceservice.model.UserRole;
import com.soko.common.exception.AccessDeniedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Component;

/**
 * Turns the resource-server JWT into the caller types used by the services.
 * {@code sub} carries the numeric user id, {@code role} one of user, seller, admin.
 */
@Component
@Slf4j
public class CallerResolver {

    public static final String ROLE_CLAIM = "role";

    public CallerIdentity resolve(Jwt jwt) {
        if (jwt == null) {
            throw new AccessDeniedException("Authentication required");
        }
        Long userId = parseUserId(jwt);
        UserRole role = UserRole.fromClaim(jwt.getClaimAsString(ROLE_CLAIM));
        return new CallerIdentity(userId, role);
    }

    /**
     * Buyer for order placement. A token makes it a registered buyer and any contact in the
     * body is ignored; without a token the order is a guest order and needs the contact.
     */
    public BuyerIdentity resolveBuyer(Jwt jwt, GuestContact guestContact) {
        if (jwt != null) {
            return BuyerIdentity.registered(parseUserId(jwt));
        }
        if (guestContact == null) {
            log.warn("Guest order rejected: no buyer contact supplied");
            throw new IllegalArgumentException("Guest orders require buyer contact information (name and phone)");
        }
        return BuyerIdentity.guest(guestContact);
    }

    private Long parseUserId(Jwt jwt) {
        String subject = jwt.getSubject();
        try {
            return Long.valueOf(subject);
        } catch (NumberFormatException e) {
            log.warn("JWT subject is not a numeric user id: sub={}", subject);
            throw new AccessDeniedException("Access Denied: invalid user id in token");
        }
    }
}
