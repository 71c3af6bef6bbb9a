package com.soko.marketplaceservice.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Who is placing an order: either a registered user or a guest with contact details.
 * Exactly one of the two shapes exists per order.
 */
public abstract class BuyerIdentity {

    private BuyerIdentity() {
    }

    public static BuyerIdentity registered(long buyerId) {
        return new Registered(buyerId);
    }

    public static BuyerIdentity guest(GuestContact contact) {
        return new Guest(contact);
    }

    @Value
    public static class Registered extends BuyerIdentity {
        long buyerId;
    }

    @Value
    public static class Guest extends BuyerIdentity {
        @NonNull
        GuestContact contact;
    }
}
