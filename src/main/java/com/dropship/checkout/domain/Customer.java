package com.dropship.checkout.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Buyer details copied into the order at draft time. Every field is a non-null string.
 */
@Value
@Builder
public class Customer {

    private static final Customer EMPTY = Customer.of(null, null, null, null, null);

    String name;
    String email;
    String phone;
    String address;
    /** Shipping region, used to look up the shipping fee. */
    String state;

    public static Customer of(String name, String email, String phone, String address, String state) {
        return Customer.builder()
                .name(orEmpty(name))
                .email(orEmpty(email))
                .phone(orEmpty(phone))
                .address(orEmpty(address))
                .state(orEmpty(state))
                .build();
    }

    public static Customer empty() {
        return EMPTY;
    }

    private static String orEmpty(String value) {
        return value != null ? value : "";
    }
}
