package com.dropship.checkout.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Normalized outcome of a payment initiation. Which fields are set depends on the gateway:
 * redirect gateways return {@code authorizationUrl}, intent gateways return {@code clientSecret}.
 */
@Value
@Builder
public class GatewayInitiation {

    GatewayType gateway;
    String reference;
    String authorizationUrl;
    String clientSecret;
    long totalMinorUsd;
    long totalMinorNgn;
    long applicationFeeMinor;
    long supplierShareMinor;
    /** USD to NGN rate used for conversion, when one was needed. */
    BigDecimal rate;
    /** Verbatim provider response body. */
    String rawResponse;
    /** Draft to persist now; empty when the order is recorded later. */
    DraftOrder draft;

    public Optional<DraftOrder> getDraftOrder() {
        return Optional.ofNullable(draft);
    }
}
