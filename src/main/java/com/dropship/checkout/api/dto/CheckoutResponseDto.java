package com.dropship.checkout.api.dto;

import com.dropship.checkout.core.MoneyUnits;
import com.dropship.checkout.domain.CheckoutResult;
import com.dropship.checkout.domain.GatewayInitiation;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Response of the create-order endpoints. Which fields are present depends on the gateway.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CheckoutResponseDto {

    boolean success;
    String authorizationUrl;
    String clientSecret;
    String reference;
    String localOrderId;
    BigDecimal totalNgn;
    Long totalKobo;
    BigDecimal totalUsd;
    /** Intent amount in cents. */
    Long amount;
    Long applicationFeeAmount;
    Long supplierShare;
    BigDecimal rate;
    /** Gateway response body, passed through. */
    JsonNode data;

    public static CheckoutResponseDto paystack(CheckoutResult result) {
        GatewayInitiation initiation = result.getInitiation();
        return CheckoutResponseDto.builder()
                .success(true)
                .authorizationUrl(initiation.getAuthorizationUrl())
                .reference(initiation.getReference())
                .localOrderId(result.getLocalOrderId())
                .totalNgn(MoneyUnits.toMajorUnits(initiation.getTotalMinorNgn()))
                .totalKobo(initiation.getTotalMinorNgn())
                .build();
    }

    public static CheckoutResponseDto opay(CheckoutResult result, JsonNode gatewayResponse) {
        GatewayInitiation initiation = result.getInitiation();
        return CheckoutResponseDto.builder()
                .success(true)
                .reference(initiation.getReference())
                .localOrderId(result.getLocalOrderId())
                .totalKobo(initiation.getTotalMinorNgn())
                .totalUsd(MoneyUnits.toMajorUnits(initiation.getTotalMinorUsd()))
                .rate(initiation.getRate())
                .data(gatewayResponse)
                .build();
    }

    public static CheckoutResponseDto stripe(CheckoutResult result) {
        GatewayInitiation initiation = result.getInitiation();
        return CheckoutResponseDto.builder()
                .success(true)
                .clientSecret(initiation.getClientSecret())
                .reference(initiation.getReference())
                .totalUsd(MoneyUnits.toMajorUnits(initiation.getTotalMinorUsd()))
                .amount(initiation.getTotalMinorUsd())
                .applicationFeeAmount(initiation.getApplicationFeeMinor())
                .supplierShare(initiation.getSupplierShareMinor())
                .build();
    }
}
