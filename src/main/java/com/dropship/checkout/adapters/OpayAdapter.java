package com.dropship.checkout.adapters;

import com.dropship.checkout.api.ConfigurationException;
import com.dropship.checkout.api.UpstreamException;
import com.dropship.checkout.config.CheckoutProperties;
import com.dropship.checkout.core.ExchangeRateService;
import com.dropship.checkout.core.GatewayAdapter;
import com.dropship.checkout.domain.CheckoutContext;
import com.dropship.checkout.domain.ConfirmationStyle;
import com.dropship.checkout.domain.Customer;
import com.dropship.checkout.domain.DraftOrder;
import com.dropship.checkout.domain.GatewayInitiation;
import com.dropship.checkout.domain.GatewayType;
import com.dropship.checkout.domain.ProfitSplit;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * OPay invoice checkout. The USD cart is converted to kobo at the live rate and submitted as a
 * signed invoice: the {@code SIGNATURE} header is the hex HMAC-SHA512 of the exact JSON body
 * sent, keyed with the merchant secret.
 * <p>
 * OPay never calls back into this service, so orders on this path stay {@code pending}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OpayAdapter implements GatewayAdapter {

    static final String SIGNATURE_HEADER = "SIGNATURE";
    private static final String HMAC_ALGORITHM = "HmacSHA512";

    private final RestTemplate gatewayRestTemplate;
    private final ExchangeRateService exchangeRateService;
    private final CheckoutProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public GatewayType getGatewayType() {
        return GatewayType.OPAY;
    }

    @Override
    public ConfirmationStyle getConfirmationStyle() {
        return ConfirmationStyle.NONE;
    }

    @Override
    public GatewayInitiation initiate(CheckoutContext context) {
        CheckoutProperties.Opay config = properties.getOpay();
        requireConfigured(config);
        ProfitSplit split = context.getSplit();
        Customer customer = context.getCustomer() != null ? context.getCustomer() : Customer.empty();

        BigDecimal rate = exchangeRateService.getUsdToNgnRate();
        long totalKobo = BigDecimal.valueOf(split.getTotalMinor()).multiply(rate)
                .setScale(0, RoundingMode.HALF_UP).longValueExact();
        String reference = newReference();

        Map<String, Object> userInfo = new LinkedHashMap<>();
        userInfo.put("userId", customer.getEmail().isBlank() ? "guest" : customer.getEmail());
        userInfo.put("name", customer.getName().isBlank() ? "Anonymous" : customer.getName());

        Map<String, Object> invoice = new LinkedHashMap<>();
        invoice.put("reference", reference);
        invoice.put("amount", totalKobo);
        invoice.put("currency", "NGN");
        invoice.put("country", config.getCountry());
        invoice.put("payType", config.getPayType());
        invoice.put("userInfo", userInfo);
        invoice.put("callbackUrl", config.getCallbackUrl());
        invoice.put("returnUrl", config.getReturnUrl());

        String json = toJson(invoice);
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(config.getPublicKey());
        headers.set(SIGNATURE_HEADER, sign(json, config.getSecretKey()));

        log.info("Creating OPay invoice: reference={}, amountKobo={}, rate={}", reference, totalKobo, rate);
        String response;
        try {
            response = gatewayRestTemplate.postForObject(config.getBaseUrl() + "/invoices/create",
                    new HttpEntity<>(json, headers), String.class);
        } catch (RestClientException e) {
            log.error("OPay invoice creation failed: reference={}: {}", reference, e.getMessage());
            throw new UpstreamException("OPay request failed: " + e.getMessage(), e);
        }

        DraftOrder draft = DraftOrder.builder()
                .paymentReference(reference)
                .gateway(GatewayType.OPAY)
                .customer(customer)
                .items(context.getItems())
                .totalMinorUsd(split.getTotalMinor())
                .totalMinorNgn(totalKobo)
                .supplierShareMinor(split.getSupplierShareMinor())
                .profitMinor(split.getProfitMinor())
                .gatewayResponse(response)
                .build();

        return GatewayInitiation.builder()
                .gateway(GatewayType.OPAY)
                .reference(reference)
                .totalMinorUsd(split.getTotalMinor())
                .totalMinorNgn(totalKobo)
                .supplierShareMinor(split.getSupplierShareMinor())
                .rate(rate)
                .rawResponse(response)
                .draft(draft)
                .build();
    }

    static String sign(String body, String secret) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(body.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA512 unavailable", e);
        }
    }

    private String toJson(Map<String, Object> invoice) {
        try {
            return objectMapper.writeValueAsString(invoice);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize OPay invoice", e);
        }
    }

    private static String newReference() {
        return "opay_ref_" + System.currentTimeMillis() + "_" + ThreadLocalRandom.current().nextInt(100000, 1000000);
    }

    private static void requireConfigured(CheckoutProperties.Opay config) {
        if (isBlank(config.getBaseUrl()) || isBlank(config.getPublicKey()) || isBlank(config.getSecretKey())) {
            throw new ConfigurationException(
                    "OPay is not configured (checkout.opay.base-url, public-key and secret-key are required)");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
