package com.dropship.checkout.adapters;

import com.dropship.checkout.api.ConfigurationException;
import com.dropship.checkout.api.UpstreamException;
import com.dropship.checkout.config.CheckoutProperties;
import com.dropship.checkout.core.ExchangeRateService;
import com.dropship.checkout.core.GatewayAdapter;
import com.dropship.checkout.core.reconcile.PollResult;
import com.dropship.checkout.domain.CheckoutContext;
import com.dropship.checkout.domain.ConfirmationStyle;
import com.dropship.checkout.domain.Customer;
import com.dropship.checkout.domain.DraftOrder;
import com.dropship.checkout.domain.GatewayInitiation;
import com.dropship.checkout.domain.GatewayType;
import com.dropship.checkout.domain.PricingCurrency;
import com.dropship.checkout.domain.ProfitSplit;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Paystack hosted checkout. The buyer is redirected to {@code authorization_url}; once they
 * return, the callback endpoint polls {@code /transaction/verify} to settle the order.
 * Amounts sent to Paystack are always kobo, shipping included.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaystackAdapter implements GatewayAdapter {

    static final String SUCCESS_STATUS = "success";

    private final RestTemplate gatewayRestTemplate;
    private final ExchangeRateService exchangeRateService;
    private final CheckoutProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public GatewayType getGatewayType() {
        return GatewayType.PAYSTACK;
    }

    @Override
    public ConfirmationStyle getConfirmationStyle() {
        return ConfirmationStyle.POLL;
    }

    @Override
    public GatewayInitiation initiate(CheckoutContext context) {
        CheckoutProperties.Paystack config = properties.getPaystack();
        String secretKey = requireSecretKey(config);
        ProfitSplit split = context.getSplit();
        Customer customer = context.getCustomer() != null ? context.getCustomer() : Customer.empty();

        BigDecimal rate = null;
        long itemsKobo = split.getTotalMinor();
        long totalMinorUsd = 0L;
        if (config.getCartCurrency() == PricingCurrency.USD) {
            rate = exchangeRateService.getUsdToNgnRate();
            itemsKobo = BigDecimal.valueOf(split.getTotalMinor()).multiply(rate)
                    .setScale(0, RoundingMode.HALF_UP).longValueExact();
            totalMinorUsd = split.getTotalMinor();
        }
        long totalKobo = Math.addExact(itemsKobo, context.getShippingFeeMinor());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("cartItems", context.getItems());
        metadata.put("customer", customer);
        metadata.put("shippingFee", context.getShippingFeeMinor());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("email", customer.getEmail().isBlank() ? config.getDefaultEmail() : customer.getEmail());
        payload.put("amount", totalKobo);
        payload.put("currency", "NGN");
        if (config.getCallbackUrl() != null && !config.getCallbackUrl().isBlank()) {
            payload.put("callback_url", config.getCallbackUrl());
        }
        payload.put("metadata", metadata);

        log.info("Initializing Paystack transaction: amountKobo={}, shippingKobo={}, items={}",
                totalKobo, context.getShippingFeeMinor(), context.getItems().size());
        JsonNode body = exchange(HttpMethod.POST, config.getBaseUrl() + "/transaction/initialize",
                new HttpEntity<>(payload, headers(secretKey)));

        JsonNode data = body.path("data");
        String reference = textOrNull(data.path("reference"));
        if (!body.path("status").asBoolean(false) || reference == null) {
            log.error("Paystack initialize rejected: message={}", body.path("message").asText(""));
            throw new UpstreamException("Paystack initialize failed: " + body.path("message").asText("no reference returned"));
        }

        DraftOrder draft = DraftOrder.builder()
                .paymentReference(reference)
                .gateway(GatewayType.PAYSTACK)
                .customer(customer)
                .items(context.getItems())
                .totalMinorUsd(totalMinorUsd)
                .totalMinorNgn(totalKobo)
                .supplierShareMinor(split.getSupplierShareMinor())
                .profitMinor(split.getProfitMinor())
                .gatewayResponse(body.toString())
                .build();

        return GatewayInitiation.builder()
                .gateway(GatewayType.PAYSTACK)
                .reference(reference)
                .authorizationUrl(textOrNull(data.path("authorization_url")))
                .totalMinorUsd(totalMinorUsd)
                .totalMinorNgn(totalKobo)
                .supplierShareMinor(split.getSupplierShareMinor())
                .rate(rate)
                .rawResponse(body.toString())
                .draft(draft)
                .build();
    }

    @Override
    public Optional<PollResult> verify(String reference) {
        String secretKey = requireSecretKey(properties.getPaystack());
        log.info("Verifying Paystack transaction reference={}", reference);
        JsonNode body = exchange(HttpMethod.GET,
                properties.getPaystack().getBaseUrl() + "/transaction/verify/{reference}",
                new HttpEntity<>(headers(secretKey)), reference);

        JsonNode data = body.path("data");
        if (!data.isObject()) {
            throw new UpstreamException("Paystack verify returned no transaction data for " + reference);
        }
        String status = data.path("status").asText("");
        Map<String, Object> transaction = objectMapper.convertValue(data, new TypeReference<Map<String, Object>>() { });
        return Optional.of(PollResult.builder()
                .paymentReference(reference)
                .gateway(GatewayType.PAYSTACK)
                .succeeded(SUCCESS_STATUS.equals(status))
                .gatewayStatus(status)
                .transaction(transaction)
                .build());
    }

    private JsonNode exchange(HttpMethod method, String url, HttpEntity<?> entity, Object... uriVariables) {
        JsonNode body;
        try {
            body = gatewayRestTemplate.exchange(url, method, entity, JsonNode.class, uriVariables).getBody();
        } catch (RestClientException e) {
            log.error("Paystack call failed: {} {}: {}", method, url, e.getMessage());
            throw new UpstreamException("Paystack request failed: " + e.getMessage(), e);
        }
        if (body == null) {
            throw new UpstreamException("Paystack returned an empty response");
        }
        return body;
    }

    private static HttpHeaders headers(String secretKey) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(secretKey);
        headers.setContentType(MediaType.APPLICATION_JSON);
        return headers;
    }

    private static String requireSecretKey(CheckoutProperties.Paystack config) {
        if (config.getSecretKey() == null || config.getSecretKey().isBlank()) {
            throw new ConfigurationException("Missing Paystack secret key (checkout.paystack.secret-key)");
        }
        return config.getSecretKey();
    }

    private static String textOrNull(JsonNode node) {
        return node.isMissingNode() || node.isNull() || node.asText().isBlank() ? null : node.asText();
    }
}
