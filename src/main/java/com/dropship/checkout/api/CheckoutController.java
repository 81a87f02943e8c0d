package com.dropship.checkout.api;

import com.dropship.checkout.api.dto.CheckoutRequestDto;
import com.dropship.checkout.api.dto.CheckoutResponseDto;
import com.dropship.checkout.api.dto.OrderDto;
import com.dropship.checkout.api.dto.PlaceOrderRequestDto;
import com.dropship.checkout.core.CheckoutOrchestrator;
import com.dropship.checkout.core.reconcile.ReconciliationService;
import com.dropship.checkout.domain.CheckoutResult;
import com.dropship.checkout.domain.GatewayType;
import com.dropship.checkout.domain.Order;
import com.dropship.checkout.domain.VerifiedPayment;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Checkout endpoints: start a payment with a gateway, confirm it, settle the order.
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Checkout", description = "Start and confirm payments across Paystack, OPay and Stripe")
public class CheckoutController {

    private final CheckoutOrchestrator orchestrator;
    private final ReconciliationService reconciliationService;
    private final ObjectMapper objectMapper;

    @PostMapping("/create-paystack-order")
    @Operation(summary = "Start a Paystack checkout",
            description = "Charges the cart plus the shipping fee for customer.state, in kobo. Returns the hosted "
                    + "checkout URL; the order is recorded as pending right away.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Transaction initialized"),
            @ApiResponse(responseCode = "400", description = "Empty cart, zero total or supplier cost above price"),
            @ApiResponse(responseCode = "500", description = "Paystack unreachable, rejected the call, or is not configured")
    })
    public ResponseEntity<CheckoutResponseDto> createPaystackOrder(@Valid @RequestBody CheckoutRequestDto request) {
        CheckoutResult result = orchestrator.checkout(GatewayType.PAYSTACK, request.toCartItems(), request.toCustomer());
        return ResponseEntity.ok(CheckoutResponseDto.paystack(result));
    }

    @PostMapping({"/create-opay-order", "/create-opay-session"})
    @Operation(summary = "Create an OPay invoice",
            description = "Converts the USD cart to kobo at the live rate and submits a signed invoice. "
                    + "OPay does not call back, so the order stays pending.")
    public ResponseEntity<CheckoutResponseDto> createOpayOrder(@Valid @RequestBody CheckoutRequestDto request) {
        CheckoutResult result = orchestrator.checkout(GatewayType.OPAY, request.toCartItems(), request.toCustomer());
        return ResponseEntity.ok(CheckoutResponseDto.opay(result, parseGatewayResponse(result.getInitiation().getRawResponse())));
    }

    @PostMapping("/create-payment-intent")
    @Operation(summary = "Create a Stripe Connect payment intent",
            description = "Profit goes to the store as application fee, the remainder to the supplier account. "
                    + "No order is recorded until place-order.")
    public ResponseEntity<CheckoutResponseDto> createPaymentIntent(@Valid @RequestBody CheckoutRequestDto request) {
        CheckoutResult result = orchestrator.checkout(GatewayType.STRIPE, request.toCartItems(), request.toCustomer());
        return ResponseEntity.ok(CheckoutResponseDto.stripe(result));
    }

    @PostMapping("/place-order")
    @Operation(summary = "Record a confirmed Stripe payment",
            description = "Re-reads the intent from Stripe and records the order as paid if it succeeded.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Order recorded as paid"),
            @ApiResponse(responseCode = "400", description = "Intent not succeeded (PAYMENT_NOT_CONFIRMED) or invalid body")
    })
    public ResponseEntity<Map<String, Object>> placeOrder(@Valid @RequestBody PlaceOrderRequestDto request) {
        Order order = orchestrator.placeStripeOrder(request.toCartItems(), request.toCustomer(), request.getPaymentIntentId());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("order", OrderDto.from(order));
        return ResponseEntity.ok(body);
    }

    @GetMapping("/paystack-callback")
    @Operation(summary = "Verify a Paystack payment",
            description = "Paystack redirects the buyer here. Verifies the reference and marks the order paid on success.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Payment verified, order paid"),
            @ApiResponse(responseCode = "400", description = "Reference missing or payment not successful"),
            @ApiResponse(responseCode = "500", description = "Verification call failed")
    })
    public ResponseEntity<Map<String, Object>> paystackCallback(@RequestParam(value = "reference", required = false) String reference) {
        VerifiedPayment verified = reconciliationService.verifyPayment(GatewayType.PAYSTACK, reference);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("message", "Payment verified");
        body.put("order", verified.getOrder() != null ? OrderDto.from(verified.getOrder()) : null);
        body.put("transaction", verified.getTransaction());
        return ResponseEntity.ok(body);
    }

    private JsonNode parseGatewayResponse(String raw) {
        if (raw == null) {
            return null;
        }
        try {
            return objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            log.debug("Gateway response is not JSON, returning it as text");
            return TextNode.valueOf(raw);
        }
    }
}
