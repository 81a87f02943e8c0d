package com.dropship.checkout.api;

import com.dropship.checkout.adapters.StripeWebhookHandler;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequiredArgsConstructor
@Tag(name = "Webhooks", description = "Gateway-pushed payment events")
public class WebhookController {

    static final String STRIPE_SIGNATURE_HEADER = "Stripe-Signature";

    private final StripeWebhookHandler stripeWebhookHandler;

    /**
     * The body is taken as a raw string; the signature covers the exact bytes Stripe sent.
     */
    @PostMapping("/webhook")
    @Operation(summary = "Stripe webhook",
            description = "Verifies Stripe-Signature when a webhook secret is configured. "
                    + "payment_intent.succeeded marks the order paid, payment_intent.payment_failed marks it failed. "
                    + "Other events are acknowledged and ignored.")
    public ResponseEntity<Map<String, Object>> stripeWebhook(
            @RequestBody String payload,
            @RequestHeader(value = STRIPE_SIGNATURE_HEADER, required = false) String signature) {
        stripeWebhookHandler.handle(payload, signature);
        return ResponseEntity.ok(Map.of("received", true));
    }
}
