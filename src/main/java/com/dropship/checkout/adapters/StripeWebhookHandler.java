package com.dropship.checkout.adapters;

import com.dropship.checkout.api.ValidationException;
import com.dropship.checkout.api.WebhookSignatureException;
import com.dropship.checkout.config.CheckoutProperties;
import com.dropship.checkout.core.reconcile.OrderReconciler;
import com.dropship.checkout.core.reconcile.WebhookEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stripe.exception.SignatureVerificationException;
import com.stripe.net.Webhook;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Receives Stripe webhook deliveries.
 * <p>
 * With {@code checkout.stripe.webhook-secret} set, the {@code Stripe-Signature} header is
 * checked against the raw body and a mismatch is rejected before anything is read. Without a
 * secret the event is trusted as-is and every such delivery is logged at WARN.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StripeWebhookHandler {

    /** Maximum age of a signed delivery, Stripe's own default. */
    static final long SIGNATURE_TOLERANCE_SECONDS = 300L;

    private final CheckoutProperties properties;
    private final OrderReconciler reconciler;
    private final ObjectMapper objectMapper;

    public WebhookEvent handle(String payload, String signatureHeader) {
        String secret = properties.getStripe().getWebhookSecret();
        if (secret != null && !secret.isBlank()) {
            verifySignature(payload, signatureHeader, secret);
        } else {
            log.warn("Stripe webhook secret not configured; processing event WITHOUT signature verification");
        }

        WebhookEvent event = parse(payload);
        if (!event.isRecognized()) {
            log.info("Ignoring Stripe event type={} id={}", event.getType(), event.getEventId());
            return event;
        }
        if (event.getPaymentReference() == null) {
            log.warn("Stripe event type={} id={} has no payment intent id", event.getType(), event.getEventId());
            return event;
        }
        boolean applied = reconciler.apply(event.getPaymentReference(), event);
        log.info("Stripe event type={} for intent={} applied={}", event.getType(), event.getPaymentReference(), applied);
        return event;
    }

    private static void verifySignature(String payload, String signatureHeader, String secret) {
        if (signatureHeader == null || signatureHeader.isBlank()) {
            throw new WebhookSignatureException("Missing Stripe-Signature header");
        }
        try {
            Webhook.Signature.verifyHeader(payload, signatureHeader, secret, SIGNATURE_TOLERANCE_SECONDS);
        } catch (SignatureVerificationException e) {
            log.warn("Rejected Stripe webhook: {}", e.getMessage());
            throw new WebhookSignatureException(e.getMessage(), e);
        }
    }

    private WebhookEvent parse(String payload) {
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Malformed webhook payload", e);
        }
        if (root == null || !root.isObject()) {
            throw new ValidationException("Malformed webhook payload");
        }
        JsonNode intentId = root.path("data").path("object").path("id");
        return new WebhookEvent(
                root.path("id").asText(null),
                root.path("type").asText(""),
                intentId.isTextual() ? intentId.asText() : null);
    }
}
