package com.dropship.checkout.adapters;

import com.dropship.checkout.api.UpstreamException;
import com.dropship.checkout.config.CheckoutProperties;
import com.dropship.checkout.core.GatewayAdapter;
import com.dropship.checkout.core.reconcile.PollResult;
import com.dropship.checkout.domain.CheckoutContext;
import com.dropship.checkout.domain.ConfirmationStyle;
import com.dropship.checkout.domain.GatewayInitiation;
import com.dropship.checkout.domain.GatewayType;
import com.dropship.checkout.domain.ProfitSplit;
import com.stripe.exception.StripeException;
import com.stripe.model.PaymentIntent;
import com.stripe.param.PaymentIntentCreateParams;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Stripe Connect payment intents with a destination charge: the store keeps
 * {@code application_fee_amount} (the profit) and Stripe transfers the rest to the supplier's
 * connected account.
 * <p>
 * Nothing is recorded at intent creation. The order is written when the client calls
 * place-order after confirming the intent, and the webhook settles anything left pending.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StripeConnectAdapter implements GatewayAdapter {

    static final String SUCCEEDED = "succeeded";

    private final StripeIntentClient stripeIntentClient;
    private final CheckoutProperties properties;

    @Override
    public GatewayType getGatewayType() {
        return GatewayType.STRIPE;
    }

    @Override
    public ConfirmationStyle getConfirmationStyle() {
        return ConfirmationStyle.WEBHOOK;
    }

    @Override
    public GatewayInitiation initiate(CheckoutContext context) {
        ProfitSplit split = context.getSplit();
        String supplierAccount = properties.getStripe().getSupplierAccount();

        PaymentIntentCreateParams.Builder params = PaymentIntentCreateParams.builder()
                .setAmount(split.getTotalMinor())
                .setCurrency(context.getCurrency())
                .setAutomaticPaymentMethods(PaymentIntentCreateParams.AutomaticPaymentMethods.builder()
                        .setEnabled(true)
                        .build())
                .putMetadata("supplierShareMinor", Long.toString(split.getSupplierShareMinor()))
                .putMetadata("profitMinor", Long.toString(split.getProfitMinor()));
        long applicationFee = 0L;
        if (supplierAccount != null && !supplierAccount.isBlank()) {
            applicationFee = split.getProfitMinor();
            params.setApplicationFeeAmount(applicationFee)
                    .setTransferData(PaymentIntentCreateParams.TransferData.builder()
                            .setDestination(supplierAccount)
                            .build());
        } else {
            log.warn("No Stripe supplier account configured (checkout.stripe.supplier-account); "
                    + "creating intent without a supplier split");
        }

        PaymentIntent intent;
        try {
            intent = stripeIntentClient.create(params.build());
        } catch (StripeException e) {
            log.error("Stripe intent creation failed: {}", e.getMessage());
            throw new UpstreamException("Stripe request failed: " + e.getMessage(), e);
        }
        log.info("Stripe intent created: id={}, amount={}, applicationFee={}",
                intent.getId(), split.getTotalMinor(), applicationFee);

        return GatewayInitiation.builder()
                .gateway(GatewayType.STRIPE)
                .reference(intent.getId())
                .clientSecret(intent.getClientSecret())
                .totalMinorUsd(split.getTotalMinor())
                .applicationFeeMinor(applicationFee)
                .supplierShareMinor(split.getSupplierShareMinor())
                .build();
    }

    /**
     * Retrieves the intent; only status {@code succeeded} counts as paid.
     */
    @Override
    public Optional<PollResult> verify(String paymentIntentId) {
        PaymentIntent intent;
        try {
            intent = stripeIntentClient.retrieve(paymentIntentId);
        } catch (StripeException e) {
            log.error("Stripe intent retrieval failed: id={}: {}", paymentIntentId, e.getMessage());
            throw new UpstreamException("Stripe request failed: " + e.getMessage(), e);
        }
        Map<String, Object> transaction = new LinkedHashMap<>();
        transaction.put("id", intent.getId());
        transaction.put("status", intent.getStatus());
        transaction.put("amount", intent.getAmount());
        transaction.put("currency", intent.getCurrency());
        return Optional.of(PollResult.builder()
                .paymentReference(paymentIntentId)
                .gateway(GatewayType.STRIPE)
                .succeeded(SUCCEEDED.equals(intent.getStatus()))
                .gatewayStatus(intent.getStatus())
                .transaction(transaction)
                .build());
    }
}
