package com.dropship.checkout.core;

import com.dropship.checkout.core.reconcile.PollResult;
import com.dropship.checkout.domain.CheckoutContext;
import com.dropship.checkout.domain.ConfirmationStyle;
import com.dropship.checkout.domain.GatewayInitiation;
import com.dropship.checkout.domain.GatewayType;

import java.util.Optional;

/**
 * What every payment gateway integration implements. An adapter takes our validated
 * checkout, builds and authenticates the provider's request, submits it, and maps the
 * response back to a {@link GatewayInitiation} (including the canonical draft order when
 * the gateway path records one up front).
 * <p>
 * Adapters throw {@link com.dropship.checkout.api.UpstreamException} for transport and
 * provider errors and {@link com.dropship.checkout.api.ConfigurationException} for missing
 * credentials. They never retry.
 */
public interface GatewayAdapter {

    GatewayType getGatewayType();

    /**
     * Name used for the adapter's circuit breaker and in logs.
     */
    default String getAdapterName() {
        return this.getClass().getSimpleName();
    }

    ConfirmationStyle getConfirmationStyle();

    /**
     * Start a payment with the gateway.
     * @param context validated cart, customer, split and shipping fee
     * @return normalized initiation (never null)
     */
    GatewayInitiation initiate(CheckoutContext context);

    /**
     * Ask the gateway whether the payment behind {@code reference} went through.
     * Returns empty if this gateway has no verify call.
     */
    default Optional<PollResult> verify(String reference) {
        return Optional.empty();
    }
}
