package com.dropship.checkout.adapters;

import com.dropship.checkout.api.ConfigurationException;
import com.dropship.checkout.config.CheckoutProperties;
import com.stripe.exception.StripeException;
import com.stripe.model.PaymentIntent;
import com.stripe.net.RequestOptions;
import com.stripe.param.PaymentIntentCreateParams;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Thin wrapper over the static Stripe SDK calls. Each call carries its own API key and the
 * shared gateway timeouts; the SDK's network retries are turned off.
 */
@Component
@RequiredArgsConstructor
public class StripeIntentClient {

    private final CheckoutProperties properties;

    public PaymentIntent create(PaymentIntentCreateParams params) throws StripeException {
        return PaymentIntent.create(params, requestOptions());
    }

    public PaymentIntent retrieve(String paymentIntentId) throws StripeException {
        return PaymentIntent.retrieve(paymentIntentId, requestOptions());
    }

    private RequestOptions requestOptions() {
        String secretKey = properties.getStripe().getSecretKey();
        if (secretKey == null || secretKey.isBlank()) {
            throw new ConfigurationException("Missing Stripe secret key (checkout.stripe.secret-key)");
        }
        return RequestOptions.builder()
                .setApiKey(secretKey)
                .setConnectTimeout((int) properties.getHttp().getConnectTimeout().toMillis())
                .setReadTimeout((int) properties.getHttp().getReadTimeout().toMillis())
                .setMaxNetworkRetries(0)
                .build();
    }
}
