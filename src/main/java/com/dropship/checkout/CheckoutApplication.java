package com.dropship.checkout;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for the dropship checkout service. Provides:
 * <ul>
 *   <li>Checkout through Paystack (redirect), OPay (mobile money) and Stripe Connect (payment intent)</li>
 *   <li>An order ledger keyed by the gateway payment reference, idempotent on draft creation</li>
 *   <li>Reconciliation of order status from verify calls and signed webhooks</li>
 *   <li>REST API and OpenAPI docs at /swagger-ui/index.html</li>
 * </ul>
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class CheckoutApplication {

    public static void main(String[] args) {
        SpringApplication.run(CheckoutApplication.class, args);
    }
}
