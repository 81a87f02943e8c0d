package com.dropship.checkout.config;

import com.dropship.checkout.domain.PricingCurrency;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Checkout configuration bound from {@code checkout.*}. Secrets come from the environment
 * (see application.yml); blank means "not configured" and the operation needing it fails
 * with a configuration error.
 */
@ConfigurationProperties(prefix = "checkout")
@Getter
@Setter
public class CheckoutProperties {

    private final Http http = new Http();
    private final Rates rates = new Rates();
    private final Shipping shipping = new Shipping();
    private final Paystack paystack = new Paystack();
    private final Opay opay = new Opay();
    private final Stripe stripe = new Stripe();
    private final Events events = new Events();

    @Getter
    @Setter
    public static class Http {
        private Duration connectTimeout = Duration.ofSeconds(15);
        private Duration readTimeout = Duration.ofSeconds(20);
    }

    @Getter
    @Setter
    public static class Rates {
        private String baseUrl = "https://v6.exchangerate-api.com/v6";
        private String apiKey = "";
        /**
         * How long a fetched USD/NGN rate may be served from Redis. Zero disables the cache,
         * so every lookup goes to the rate provider.
         */
        private Duration cacheTtl = Duration.ZERO;
    }

    @Getter
    @Setter
    public static class Shipping {
        /** Flat fee in kobo for regions not listed in {@link #fees}. */
        private long defaultFee = 3500;
        private Map<String, Long> fees = defaultFees();

        private static Map<String, Long> defaultFees() {
            Map<String, Long> fees = new LinkedHashMap<>();
            fees.put("Lagos", 2000L);
            fees.put("Abuja", 2500L);
            fees.put("Rivers", 3000L);
            fees.put("Kano", 2800L);
            fees.put("Kaduna", 2500L);
            fees.put("Oyo", 2200L);
            fees.put("Ogun", 2000L);
            fees.put("Enugu", 2700L);
            fees.put("Anambra", 2700L);
            return fees;
        }
    }

    @Getter
    @Setter
    public static class Paystack {
        private String baseUrl = "https://api.paystack.co";
        private String secretKey = "";
        private String callbackUrl = "";
        /** Currency cart prices arrive in. USD carts are converted at the live rate. */
        private PricingCurrency cartCurrency = PricingCurrency.NGN;
        private String defaultEmail = "guest@example.com";
    }

    @Getter
    @Setter
    public static class Opay {
        private String baseUrl = "";
        private String publicKey = "";
        private String secretKey = "";
        private String callbackUrl = "";
        private String returnUrl = "";
        private String country = "NG";
        private String payType = "WEB";
    }

    @Getter
    @Setter
    public static class Stripe {
        private String secretKey = "";
        private String webhookSecret = "";
        /** Connected account (acct_...) that receives the supplier share. */
        private String supplierAccount = "";
        private String currency = "usd";
    }

    @Getter
    @Setter
    public static class Events {
        private boolean enabled = true;
        private String topic = "order-events";
    }
}
