package com.dropship.checkout.core;

import com.dropship.checkout.api.ConfigurationException;
import com.dropship.checkout.api.UpstreamException;
import com.dropship.checkout.config.CheckoutProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Optional;

/**
 * Looks up the USD to NGN spot rate from exchangerate-api.com.
 * <p>
 * Every call is a fresh round trip unless {@code checkout.rates.cache-ttl} is positive, in
 * which case the rate is kept in Redis for that long. A Redis failure never fails the lookup;
 * it falls through to the live call. There is no retry.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExchangeRateService {

    static final String CACHE_KEY = "checkout:rates:USD:NGN";

    private final RestTemplate gatewayRestTemplate;
    private final StringRedisTemplate redisTemplate;
    private final CheckoutProperties properties;

    public BigDecimal getUsdToNgnRate() {
        CheckoutProperties.Rates rates = properties.getRates();
        if (rates.getApiKey() == null || rates.getApiKey().isBlank()) {
            throw new ConfigurationException("Missing exchange rate API key (checkout.rates.api-key)");
        }

        Duration ttl = rates.getCacheTtl();
        boolean cacheEnabled = ttl != null && !ttl.isZero() && !ttl.isNegative();
        if (cacheEnabled) {
            Optional<BigDecimal> cached = readCached();
            if (cached.isPresent()) {
                return cached.get();
            }
        }

        BigDecimal rate = fetchRate(rates);
        if (cacheEnabled) {
            writeCached(rate, ttl);
        }
        return rate;
    }

    private BigDecimal fetchRate(CheckoutProperties.Rates rates) {
        String url = rates.getBaseUrl() + "/" + rates.getApiKey() + "/latest/USD";
        JsonNode body;
        try {
            body = gatewayRestTemplate.getForObject(url, JsonNode.class);
        } catch (RestClientException e) {
            log.error("Exchange rate lookup failed: {}", e.getMessage());
            throw new UpstreamException("Exchange rate provider unavailable: " + e.getMessage(), e);
        }
        JsonNode ngn = body != null ? body.path("conversion_rates").path("NGN") : null;
        if (ngn == null || !ngn.isNumber() || ngn.decimalValue().signum() <= 0) {
            log.error("Exchange rate response has no usable conversion_rates.NGN field");
            throw new UpstreamException("Could not get NGN rate");
        }
        BigDecimal rate = ngn.decimalValue();
        log.debug("Fetched USD->NGN rate {}", rate);
        return rate;
    }

    private Optional<BigDecimal> readCached() {
        try {
            String value = redisTemplate.opsForValue().get(CACHE_KEY);
            if (value != null) {
                log.debug("USD->NGN rate served from cache: {}", value);
                return Optional.of(new BigDecimal(value));
            }
        } catch (Exception e) {
            log.warn("Rate cache read failed, falling back to live lookup: {}", e.getMessage());
        }
        return Optional.empty();
    }

    private void writeCached(BigDecimal rate, Duration ttl) {
        try {
            redisTemplate.opsForValue().set(CACHE_KEY, rate.toPlainString(), ttl);
        } catch (Exception e) {
            log.warn("Rate cache write failed: {}", e.getMessage());
        }
    }
}
