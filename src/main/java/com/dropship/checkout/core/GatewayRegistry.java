package com.dropship.checkout.core;

import com.dropship.checkout.api.ConfigurationException;
import com.dropship.checkout.api.UpstreamException;
import com.dropship.checkout.api.ValidationException;
import com.dropship.checkout.domain.GatewayType;
import com.stripe.exception.StripeException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Looks up gateway adapters by type and runs their calls inside a per-adapter circuit breaker.
 * Calls are never retried.
 * <p>
 * Only gateway faults count against the breaker: transport errors, 5xx and 429. Other 4xx
 * answers (unknown reference, rejected parameter) are not recorded.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GatewayRegistry {

    private final List<GatewayAdapter> adapters;
    private final CircuitBreakerRegistry circuitBreakerRegistry;

    private Map<GatewayType, GatewayAdapter> adapterByType;

    @PostConstruct
    void init() {
        adapterByType = new EnumMap<>(GatewayType.class);
        for (GatewayAdapter adapter : adapters) {
            GatewayAdapter previous = adapterByType.putIfAbsent(adapter.getGatewayType(), adapter);
            if (previous != null) {
                log.warn("Two adapters for gateway {}: keeping {}, ignoring {}",
                        adapter.getGatewayType(), previous.getAdapterName(), adapter.getAdapterName());
            }
        }
        log.info("Registered gateway adapters: {}", adapterByType.keySet());
    }

    public GatewayAdapter adapterFor(GatewayType type) {
        GatewayAdapter adapter = adapterByType.get(type);
        if (adapter == null) {
            throw new ConfigurationException("No adapter registered for gateway " + type);
        }
        return adapter;
    }

    /**
     * Runs {@code call} through the adapter's circuit breaker. An open breaker rejects the call
     * without touching the gateway and surfaces as {@link UpstreamException}.
     */
    public <T> T invoke(GatewayAdapter adapter, Supplier<T> call) {
        CircuitBreaker circuitBreaker = circuitBreakerRegistry.circuitBreaker(adapter.getAdapterName(),
                () -> CircuitBreakerConfig.from(circuitBreakerRegistry.getDefaultConfig())
                        .recordException(GatewayRegistry::isGatewayFault)
                        .build());
        try {
            return CircuitBreaker.decorateSupplier(circuitBreaker, call).get();
        } catch (CallNotPermittedException e) {
            log.warn("Circuit open for gateway adapter={}, rejecting call", adapter.getAdapterName());
            throw new UpstreamException(adapter.getGatewayType() + " is temporarily unavailable", e);
        }
    }

    static boolean isGatewayFault(Throwable error) {
        if (error instanceof ValidationException || error instanceof ConfigurationException) {
            return false;
        }
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof HttpClientErrorException) {
                return isFaultStatus(((HttpClientErrorException) t).getStatusCode().value());
            }
            if (t instanceof StripeException && ((StripeException) t).getStatusCode() != null) {
                return isFaultStatus(((StripeException) t).getStatusCode());
            }
        }
        return true;
    }

    private static boolean isFaultStatus(int httpStatus) {
        return httpStatus < 400 || httpStatus >= 500 || httpStatus == HttpStatus.TOO_MANY_REQUESTS.value();
    }
}
