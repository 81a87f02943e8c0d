package com.dropship.checkout.api;

import com.dropship.checkout.api.dto.OrderDto;
import com.dropship.checkout.core.ExchangeRateService;
import com.dropship.checkout.core.OrderLedger;
import com.dropship.checkout.core.ProductCatalog;
import com.dropship.checkout.domain.Product;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Read-only storefront endpoints.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Store", description = "Rates, catalog and orders")
public class StoreController {

    private final ExchangeRateService exchangeRateService;
    private final OrderLedger ledger;
    private final ProductCatalog productCatalog;
    private final Clock clock;

    @GetMapping("/rates")
    @Operation(summary = "Current USD to NGN rate")
    public ResponseEntity<Map<String, Object>> rates() {
        BigDecimal ngn = exchangeRateService.getUsdToNgnRate();
        Map<String, Object> rates = new LinkedHashMap<>();
        rates.put("USD", BigDecimal.ONE);
        rates.put("NGN", ngn);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("rates", rates);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/orders")
    @Operation(summary = "All orders, newest first")
    public ResponseEntity<Map<String, Object>> orders() {
        List<OrderDto> orders = ledger.listOrders().stream()
                .map(OrderDto::from)
                .collect(Collectors.toList());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("orders", orders);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/products")
    @Operation(summary = "Catalog with naira prices at the live rate")
    public ResponseEntity<Map<String, Object>> products() {
        List<Product> products = productCatalog.getProductsWithLivePricing();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("products", products);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/health")
    @Operation(summary = "Liveness probe")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ok", true);
        body.put("time", Instant.now(clock).toString());
        return ResponseEntity.ok(body);
    }
}
