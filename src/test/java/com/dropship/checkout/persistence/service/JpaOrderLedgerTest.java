package com.dropship.checkout.persistence.service;

import com.dropship.checkout.config.ClockConfig;
import com.dropship.checkout.domain.CartItem;
import com.dropship.checkout.domain.Customer;
import com.dropship.checkout.domain.DraftOrder;
import com.dropship.checkout.domain.GatewayType;
import com.dropship.checkout.domain.Order;
import com.dropship.checkout.domain.OrderStatus;
import com.dropship.checkout.persistence.repository.OrderRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Ledger against a real PostgreSQL, so ON CONFLICT and the conditional update run for real.
 * Skipped when Docker is not available.
 */
@Tag("integration")
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import({JpaOrderLedger.class, ClockConfig.class, JpaOrderLedgerTest.JsonConfig.class})
@Testcontainers(disabledWithoutDocker = true)
class JpaOrderLedgerTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine");

    @DynamicPropertySource
    static void datasourceProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.sql.init.mode", () -> "always");
    }

    @TestConfiguration
    static class JsonConfig {
        @Bean
        ObjectMapper objectMapper() {
            return new ObjectMapper();
        }
    }

    @Autowired
    private JpaOrderLedger ledger;

    @Autowired
    private OrderRepository orderRepository;

    @Test
    void createDraftThenFind() {
        String localOrderId = ledger.createDraft(draft("pi_1"));

        Order order = ledger.findByReference("pi_1").orElseThrow();
        assertThat(order.getLocalOrderId()).isEqualTo(localOrderId);
        assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING);
        assertThat(order.getGateway()).isEqualTo(GatewayType.STRIPE);
        assertThat(order.getTotalMinorUsd()).isEqualTo(2000L);
        assertThat(order.getProfitMinor()).isEqualTo(800L);
        assertThat(order.getCustomer().getPhone()).isEmpty();
        assertThat(order.getItemsJson()).contains("\"sku\":\"SKU-1\"");
    }

    @Test
    void duplicateReferenceKeepsFirstRow() {
        String first = ledger.createDraft(draft("pi_1"));
        String second = ledger.createDraft(draft("pi_1"));

        assertThat(second).isEqualTo(first);
        assertThat(orderRepository.count()).isEqualTo(1L);
    }

    @Test
    void transitionsOnlyFromPending() {
        ledger.createDraft(draft("pi_1"));

        assertThat(ledger.markPaid("pi_1")).isTrue();
        assertThat(ledger.markFailed("pi_1")).isFalse();
        assertThat(ledger.markPaid("unknown")).isFalse();

        Order order = ledger.findByReference("pi_1").orElseThrow();
        assertThat(order.getStatus()).isEqualTo(OrderStatus.PAID);
        assertThat(order.getProcessedAt()).isNotNull();
    }

    @Test
    void listOrdersNewestFirst() throws InterruptedException {
        ledger.createDraft(draft("pi_old"));
        Thread.sleep(5);
        ledger.createDraft(draft("pi_new"));

        assertThat(ledger.listOrders()).extracting(Order::getPaymentReference)
                .containsExactly("pi_new", "pi_old");
    }

    @Test
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    void concurrentDraftsInsertOneRow() throws Exception {
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<String>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                Callable<String> task = () -> {
                    start.await();
                    return ledger.createDraft(draft("pi_race"));
                };
                results.add(pool.submit(task));
            }
            start.countDown();
            Set<String> ids = new HashSet<>();
            for (Future<String> result : results) {
                ids.add(result.get(30, TimeUnit.SECONDS));
            }
            assertThat(ids).hasSize(1);
            assertThat(orderRepository.count()).isEqualTo(1L);
        } finally {
            pool.shutdownNow();
            orderRepository.deleteAll();
        }
    }

    private static DraftOrder draft(String reference) {
        return DraftOrder.builder()
                .paymentReference(reference)
                .gateway(GatewayType.STRIPE)
                .customer(Customer.of("Ada", "ada@example.com", null, null, "Lagos"))
                .items(List.of(CartItem.builder().id("p1").price(new BigDecimal("10.00"))
                        .supplierCost(new BigDecimal("6.00")).quantity(2).sku("SKU-1").build()))
                .totalMinorUsd(2000L)
                .supplierShareMinor(1200L)
                .profitMinor(800L)
                .build();
    }
}
