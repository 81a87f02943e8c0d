package com.dropship.checkout.persistence.service;

import com.dropship.checkout.core.OrderLedger;
import com.dropship.checkout.persistence.repository.OrderRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;

class OrderLedgerSelectionTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withBean(ObjectMapper.class)
            .withBean(Clock.class, Clock::systemUTC)
            .withBean(OrderRepository.class, () -> Mockito.mock(OrderRepository.class))
            .withUserConfiguration(InMemoryOrderLedger.class, JpaOrderLedger.class);

    @Test
    void memoryTypeSelectsInMemoryLedger() {
        contextRunner.withPropertyValues("checkout.ledger.type=memory").run(context -> {
            assertThat(context).hasSingleBean(OrderLedger.class);
            assertThat(context.getBean(OrderLedger.class)).isInstanceOf(InMemoryOrderLedger.class);
        });
    }

    @Test
    void jpaLedgerIsDefault() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(OrderLedger.class);
            assertThat(context.getBean(OrderLedger.class)).isInstanceOf(JpaOrderLedger.class);
        });
    }
}
