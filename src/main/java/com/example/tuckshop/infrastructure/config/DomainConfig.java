package com.example.tuckshop.infrastructure.config;

import com.example.tuckshop.domain.service.OrderTransitionPolicy;
import com.example.tuckshop.domain.service.StockLedger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Registers the framework-free domain services as beans.
 */
@Configuration
public class DomainConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public StockLedger stockLedger() {
        return new StockLedger();
    }

    @Bean
    public OrderTransitionPolicy orderTransitionPolicy() {
        return new OrderTransitionPolicy();
    }
}
