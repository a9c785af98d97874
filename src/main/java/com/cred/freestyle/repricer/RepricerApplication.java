package com.cred.freestyle.repricer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.kafka.annotation.EnableKafka;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Inventory-driven repricing engine.
 *
 * Consumes inventory and product webhooks from Kafka, evaluates the shop's active campaigns
 * against the changed variant and writes new prices back through the Shopify Admin API.
 *
 * Architecture:
 * - Messaging: webhook consumer, price-change publisher
 * - Engine: event processor, rule state machine, prioritization, pricing
 * - Stores: locks and cooldowns in PostgreSQL (default) or Redis
 * - Gateways: Shopify Admin GraphQL client, JPA audit trail
 * - Admin API: manual event submission, cooldown and rule-state inspection
 *
 * @author Repricer Team
 */
@SpringBootApplication
@EnableJpaRepositories
@EnableTransactionManagement
@EnableKafka
@EnableScheduling
public class RepricerApplication {

    public static void main(String[] args) {
        SpringApplication.run(RepricerApplication.class, args);
    }
}
