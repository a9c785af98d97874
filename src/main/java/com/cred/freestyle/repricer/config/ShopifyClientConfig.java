package com.cred.freestyle.repricer.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * HTTP client for the Shopify Admin API. The shop host is part of every request URI,
 * so the client carries timeouts only.
 *
 * @author Repricer Team
 */
@Configuration
public class ShopifyClientConfig {

    @Value("${repricer.shopify.connect-timeout-ms:5000}")
    private Integer connectTimeoutMs;

    @Value("${repricer.shopify.read-timeout-ms:10000}")
    private Integer readTimeoutMs;

    @Bean
    public RestClient shopifyRestClient() {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeoutMs);
        requestFactory.setReadTimeout(readTimeoutMs);
        return RestClient.builder()
                .requestFactory(requestFactory)
                .build();
    }
}
