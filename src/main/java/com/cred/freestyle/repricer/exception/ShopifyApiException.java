package com.cred.freestyle.repricer.exception;

/**
 * Exception thrown when a call to the Shopify Admin API fails at the transport or protocol level
 * (connection error, non-2xx status, GraphQL top-level errors).
 *
 * @author Repricer Team
 */
public class ShopifyApiException extends RuntimeException {

    private final String shopDomain;
    private final String operation;

    public ShopifyApiException(String shopDomain, String operation, String message) {
        super(String.format("Shopify %s failed for %s: %s", operation, shopDomain, message));
        this.shopDomain = shopDomain;
        this.operation = operation;
    }

    public ShopifyApiException(String shopDomain, String operation, Throwable cause) {
        super(String.format("Shopify %s failed for %s: %s", operation, shopDomain, cause.getMessage()), cause);
        this.shopDomain = shopDomain;
        this.operation = operation;
    }

    public String getShopDomain() {
        return shopDomain;
    }

    public String getOperation() {
        return operation;
    }
}
