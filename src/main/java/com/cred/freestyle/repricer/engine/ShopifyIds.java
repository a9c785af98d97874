package com.cred.freestyle.repricer.engine;

/**
 * Conversions between numeric platform ids and global ids ("gid://shopify/{Type}/{id}").
 *
 * @author Repricer Team
 */
public final class ShopifyIds {

    public static final String PRODUCT = "Product";
    public static final String PRODUCT_VARIANT = "ProductVariant";
    public static final String INVENTORY_ITEM = "InventoryItem";
    public static final String COLLECTION = "Collection";

    private static final String GID_PREFIX = "gid://shopify/";

    private ShopifyIds() {
    }

    /**
     * @return Global id for the type; values that already are global ids are returned unchanged
     */
    public static String toGid(String type, String id) {
        if (id == null || id.isBlank()) {
            return null;
        }
        if (id.startsWith(GID_PREFIX)) {
            return id;
        }
        return GID_PREFIX + type + "/" + id.trim();
    }

    /**
     * @return Trailing numeric part of a global id, or the value itself if it is not a global id
     */
    public static String toNumeric(String id) {
        if (id == null) {
            return null;
        }
        if (!id.startsWith(GID_PREFIX)) {
            return id.trim();
        }
        String tail = id.substring(id.lastIndexOf('/') + 1);
        int query = tail.indexOf('?');
        return query >= 0 ? tail.substring(0, query) : tail;
    }

    /**
     * Compare two ids that may each be numeric or global.
     */
    public static boolean sameId(String a, String b) {
        if (a == null || b == null) {
            return false;
        }
        return toNumeric(a).equals(toNumeric(b));
    }
}
