package com.cred.freestyle.repricer.engine;

import com.cred.freestyle.repricer.domain.model.Campaign;
import com.cred.freestyle.repricer.domain.model.TargetCriteria;
import com.cred.freestyle.repricer.gateway.VariantSnapshot;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;

/**
 * Decides whether a campaign's target criteria cover a variant.
 * Criteria lists are OR-ed; empty criteria match every variant.
 *
 * @author Repricer Team
 */
@Component
public class TargetMatcher {

    public boolean matches(Campaign campaign, VariantSnapshot variant) {
        TargetCriteria criteria = campaign.getTargetCriteria();
        if (criteria == null || criteria.isEmpty()) {
            return true;
        }

        return containsId(criteria.getProductIds(), variant.getProductId())
                || containsId(criteria.getVariantIds(), variant.getVariantId())
                || anyId(criteria.getCollectionIds(), variant.getCollectionIds())
                || anyIgnoreCase(criteria.getTags(), variant.getTags())
                || containsIgnoreCase(criteria.getVendors(), variant.getVendor())
                || containsIgnoreCase(criteria.getProductTypes(), variant.getProductType());
    }

    private static boolean containsId(Collection<String> ids, String id) {
        if (ids == null || id == null) {
            return false;
        }
        for (String candidate : ids) {
            if (ShopifyIds.sameId(candidate, id)) {
                return true;
            }
        }
        return false;
    }

    private static boolean anyId(Collection<String> ids, Set<String> variantIds) {
        if (variantIds == null) {
            return false;
        }
        for (String id : variantIds) {
            if (containsId(ids, id)) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsIgnoreCase(Collection<String> values, String value) {
        if (values == null || value == null) {
            return false;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (String candidate : values) {
            if (candidate != null && candidate.trim().toLowerCase(Locale.ROOT).equals(normalized)) {
                return true;
            }
        }
        return false;
    }

    private static boolean anyIgnoreCase(Collection<String> values, Set<String> variantValues) {
        if (variantValues == null) {
            return false;
        }
        for (String value : variantValues) {
            if (containsIgnoreCase(values, value)) {
                return true;
            }
        }
        return false;
    }
}
