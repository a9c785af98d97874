package com.cred.freestyle.repricer.domain.model;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Embeddable;
import jakarta.persistence.FetchType;
import jakarta.persistence.JoinColumn;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashSet;
import java.util.Set;

/**
 * Which variants a campaign applies to. Lists are combined as a union: a variant matches when
 * any list matches it. A criteria object with every list empty matches all variants.
 *
 * Product and variant ids are platform global ids ("gid://shopify/Product/123").
 *
 * @author Repricer Team
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TargetCriteria {

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "campaign_target_products", joinColumns = @JoinColumn(name = "campaign_id"))
    @Column(name = "product_id", length = 255)
    @Builder.Default
    private Set<String> productIds = new HashSet<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "campaign_target_variants", joinColumns = @JoinColumn(name = "campaign_id"))
    @Column(name = "variant_id", length = 255)
    @Builder.Default
    private Set<String> variantIds = new HashSet<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "campaign_target_collections", joinColumns = @JoinColumn(name = "campaign_id"))
    @Column(name = "collection_id", length = 255)
    @Builder.Default
    private Set<String> collectionIds = new HashSet<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "campaign_target_tags", joinColumns = @JoinColumn(name = "campaign_id"))
    @Column(name = "tag", length = 255)
    @Builder.Default
    private Set<String> tags = new HashSet<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "campaign_target_vendors", joinColumns = @JoinColumn(name = "campaign_id"))
    @Column(name = "vendor", length = 255)
    @Builder.Default
    private Set<String> vendors = new HashSet<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "campaign_target_product_types", joinColumns = @JoinColumn(name = "campaign_id"))
    @Column(name = "product_type", length = 255)
    @Builder.Default
    private Set<String> productTypes = new HashSet<>();

    public boolean isEmpty() {
        return isBlank(productIds) && isBlank(variantIds) && isBlank(collectionIds)
                && isBlank(tags) && isBlank(vendors) && isBlank(productTypes);
    }

    private static boolean isBlank(Set<String> values) {
        return values == null || values.isEmpty();
    }
}
