package com.cred.freestyle.repricer.api.controller;

import com.cred.freestyle.repricer.api.dto.RuleStateResponse;
import com.cred.freestyle.repricer.engine.ShopifyIds;
import com.cred.freestyle.repricer.repository.RuleExecutionStateRepository;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Read-only view of rule execution state.
 *
 * @author Repricer Team
 */
@RestController
@RequestMapping("/api/v1/rule-states")
public class RuleStateController {

    private final RuleExecutionStateRepository ruleStateRepository;

    public RuleStateController(RuleExecutionStateRepository ruleStateRepository) {
        this.ruleStateRepository = ruleStateRepository;
    }

    /**
     * Rule states for a variant, most recently updated first.
     *
     * @param variantId Numeric or global variant id
     */
    @GetMapping
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<List<RuleStateResponse>> getRuleStates(@RequestParam("variantId") String variantId) {
        String gid = ShopifyIds.toGid(ShopifyIds.PRODUCT_VARIANT, variantId);
        if (gid == null) {
            throw new IllegalArgumentException("variantId must not be blank");
        }
        List<RuleStateResponse> response = ruleStateRepository.findByVariantIdOrderByUpdatedAtDesc(gid).stream()
                .map(RuleStateResponse::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(response);
    }
}
