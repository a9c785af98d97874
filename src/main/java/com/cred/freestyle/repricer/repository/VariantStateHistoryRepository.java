package com.cred.freestyle.repricer.repository;

import com.cred.freestyle.repricer.domain.model.VariantStateHistory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for VariantStateHistory entity.
 *
 * @author Repricer Team
 */
@Repository
public interface VariantStateHistoryRepository extends JpaRepository<VariantStateHistory, String> {

    Optional<VariantStateHistory> findFirstByVariantIdOrderByCapturedAtDesc(String variantId);

    List<VariantStateHistory> findTop50ByVariantIdOrderByCapturedAtDesc(String variantId);
}
