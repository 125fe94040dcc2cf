package com.verticx.finance.fee;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface FeeTemplateRepository extends JpaRepository<FeeTemplate, Long> {
    List<FeeTemplate> findByBranchIdOrderByGradeLevelAsc(Long branchId);
}
